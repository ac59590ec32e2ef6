package com.sqllinter.grammar;

import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 具名段定义：匹配语法确定边界并包装成带类型的复合段，解析语法（可选）负责细化内部结构。
 *
 * <p>没有解析语法时，匹配阶段得到的结构即为最终结构，解析阶段只递归展开子段。
 *
 * @param name         在方言中注册的名称
 * @param type         产出复合段的语义类型
 * @param matchGrammar 边界匹配语法，应尽量廉价
 * @param parseGrammar 内部解析语法，可为 null
 */
public record SegmentDefinition(String name, String type, Grammar matchGrammar, Grammar parseGrammar)
        implements Grammar {

    public SegmentDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(matchGrammar, "matchGrammar");
    }

    public static SegmentDefinition of(String name, String type, Grammar matchGrammar) {
        return new SegmentDefinition(name, type, matchGrammar, null);
    }

    public static SegmentDefinition of(String name, String type, Grammar matchGrammar, Grammar parseGrammar) {
        return new SegmentDefinition(name, type, matchGrammar, parseGrammar);
    }

    /**
     * 继承解析语法与类型，仅替换匹配语法，得到一个新名称的段定义。
     */
    public SegmentDefinition withMatchGrammar(String newName, Grammar newMatchGrammar) {
        return new SegmentDefinition(newName, type, newMatchGrammar, parseGrammar);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty()) {
            return MatchResult.noMatch(segments);
        }
        if (segments.get(0) instanceof CompositeSegment composite && composite.name().equals(name)) {
            return MatchResult.of(List.of(composite), segments.subList(1, segments.size()));
        }
        MatchResult result = matchGrammar.match(segments, context);
        if (!result.hasMatch()) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(wrap(result.matched()), result.unmatched());
    }

    /**
     * 包装为 MATCHED 状态的复合段，首尾的非代码段留在段外。
     */
    private List<Segment> wrap(List<Segment> matched) {
        int first = SegmentScan.firstCodeIndex(matched, 0);
        if (first < 0) {
            return List.of(new CompositeSegment(type, name, matched, CompositeSegment.State.MATCHED));
        }
        int last = SegmentScan.lastCodeIndex(matched);
        List<Segment> wrapped = new ArrayList<>(matched.subList(0, first));
        wrapped.add(new CompositeSegment(type, name, matched.subList(first, last + 1), CompositeSegment.State.MATCHED));
        wrapped.addAll(matched.subList(last + 1, matched.size()));
        return wrapped;
    }

    @Override
    public boolean isOptional() {
        return false;
    }

    @Override
    public String describe() {
        return name;
    }
}
