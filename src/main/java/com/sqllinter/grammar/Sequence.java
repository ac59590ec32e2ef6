package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按顺序匹配全部子语法，任一必需元素失败则整体失败。
 */
public final class Sequence extends BaseGrammar<Sequence> {
    private final List<Grammar> elements;

    private Sequence(List<Grammar> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Sequence 至少需要一个元素");
        }
        this.elements = List.copyOf(elements);
    }

    private Sequence(Sequence other) {
        super(other);
        this.elements = other.elements;
    }

    public static Sequence of(Grammar... elements) {
        return new Sequence(Arrays.asList(elements));
    }

    @Override
    protected Sequence copy() {
        return new Sequence(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        List<Segment> matched = new ArrayList<>();
        List<Segment> unmatched = segments;

        for (int elementIndex = 0; elementIndex < elements.size(); elementIndex++) {
            Grammar element = elements.get(elementIndex);
            if (element instanceof Meta meta) {
                matched.add(meta.create(SegmentScan.positionAt(matched, unmatched)));
                continue;
            }
            int skip = isCodeOnly() ? leadingNonCode(unmatched) : 0;
            if (skip == unmatched.size()) {
                // 输入耗尽：只剩可选元素时保留已匹配部分
                if (!remainingOptional(elementIndex)) {
                    return MatchResult.noMatch(segments);
                }
                for (int rest = elementIndex; rest < elements.size(); rest++) {
                    if (elements.get(rest) instanceof Meta meta) {
                        matched.add(meta.create(SegmentScan.positionAt(matched, unmatched)));
                    }
                }
                break;
            }
            List<Segment> candidate = unmatched.subList(skip, unmatched.size());
            MatchResult elementMatch = element.match(candidate, context);
            if (elementMatch.hasMatch()) {
                matched.addAll(unmatched.subList(0, skip));
                matched.addAll(elementMatch.matched());
                unmatched = elementMatch.unmatched();
            } else if (!element.isOptional()) {
                return MatchResult.noMatch(segments);
            }
        }

        if (!SegmentScan.hasCode(matched)) {
            return MatchResult.noMatch(segments);
        }
        if (isCodeOnly()) {
            int skip = leadingNonCode(unmatched);
            matched.addAll(unmatched.subList(0, skip));
            unmatched = unmatched.subList(skip, unmatched.size());
        }
        return MatchResult.of(matched, unmatched);
    }

    private boolean remainingOptional(int fromIndex) {
        for (int index = fromIndex; index < elements.size(); index++) {
            Grammar element = elements.get(index);
            if (!(element instanceof Meta) && !element.isOptional()) {
                return false;
            }
        }
        return true;
    }

    private static int leadingNonCode(List<Segment> segments) {
        int first = SegmentScan.firstCodeIndex(segments, 0);
        return first < 0 ? segments.size() : first;
    }

    @Override
    public String describe() {
        return elements.stream().map(Grammar::describe).collect(Collectors.joining(", ", "Sequence(", ")"));
    }
}
