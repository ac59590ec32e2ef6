package com.sqllinter.grammar;

import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 左括号、内部语法、配对的右括号。
 *
 * <p>括号不平衡是硬失败，绝不返回部分结果。内部为空时只有内部语法标记为可选才算成功。
 */
public final class Bracketed extends BaseGrammar<Bracketed> {
    public static final String START_BRACKET = "start_bracket";
    public static final String END_BRACKET = "end_bracket";

    private final Grammar inner;

    private Bracketed(Grammar inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    private Bracketed(Bracketed other) {
        super(other);
        this.inner = other.inner;
    }

    public static Bracketed of(Grammar inner) {
        return new Bracketed(inner);
    }

    /**
     * 内部不做约束。
     */
    public static Bracketed anything() {
        return new Bracketed(Anything.create());
    }

    @Override
    protected Bracketed copy() {
        return new Bracketed(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        int open = isCodeOnly() ? SegmentScan.firstCodeIndex(segments, 0) : 0;
        if (open < 0 || open >= segments.size() || !SegmentScan.isOpenBracket(segments.get(open))) {
            return MatchResult.noMatch(segments);
        }
        int close = SegmentScan.findClosingBracket(segments, open);
        if (close < 0) {
            return MatchResult.noMatch(segments);
        }

        List<Segment> content = segments.subList(open + 1, close);
        int contentStart = isCodeOnly() ? SegmentScan.firstCodeIndex(content, 0) : 0;
        int contentEnd = isCodeOnly() ? SegmentScan.lastCodeIndex(content) + 1 : content.size();

        List<Segment> matched = new ArrayList<>(segments.subList(0, open));
        matched.add(((RawSegment) segments.get(open)).retag(START_BRACKET, START_BRACKET));
        if (contentStart < 0 || contentStart >= contentEnd) {
            if (!inner.isOptional()) {
                return MatchResult.noMatch(segments);
            }
            matched.add(Meta.INDENT.create(segments.get(close).position()));
            matched.addAll(content);
        } else {
            MatchResult innerMatch = inner.match(content.subList(contentStart, contentEnd), context);
            if (!innerMatch.hasMatch() || !innerMatch.isComplete()) {
                return MatchResult.noMatch(segments);
            }
            matched.addAll(content.subList(0, contentStart));
            matched.add(Meta.INDENT.create(content.get(contentStart).position()));
            matched.addAll(innerMatch.matched());
            matched.addAll(content.subList(contentEnd, content.size()));
        }
        matched.add(Meta.DEDENT.create(segments.get(close).position()));
        matched.add(((RawSegment) segments.get(close)).retag(END_BRACKET, END_BRACKET));
        return MatchResult.of(matched, segments.subList(close + 1, segments.size()));
    }

    @Override
    public String describe() {
        return "Bracketed(" + inner.describe() + ")";
    }
}
