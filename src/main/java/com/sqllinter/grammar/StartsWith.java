package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 以给定语法开头，然后贪婪地消费到终止符（可选包含终止符）。
 *
 * <p>只确定边界，不解析内部：返回的是原始段，内部留给解析阶段，这是匹配/解析两阶段划分的关键。
 */
public final class StartsWith extends BaseGrammar<StartsWith> {
    private final Grammar head;
    /** 终止符，默认无：消费到输入末尾 */
    private Grammar terminator;
    /** 是否把终止符包含进匹配结果，默认 false */
    private boolean includeTerminator;

    private StartsWith(Grammar head) {
        this.head = Objects.requireNonNull(head, "head");
    }

    private StartsWith(StartsWith other) {
        super(other);
        this.head = other.head;
        this.terminator = other.terminator;
        this.includeTerminator = other.includeTerminator;
    }

    public static StartsWith of(Grammar head) {
        return new StartsWith(head);
    }

    public StartsWith terminator(Grammar newTerminator) {
        StartsWith copy = copy();
        copy.terminator = newTerminator;
        return copy;
    }

    public StartsWith includeTerminator(boolean include) {
        StartsWith copy = copy();
        copy.includeTerminator = include;
        return copy;
    }

    @Override
    protected StartsWith copy() {
        return new StartsWith(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        int first = isCodeOnly() ? SegmentScan.firstCodeIndex(segments, 0) : 0;
        if (first < 0 || first >= segments.size()) {
            return MatchResult.noMatch(segments);
        }
        List<Segment> candidate = segments.subList(first, segments.size());
        MatchResult headMatch = head.match(candidate, context);
        if (!headMatch.hasMatch()) {
            return MatchResult.noMatch(segments);
        }

        int end = segments.size();
        if (terminator != null) {
            int afterHead = first + headMatch.consumedFrom(candidate);
            // 包含终止符时按开闭对计数，嵌套的同类结构不会提前结束
            Lookahead.Nesting nesting = includeTerminator ? new Lookahead.Nesting(head, terminator) : null;
            Lookahead.Hit hit = Lookahead.find(segments, afterHead, terminator, nesting, context);
            if (hit != null) {
                end = includeTerminator ? hit.end() : hit.index();
            }
        }
        if (!includeTerminator || terminator == null) {
            end = SegmentScan.trimTrailingNonCode(segments, end);
        }
        return MatchResult.of(new ArrayList<>(segments.subList(0, end)), segments.subList(end, segments.size()));
    }

    @Override
    public String describe() {
        return "StartsWith(" + head.describe() + ")";
    }
}
