package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * 消费到第一个终止符之前（默认不含终止符），用于在细致解析前预先切分区域。
 */
public final class GreedyUntil extends BaseGrammar<GreedyUntil> {
    private final Grammar terminator;
    /** 是否把终止符包含进匹配结果，默认 false */
    private boolean includeTerminator;
    /** 跳过的嵌套开闭对，默认无 */
    private Lookahead.Nesting nesting;

    private GreedyUntil(Grammar terminator) {
        this.terminator = terminator;
    }

    private GreedyUntil(GreedyUntil other) {
        super(other);
        this.terminator = other.terminator;
        this.includeTerminator = other.includeTerminator;
        this.nesting = other.nesting;
    }

    /**
     * 任一终止符出现即停止。
     */
    public static GreedyUntil of(Grammar... terminators) {
        if (terminators.length == 0) {
            throw new IllegalArgumentException("GreedyUntil 至少需要一个终止符");
        }
        Grammar terminator = terminators.length == 1 ? terminators[0] : OneOf.of(terminators);
        return new GreedyUntil(terminator);
    }

    public GreedyUntil includeTerminator(boolean include) {
        GreedyUntil copy = copy();
        copy.includeTerminator = include;
        return copy;
    }

    /**
     * 跳过 opener ... closer 包围的嵌套区域，其中出现的终止符不计。
     */
    public GreedyUntil skipNested(Grammar opener, Grammar closer) {
        GreedyUntil copy = copy();
        copy.nesting = new Lookahead.Nesting(opener, closer);
        return copy;
    }

    @Override
    protected GreedyUntil copy() {
        return new GreedyUntil(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        Lookahead.Hit hit = Lookahead.find(segments, 0, terminator, nesting, context);
        int end;
        if (hit == null) {
            end = segments.size();
        } else {
            end = includeTerminator ? hit.end() : hit.index();
        }
        if (isCodeOnly() && (hit == null || !includeTerminator)) {
            end = SegmentScan.trimTrailingNonCode(segments, end);
        }
        if (end == 0) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(new ArrayList<>(segments.subList(0, end)), segments.subList(end, segments.size()));
    }

    @Override
    public String describe() {
        return "GreedyUntil(" + terminator.describe() + ")";
    }
}
