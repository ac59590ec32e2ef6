package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 匹配全部剩余段。
 */
public final class Anything extends BaseGrammar<Anything> {

    private Anything() {
    }

    private Anything(Anything other) {
        super(other);
    }

    public static Anything create() {
        return new Anything();
    }

    @Override
    protected Anything copy() {
        return new Anything(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty()) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(List.copyOf(segments), List.of());
    }

    @Override
    public String describe() {
        return "Anything";
    }
}
