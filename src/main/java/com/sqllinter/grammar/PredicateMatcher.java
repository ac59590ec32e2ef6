package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 以任意谓词检查第一个段，命中时原样返回该段，主要用作终止符。
 */
public final class PredicateMatcher extends BaseGrammar<PredicateMatcher> {
    private final String label;
    private final Predicate<Segment> predicate;

    private PredicateMatcher(String label, Predicate<Segment> predicate) {
        this.label = Objects.requireNonNull(label, "label");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    private PredicateMatcher(PredicateMatcher other) {
        super(other);
        this.label = other.label;
        this.predicate = other.predicate;
    }

    public static PredicateMatcher of(String label, Predicate<Segment> predicate) {
        return new PredicateMatcher(label, predicate);
    }

    @Override
    protected PredicateMatcher copy() {
        return new PredicateMatcher(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty() || !predicate.test(segments.get(0))) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(List.of(segments.get(0)), segments.subList(1, segments.size()));
    }

    @Override
    public String describe() {
        return label;
    }
}
