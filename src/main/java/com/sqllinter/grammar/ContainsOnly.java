package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;
import java.util.Set;

/**
 * 仅当区间内每个段的类型（或名称）都属于允许集合时成功，消费整个区间。
 */
public final class ContainsOnly extends BaseGrammar<ContainsOnly> {
    private final Set<String> allowed;

    private ContainsOnly(Set<String> allowed) {
        this.allowed = Set.copyOf(allowed);
    }

    private ContainsOnly(ContainsOnly other) {
        super(other);
        this.allowed = other.allowed;
    }

    public static ContainsOnly of(String... types) {
        return new ContainsOnly(Set.of(types));
    }

    @Override
    protected ContainsOnly copy() {
        return new ContainsOnly(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty()) {
            return MatchResult.noMatch(segments);
        }
        for (Segment segment : segments) {
            if (isCodeOnly() && !segment.isCode()) {
                continue;
            }
            if (!allowed.contains(segment.type()) && !allowed.contains(segment.name())) {
                return MatchResult.noMatch(segments);
            }
        }
        return MatchResult.of(List.copyOf(segments), List.of());
    }

    @Override
    public String describe() {
        return "ContainsOnly" + allowed;
    }
}
