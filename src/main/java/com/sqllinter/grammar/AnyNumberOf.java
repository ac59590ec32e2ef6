package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任意顺序出现零次或多次的子语法，每次取第一个成功的分支。
 */
public final class AnyNumberOf extends BaseGrammar<AnyNumberOf> {
    private final List<Grammar> options;
    /** 至少出现次数，默认 0 */
    private int minTimes;
    /** 至多出现次数，默认不限（0 表示不限） */
    private int maxTimes;

    private AnyNumberOf(List<Grammar> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("AnyNumberOf 至少需要一个分支");
        }
        this.options = List.copyOf(options);
    }

    private AnyNumberOf(AnyNumberOf other) {
        super(other);
        this.options = other.options;
        this.minTimes = other.minTimes;
        this.maxTimes = other.maxTimes;
    }

    public static AnyNumberOf of(Grammar... options) {
        return new AnyNumberOf(Arrays.asList(options));
    }

    public AnyNumberOf minTimes(int times) {
        AnyNumberOf copy = copy();
        copy.minTimes = times;
        return copy;
    }

    public AnyNumberOf maxTimes(int times) {
        AnyNumberOf copy = copy();
        copy.maxTimes = times;
        return copy;
    }

    @Override
    protected AnyNumberOf copy() {
        return new AnyNumberOf(this);
    }

    /**
     * 下限为 0 时天然可选。
     */
    @Override
    public boolean isOptional() {
        return super.isOptional() || minTimes == 0;
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        List<Segment> matched = new ArrayList<>();
        List<Segment> unmatched = segments;
        int times = 0;
        while (maxTimes <= 0 || times < maxTimes) {
            int skip = 0;
            if (isCodeOnly()) {
                int first = SegmentScan.firstCodeIndex(unmatched, 0);
                skip = first < 0 ? unmatched.size() : first;
            }
            if (skip >= unmatched.size()) {
                break;
            }
            MatchResult occurrence = matchAnyOption(unmatched.subList(skip, unmatched.size()), context);
            if (!occurrence.hasMatch()) {
                break;
            }
            matched.addAll(unmatched.subList(0, skip));
            matched.addAll(occurrence.matched());
            unmatched = occurrence.unmatched();
            times++;
        }
        if (times < minTimes || times == 0) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(matched, unmatched);
    }

    private MatchResult matchAnyOption(List<Segment> segments, ParseContext context) {
        for (Grammar option : options) {
            MatchResult result = option.match(segments, context);
            if (result.hasMatch()) {
                return result;
            }
        }
        return MatchResult.noMatch(segments);
    }

    @Override
    public String describe() {
        return options.stream().map(Grammar::describe).collect(Collectors.joining(", ", "AnyNumberOf(", ")"));
    }
}
