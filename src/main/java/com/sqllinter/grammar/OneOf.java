package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按声明顺序尝试各分支，取第一个成功的分支。
 *
 * <p>不做最长匹配：一旦某个分支成功，其余分支不再尝试；被选中的分支在后续解析阶段失败时，
 * 也不会回退到兄弟分支。
 */
public final class OneOf extends BaseGrammar<OneOf> {
    private final List<Grammar> options;

    private OneOf(List<Grammar> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("OneOf 至少需要一个分支");
        }
        this.options = List.copyOf(options);
    }

    private OneOf(OneOf other) {
        super(other);
        this.options = other.options;
    }

    public static OneOf of(Grammar... options) {
        return new OneOf(Arrays.asList(options));
    }

    @Override
    protected OneOf copy() {
        return new OneOf(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
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
        return options.stream().map(Grammar::describe).collect(Collectors.joining(" | ", "OneOf(", ")"));
    }
}
