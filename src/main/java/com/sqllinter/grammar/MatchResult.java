package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 一次匹配的结果：已匹配（可能已重组）的段与剩余未匹配的后缀。
 *
 * <p>不变量：matched 的原文拼接加上 unmatched 的原文拼接等于输入原文。
 */
public record MatchResult(List<Segment> matched, List<Segment> unmatched) {

    public static MatchResult of(List<Segment> matched, List<Segment> unmatched) {
        return new MatchResult(matched, unmatched);
    }

    public static MatchResult noMatch(List<Segment> segments) {
        return new MatchResult(List.of(), segments);
    }

    /**
     * 只包含零宽标记的结果不算匹配。
     */
    public boolean hasMatch() {
        for (Segment segment : matched) {
            if (!segment.isMeta()) {
                return true;
            }
        }
        return false;
    }

    public boolean isComplete() {
        return unmatched.isEmpty();
    }

    /**
     * 相对输入消费的段数。
     */
    public int consumedFrom(List<Segment> input) {
        return input.size() - unmatched.size();
    }
}
