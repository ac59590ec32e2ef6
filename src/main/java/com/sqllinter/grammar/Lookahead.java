package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 对括号敏感的前瞻：寻找终止符第一次出现的位置，括号内部的出现不计。
 */
final class Lookahead {

    /**
     * 终止符命中的位置与该处的匹配结果。
     */
    record Hit(int index, int end, MatchResult match) {
    }

    /**
     * 额外的开闭对（如 CASE ... END），开闭对内部的终止符同样不计。
     */
    record Nesting(Grammar opener, Grammar closer) {
    }

    private Lookahead() {
    }

    /**
     * 从 from 开始查找 terminator，只在代码段上尝试。
     */
    static Hit find(List<Segment> segments, int from, Grammar terminator, Nesting nesting, ParseContext context) {
        int depth = 0;
        int index = from;
        while (index < segments.size()) {
            Segment current = segments.get(index);
            if (!current.isCode()) {
                index++;
                continue;
            }
            List<Segment> tail = segments.subList(index, segments.size());
            if (depth == 0) {
                MatchResult terminatorMatch = terminator.match(tail, context);
                if (terminatorMatch.hasMatch()) {
                    return new Hit(index, index + terminatorMatch.consumedFrom(tail), terminatorMatch);
                }
            } else {
                MatchResult closerMatch = nesting.closer().match(tail, context);
                if (closerMatch.hasMatch()) {
                    depth--;
                    index += closerMatch.consumedFrom(tail);
                    continue;
                }
            }
            if (nesting != null) {
                MatchResult openerMatch = nesting.opener().match(tail, context);
                if (openerMatch.hasMatch()) {
                    depth++;
                    index += openerMatch.consumedFrom(tail);
                    continue;
                }
            }
            if (SegmentScan.isOpenBracket(current)) {
                int close = SegmentScan.findClosingBracket(segments, index);
                // 括号不平衡时后续内容都视为括号内部
                index = close < 0 ? segments.size() : close + 1;
                continue;
            }
            index++;
        }
        return null;
    }
}
