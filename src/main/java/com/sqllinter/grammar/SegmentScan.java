package com.sqllinter.grammar;

import com.sqllinter.segment.FilePosition;
import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 组合子共用的段扫描工具：非代码段裁剪与括号配对。
 */
final class SegmentScan {
    static final String OPEN_BRACKET = "(";
    static final String CLOSE_BRACKET = ")";

    private SegmentScan() {
    }

    static int firstCodeIndex(List<Segment> segments, int from) {
        for (int index = from; index < segments.size(); index++) {
            if (segments.get(index).isCode()) {
                return index;
            }
        }
        return -1;
    }

    static int lastCodeIndex(List<Segment> segments) {
        for (int index = segments.size() - 1; index >= 0; index--) {
            if (segments.get(index).isCode()) {
                return index;
            }
        }
        return -1;
    }

    static boolean hasCode(List<Segment> segments) {
        return firstCodeIndex(segments, 0) >= 0;
    }

    /**
     * 返回 [0, end) 区间内去掉尾部非代码段后的结束下标。
     */
    static int trimTrailingNonCode(List<Segment> segments, int end) {
        int trimmed = end;
        while (trimmed > 0 && !segments.get(trimmed - 1).isCode()) {
            trimmed--;
        }
        return trimmed;
    }

    static boolean isOpenBracket(Segment segment) {
        return segment instanceof RawSegment && segment.isCode() && OPEN_BRACKET.equals(segment.raw());
    }

    static boolean isCloseBracket(Segment segment) {
        return segment instanceof RawSegment && segment.isCode() && CLOSE_BRACKET.equals(segment.raw());
    }

    /**
     * 查找与 openIndex 处左括号配对的右括号下标，不平衡时返回 -1。
     */
    static int findClosingBracket(List<Segment> segments, int openIndex) {
        int depth = 0;
        for (int index = openIndex; index < segments.size(); index++) {
            Segment segment = segments.get(index);
            if (isOpenBracket(segment)) {
                depth++;
            } else if (isCloseBracket(segment)) {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
        }
        return -1;
    }

    /**
     * 计算零宽标记应挂载的位置：下一个未匹配段的起点，或已匹配内容的末尾。
     */
    static FilePosition positionAt(List<Segment> matched, List<Segment> unmatched) {
        if (!unmatched.isEmpty()) {
            return unmatched.get(0).position();
        }
        for (int index = matched.size() - 1; index >= 0; index--) {
            Segment segment = matched.get(index);
            if (!segment.isMeta()) {
                return segment.position().advance(segment.raw());
            }
        }
        return FilePosition.START;
    }
}
