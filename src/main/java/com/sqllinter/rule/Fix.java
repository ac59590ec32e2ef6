package com.sqllinter.rule;

import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 规则提出的修复：有序的树编辑列表，在整棵树遍历完成后统一应用。
 */
public record Fix(List<SegmentEdit> edits) {

    public Fix {
        if (edits == null || edits.isEmpty()) {
            throw new IllegalArgumentException("修复至少包含一个编辑");
        }
        edits = List.copyOf(edits);
    }

    public static Fix replace(Segment target, Segment replacement) {
        return new Fix(List.of(new SegmentEdit(target, replacement)));
    }
}
