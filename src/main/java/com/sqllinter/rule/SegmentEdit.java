package com.sqllinter.rule;

import com.sqllinter.segment.Segment;

import java.util.Objects;

/**
 * 一次树编辑：按对象身份用 replacement 替换 target。
 */
public record SegmentEdit(Segment target, Segment replacement) {

    public SegmentEdit {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(replacement, "replacement");
    }
}
