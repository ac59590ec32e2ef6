package com.sqllinter.segment;

/**
 * 零宽度的缩进/反缩进标记，只记录嵌套层次，不对应任何原文。
 */
public final class MetaSegment extends Segment {
    private final String type;
    private final FilePosition position;

    private MetaSegment(String type, FilePosition position) {
        this.type = type;
        this.position = position;
    }

    public static MetaSegment indent(FilePosition position) {
        return new MetaSegment(SegmentTypes.INDENT, position);
    }

    public static MetaSegment dedent(FilePosition position) {
        return new MetaSegment(SegmentTypes.DEDENT, position);
    }

    /** 缩进为 +1，反缩进为 -1 */
    public int indentDelta() {
        return SegmentTypes.INDENT.equals(type) ? 1 : -1;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String name() {
        return type;
    }

    @Override
    public String raw() {
        return "";
    }

    @Override
    public FilePosition position() {
        return position;
    }

    @Override
    public boolean isCode() {
        return false;
    }

    @Override
    public boolean isComment() {
        return false;
    }

    @Override
    public boolean isMeta() {
        return true;
    }
}
