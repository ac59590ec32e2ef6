package com.sqllinter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 语法树节点：原始词法单元、复合节点或零宽度的缩进标记。
 */
public abstract sealed class Segment permits RawSegment, CompositeSegment, MetaSegment {

    /** 语义类型，用于规则定位与修复 */
    public abstract String type();

    /** 产生该段的语法名称 */
    public abstract String name();

    /** 该段覆盖的原文 */
    public abstract String raw();

    public abstract FilePosition position();

    public abstract boolean isCode();

    public abstract boolean isComment();

    public List<Segment> children() {
        return List.of();
    }

    public boolean isMeta() {
        return false;
    }

    public boolean isWhitespace() {
        return SegmentTypes.WHITESPACE.equals(type()) || SegmentTypes.NEWLINE.equals(type());
    }

    /**
     * 按文档顺序收集所有叶子词法单元。
     */
    public List<RawSegment> rawSegments() {
        List<RawSegment> leaves = new ArrayList<>();
        collectRaw(this, leaves);
        return leaves;
    }

    /**
     * 按文档顺序（先序）收集类型属于给定集合的所有段，包含自身。
     */
    public List<Segment> recursiveCrawl(Set<String> types) {
        List<Segment> found = new ArrayList<>();
        crawl(this, types, found);
        return found;
    }

    /**
     * 渲染为带行列号的缩进树，便于调试与 parse 命令输出。
     */
    public String toTreeString() {
        StringBuilder builder = new StringBuilder();
        appendTree(this, 0, builder);
        return builder.toString();
    }

    private static void collectRaw(Segment segment, List<RawSegment> leaves) {
        if (segment instanceof RawSegment rawSegment) {
            leaves.add(rawSegment);
            return;
        }
        for (Segment child : segment.children()) {
            collectRaw(child, leaves);
        }
    }

    private static void crawl(Segment segment, Set<String> types, List<Segment> found) {
        if (types.contains(segment.type())) {
            found.add(segment);
        }
        // 无法解析的区域对规则不透明
        if (SegmentTypes.UNPARSABLE.equals(segment.type())) {
            return;
        }
        for (Segment child : segment.children()) {
            crawl(child, types, found);
        }
    }

    private static void appendTree(Segment segment, int depth, StringBuilder builder) {
        FilePosition position = segment.position();
        builder.append(String.format("[L:%3d, P:%3d]      |", position.lineNo(), position.linePos()));
        builder.append("    ".repeat(depth));
        builder.append(segment.type()).append(':');
        if (segment instanceof CompositeSegment) {
            builder.append(System.lineSeparator());
            for (Segment child : segment.children()) {
                appendTree(child, depth + 1, builder);
            }
            return;
        }
        if (!segment.raw().isEmpty()) {
            builder.append(" ".repeat(Math.max(1, 28 - depth * 4 - segment.type().length())));
            builder.append('\'').append(escape(segment.raw())).append('\'');
        }
        builder.append(System.lineSeparator());
    }

    private static String escape(String raw) {
        return raw.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
    }
}
