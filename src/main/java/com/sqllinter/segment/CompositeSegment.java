package com.sqllinter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 复合节点：独占一组有序子段，原文等于子段原文的拼接。
 */
public final class CompositeSegment extends Segment {

    /** 段的解析状态：MATCHED 仅确定边界，PARSED 已递归解析子段 */
    public enum State {
        MATCHED,
        PARSED
    }

    private final String type;
    private final String name;
    private final List<Segment> children;
    private final State state;
    private final String expected;
    private String cachedRaw;

    public CompositeSegment(String type, String name, List<Segment> children, State state) {
        this(type, name, children, state, null);
    }

    private CompositeSegment(String type, String name, List<Segment> children, State state, String expected) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.children = List.copyOf(children);
        this.state = Objects.requireNonNull(state, "state");
        this.expected = expected;
    }

    /**
     * 将无法匹配的区域包装为不透明的 unparsable 段，保留全部原文。
     */
    public static CompositeSegment unparsable(List<Segment> children, String expected) {
        return new CompositeSegment(SegmentTypes.UNPARSABLE, SegmentTypes.UNPARSABLE, children, State.PARSED, expected);
    }

    /**
     * 以新的子段列表与状态构造副本。
     */
    public CompositeSegment withChildren(List<Segment> newChildren, State newState) {
        return new CompositeSegment(type, name, newChildren, newState, expected);
    }

    public State state() {
        return state;
    }

    /** 对 unparsable 段给出期望的语法描述，其余段为 null */
    public String expected() {
        return expected;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Segment> children() {
        return children;
    }

    @Override
    public String raw() {
        if (cachedRaw == null) {
            StringBuilder builder = new StringBuilder();
            for (Segment child : children) {
                builder.append(child.raw());
            }
            cachedRaw = builder.toString();
        }
        return cachedRaw;
    }

    @Override
    public FilePosition position() {
        return children.isEmpty() ? FilePosition.START : children.get(0).position();
    }

    @Override
    public boolean isCode() {
        return children.stream().anyMatch(Segment::isCode);
    }

    @Override
    public boolean isComment() {
        return false;
    }

    /**
     * 去除零宽标记后的子段，用于重新匹配。
     */
    public List<Segment> childrenWithoutMeta() {
        List<Segment> filtered = new ArrayList<>(children.size());
        for (Segment child : children) {
            if (!child.isMeta()) {
                filtered.add(child);
            }
        }
        return filtered;
    }

    @Override
    public String toString() {
        return "CompositeSegment[" + type + ", " + name + ", " + state + ", '" + raw() + "']";
    }
}
