package com.sqllinter.segment;

import java.util.Objects;

/**
 * 词法器产出的不可变词法单元，也是语法树的叶子。
 *
 * <p>终结符匹配时会生成重新标注类型的副本，原文、位置与词法类别保持不变。
 */
public final class RawSegment extends Segment {
    private final String raw;
    private final FilePosition position;
    private final String lexerName;
    private final String type;
    private final String name;
    private final boolean code;
    private final boolean comment;

    public RawSegment(String raw, FilePosition position, String lexerName, String type,
                      boolean code, boolean comment) {
        this(raw, position, lexerName, type, lexerName, code, comment);
    }

    private RawSegment(String raw, FilePosition position, String lexerName, String type, String name,
                       boolean code, boolean comment) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.position = Objects.requireNonNull(position, "position");
        this.lexerName = lexerName;
        this.type = type;
        this.name = name;
        this.code = code;
        this.comment = comment;
    }

    /**
     * 以新的语义类型与名称重新标注当前词法单元。
     */
    public RawSegment retag(String newType, String newName) {
        if (Objects.equals(type, newType) && Objects.equals(name, newName)) {
            return this;
        }
        return new RawSegment(raw, position, lexerName, newType, newName, code, comment);
    }

    /**
     * 生成仅原文不同的副本，供修复改写使用。
     */
    public RawSegment withRaw(String newRaw) {
        return new RawSegment(newRaw, position, lexerName, type, name, code, comment);
    }

    /** 产生该单元的词法规则名，重新标注后不变 */
    public String lexerName() {
        return lexerName;
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
    public String raw() {
        return raw;
    }

    @Override
    public FilePosition position() {
        return position;
    }

    @Override
    public boolean isCode() {
        return code;
    }

    @Override
    public boolean isComment() {
        return comment;
    }

    @Override
    public String toString() {
        return "RawSegment[" + type + ", '" + raw + "', " + position + "]";
    }
}
