package com.sqllinter.segment;

/**
 * 框架层面约定的段类型名，方言可在此之外自定义更多类型。
 */
public final class SegmentTypes {
    private SegmentTypes() {
    }

    public static final String RAW = "raw";
    public static final String WHITESPACE = "whitespace";
    public static final String NEWLINE = "newline";
    public static final String COMMENT = "comment";
    public static final String KEYWORD = "keyword";
    public static final String FILE = "file";
    public static final String UNPARSABLE = "unparsable";
    public static final String INDENT = "indent";
    public static final String DEDENT = "dedent";
}
