package com.sqllinter.grammar;

import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.SegmentTypes;

import java.util.Locale;

/**
 * 不区分大小写地精确匹配一个词法单元，例如关键字与运算符。
 */
public final class KeywordMatcher extends TerminalGrammar<KeywordMatcher> {
    private final String word;

    private KeywordMatcher(String word, String type, String name) {
        super(type, name);
        this.word = word;
    }

    private KeywordMatcher(KeywordMatcher other) {
        super(other);
        this.word = other.word;
    }

    /**
     * 关键字：类型为 keyword，名称为小写原词。
     */
    public static KeywordMatcher keyword(String word) {
        return new KeywordMatcher(word, SegmentTypes.KEYWORD, word.toLowerCase(Locale.ROOT));
    }

    /**
     * 带自定义类型与名称的符号，例如逗号、比较运算符。
     */
    public static KeywordMatcher symbol(String word, String type, String name) {
        return new KeywordMatcher(word, type, name);
    }

    @Override
    protected KeywordMatcher copy() {
        return new KeywordMatcher(this);
    }

    @Override
    protected boolean accepts(RawSegment segment) {
        return segment.isCode() && segment.raw().equalsIgnoreCase(word);
    }

    @Override
    public String describe() {
        return word.toUpperCase(Locale.ROOT);
    }
}
