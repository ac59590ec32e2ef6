package com.sqllinter.lexer;

import com.sqllinter.segment.SegmentTypes;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 词法表中的一条具名规则：正则或精确字符串匹配。
 *
 * @param name    规则名，同时作为词法类别写入产出的词法单元
 * @param kind    匹配方式
 * @param pattern 正则表达式或精确字符串
 * @param type    产出词法单元的初始语义类型
 * @param code    是否为代码（非空白、非注释）
 * @param comment 是否为注释
 */
public record LexerMatcher(String name, Kind kind, String pattern, String type, boolean code, boolean comment) {

    /** 匹配方式 */
    public enum Kind {
        REGEX,
        SINGLETON
    }

    public LexerMatcher {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(type, "type");
        if (kind == Kind.REGEX) {
            // 提前编译以便在构造时暴露非法正则
            Pattern.compile(pattern);
        }
    }

    public static LexerMatcher regex(String name, String pattern) {
        return new LexerMatcher(name, Kind.REGEX, pattern, SegmentTypes.RAW, true, false);
    }

    public static LexerMatcher singleton(String name, String literal) {
        return new LexerMatcher(name, Kind.SINGLETON, literal, SegmentTypes.RAW, true, false);
    }

    /**
     * 标记为非代码的空白类规则，并指定类型。
     */
    public LexerMatcher asTrivia(String triviaType) {
        return new LexerMatcher(name, kind, pattern, triviaType, false, false);
    }

    /**
     * 标记为注释规则。
     */
    public LexerMatcher asComment() {
        return new LexerMatcher(name, kind, pattern, SegmentTypes.COMMENT, false, true);
    }

    public LexerMatcher withType(String newType) {
        return new LexerMatcher(name, kind, pattern, newType, code, comment);
    }

    /**
     * 编译为可复用的匹配函数，返回在 offset 处匹配的长度，无匹配返回 0。
     */
    CompiledMatcher compile() {
        if (kind == Kind.SINGLETON) {
            return (text, offset) -> text.startsWith(pattern, offset) ? pattern.length() : 0;
        }
        Pattern compiled = Pattern.compile(pattern);
        return (text, offset) -> {
            Matcher matcher = compiled.matcher(text);
            matcher.region(offset, text.length());
            return matcher.lookingAt() ? matcher.end() - offset : 0;
        };
    }

    @FunctionalInterface
    interface CompiledMatcher {
        int matchLength(String text, int offset);
    }
}
