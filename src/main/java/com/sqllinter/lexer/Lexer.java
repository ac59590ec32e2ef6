package com.sqllinter.lexer;

import com.sqllinter.segment.FilePosition;
import com.sqllinter.segment.RawSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * 按声明顺序尝试词法规则，把原文切分为无损的词法单元序列。
 *
 * <p>空白与注释同样产出词法单元，所有单元原文拼接后与输入完全一致。
 */
public class Lexer {
    private final List<LexerMatcher> matchers;
    private final List<LexerMatcher.CompiledMatcher> compiled;

    public Lexer(List<LexerMatcher> matchers) {
        if (matchers == null || matchers.isEmpty()) {
            throw new IllegalArgumentException("词法规则表不能为空");
        }
        this.matchers = List.copyOf(matchers);
        this.compiled = new ArrayList<>(matchers.size());
        for (LexerMatcher matcher : this.matchers) {
            compiled.add(matcher.compile());
        }
    }

    /**
     * 将原文切分为词法单元，无法识别的位置抛出 {@link LexException}。
     */
    public List<RawSegment> lex(String source) {
        if (source == null) {
            throw new IllegalArgumentException("SQL 文本不能为空");
        }
        List<RawSegment> tokens = new ArrayList<>();
        FilePosition position = FilePosition.START;
        int offset = 0;
        while (offset < source.length()) {
            int index = -1;
            int length = 0;
            for (int candidate = 0; candidate < compiled.size() && length == 0; candidate++) {
                length = compiled.get(candidate).matchLength(source, offset);
                index = candidate;
            }
            if (length == 0) {
                throw new LexException("无法识别字符: '" + source.charAt(offset) + "'", position, source);
            }
            LexerMatcher rule = matchers.get(index);
            String text = source.substring(offset, offset + length);
            tokens.add(new RawSegment(text, position, rule.name(), rule.type(), rule.code(), rule.comment()));
            position = position.advance(text);
            offset += length;
        }
        return tokens;
    }

    public List<LexerMatcher> getMatchers() {
        return matchers;
    }
}
