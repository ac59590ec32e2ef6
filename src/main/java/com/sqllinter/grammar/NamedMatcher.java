package com.sqllinter.grammar;

import com.sqllinter.segment.RawSegment;

/**
 * 按词法规则名匹配，例如把 single_quote 词法单元标注为字符串字面量。
 */
public final class NamedMatcher extends TerminalGrammar<NamedMatcher> {
    private final String lexerName;

    private NamedMatcher(String lexerName, String type, String name) {
        super(type, name);
        this.lexerName = lexerName;
    }

    private NamedMatcher(NamedMatcher other) {
        super(other);
        this.lexerName = other.lexerName;
    }

    public static NamedMatcher of(String lexerName, String type, String name) {
        return new NamedMatcher(lexerName, type, name);
    }

    @Override
    protected NamedMatcher copy() {
        return new NamedMatcher(this);
    }

    @Override
    protected boolean accepts(RawSegment segment) {
        return lexerName.equals(segment.lexerName());
    }

    @Override
    public String describe() {
        return "<" + lexerName + ">";
    }
}
