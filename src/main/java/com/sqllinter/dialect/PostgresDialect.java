package com.sqllinter.dialect;

import com.sqllinter.grammar.KeywordMatcher;
import com.sqllinter.grammar.OneOf;
import com.sqllinter.grammar.Ref;
import com.sqllinter.grammar.RegexMatcher;
import com.sqllinter.lexer.LexerMatcher;

/**
 * PostgreSQL 方言：标识符允许 $，支持 ILIKE。
 */
public final class PostgresDialect {
    public static final String NAME = "postgres";

    private PostgresDialect() {
    }

    public static Dialect create() {
        Dialect dialect = AnsiDialect.create().derive(NAME);
        dialect.replaceLexerMatcher(LexerMatcher.regex("code", "[0-9a-zA-Z_$]+"));
        dialect.override("NakedIdentifierSegment", RegexMatcher.of("[A-Z0-9_]*[A-Z][A-Z0-9_$]*",
                AnsiDialect.reservedPattern(AnsiDialect.RESERVED_WORDS), "naked_identifier", "identifier"));
        dialect.register(AnsiDialect.keywordName("ilike"), KeywordMatcher.keyword("ilike"));
        dialect.override("LikeGrammar", OneOf.of(
                Ref.of(AnsiDialect.keywordName("like")),
                Ref.of(AnsiDialect.keywordName("ilike"))));
        return dialect;
    }
}
