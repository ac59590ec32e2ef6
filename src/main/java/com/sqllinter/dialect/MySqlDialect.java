package com.sqllinter.dialect;

import com.sqllinter.grammar.NamedMatcher;
import com.sqllinter.grammar.OneOf;

/**
 * MySQL 方言：反引号包围的是标识符，双引号包围的是字符串。
 */
public final class MySqlDialect {
    public static final String NAME = "mysql";

    private MySqlDialect() {
    }

    public static Dialect create() {
        Dialect dialect = AnsiDialect.create().derive(NAME);
        dialect.override("QuotedIdentifierSegment", NamedMatcher.of("back_quote", "quoted_identifier", "identifier"));
        dialect.override("QuotedLiteralSegment", OneOf.of(
                NamedMatcher.of("single_quote", "quoted_literal", "literal"),
                NamedMatcher.of("double_quote", "quoted_literal", "literal")));
        return dialect;
    }
}
