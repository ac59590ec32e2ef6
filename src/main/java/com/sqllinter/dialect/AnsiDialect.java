package com.sqllinter.dialect;

import com.sqllinter.grammar.AnyNumberOf;
import com.sqllinter.grammar.Anything;
import com.sqllinter.grammar.Bracketed;
import com.sqllinter.grammar.ContainsOnly;
import com.sqllinter.grammar.Delimited;
import com.sqllinter.grammar.Grammar;
import com.sqllinter.grammar.GreedyUntil;
import com.sqllinter.grammar.KeywordMatcher;
import com.sqllinter.grammar.Meta;
import com.sqllinter.grammar.NamedMatcher;
import com.sqllinter.grammar.OneOf;
import com.sqllinter.grammar.PredicateMatcher;
import com.sqllinter.grammar.Ref;
import com.sqllinter.grammar.RegexMatcher;
import com.sqllinter.grammar.SegmentDefinition;
import com.sqllinter.grammar.Sequence;
import com.sqllinter.grammar.StartsWith;
import com.sqllinter.lexer.LexerMatcher;
import com.sqllinter.segment.SegmentTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ANSI 基础方言：词法表与完整的语句语法，其他方言从这里派生。
 *
 * <p>OneOf 按声明顺序取第一个成功的分支，因此各处候选项的顺序是有意安排的：
 * 更具体、更长的分支放在前面。
 */
public final class AnsiDialect {
    public static final String NAME = "ansi";

    /** 不能作为裸标识符使用的保留字 */
    static final List<String> RESERVED_WORDS = List.of(
            "ALL", "AND", "AS", "ASC", "BY", "CASE", "CROSS", "CREATE", "DELETE", "DESC", "DISTINCT",
            "DROP", "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FROM", "FULL", "GRANT", "GROUP",
            "HAVING", "IN", "INNER", "INSERT", "INTERSECT", "INTO", "IS", "JOIN", "LEFT", "LIKE",
            "LIMIT", "MINUS", "NOT", "NULL", "OFFSET", "ON", "OR", "ORDER", "OUTER", "OVER",
            "PARTITION", "REVOKE", "RIGHT", "SELECT", "SET", "TABLE", "THEN", "TRUE", "UNION",
            "UPDATE", "USING", "VALUES", "WHEN", "WHERE", "WITH");

    /** 可以同时作为函数名的保留字，例如 LEFT(x, 3) */
    static final List<String> FUNCTION_NAME_EXCEPTIONS = List.of("LEFT", "RIGHT");

    private static final List<String> KEYWORDS = List.of(
            "all", "and", "as", "asc", "by", "cascade", "case", "chain", "commit", "constraint",
            "create", "cross", "default", "delete", "desc", "distinct", "drop", "else", "end",
            "except", "exists", "for", "foreign", "from", "full", "grant", "group", "having", "if",
            "in", "inner", "insert", "intersect", "into", "is", "join", "key", "left", "like",
            "limit", "minus", "nan", "no", "not", "null", "offset", "on", "option", "or", "order",
            "outer", "over", "overwrite", "partition", "primary", "privileges", "references",
            "replace", "restrict", "revoke", "right", "rollback", "rows", "schema", "select", "set",
            "table", "tables", "then", "to", "union", "unique", "update", "using", "value", "values",
            "view", "when", "where", "with", "work");

    private AnsiDialect() {
    }

    /**
     * 构建一个未冻结的 ANSI 方言，调用方可以继续派生或覆盖。
     */
    public static Dialect create() {
        Dialect dialect = new Dialect(NAME);
        dialect.setLexerMatchers(lexerMatchers());
        registerTerminals(dialect);
        registerKeywords(dialect);
        registerExpressions(dialect);
        registerSelect(dialect);
        registerStatements(dialect);
        registerDefinitions(dialect);
        return dialect;
    }

    /**
     * 关键字在方言中的注册名，例如 select 对应 SelectKeywordSegment。
     */
    public static String keywordName(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1) + "KeywordSegment";
    }

    static String reservedPattern(List<String> words) {
        return "(" + String.join("|", words) + ")";
    }

    // ==================== 词法表 ====================

    static List<LexerMatcher> lexerMatchers() {
        return List.of(
                LexerMatcher.regex("whitespace", "[\\t \\f]+").asTrivia(SegmentTypes.WHITESPACE),
                LexerMatcher.regex("inline_comment", "(--|#)[^\\n]*").asComment(),
                LexerMatcher.regex("block_comment", "/\\*[\\s\\S]*?\\*/").asComment(),
                LexerMatcher.regex("single_quote", "'(?:[^']|'')*'"),
                LexerMatcher.regex("double_quote", "\"[^\"]*\""),
                LexerMatcher.regex("back_quote", "`[^`]*`"),
                LexerMatcher.regex("numeric_literal", "[0-9]+(\\.[0-9]+)?"),
                LexerMatcher.regex("not_equal", "!=|<>"),
                LexerMatcher.regex("greater_than_or_equal", ">="),
                LexerMatcher.regex("less_than_or_equal", "<="),
                LexerMatcher.regex("newline", "\\r\\n|\\r").asTrivia(SegmentTypes.NEWLINE),
                LexerMatcher.regex("casting_operator", "::"),
                LexerMatcher.regex("concat_operator", "\\|\\|"),
                LexerMatcher.singleton("newline", "\n").asTrivia(SegmentTypes.NEWLINE),
                LexerMatcher.singleton("equals", "="),
                LexerMatcher.singleton("greater_than", ">"),
                LexerMatcher.singleton("less_than", "<"),
                LexerMatcher.singleton("dot", "."),
                LexerMatcher.singleton("comma", ",").withType("comma"),
                LexerMatcher.singleton("plus", "+"),
                LexerMatcher.singleton("tilde", "~"),
                LexerMatcher.singleton("minus", "-"),
                LexerMatcher.singleton("divide", "/"),
                LexerMatcher.singleton("percent", "%"),
                LexerMatcher.singleton("star", "*"),
                LexerMatcher.singleton("bracket_open", "("),
                LexerMatcher.singleton("bracket_close", ")"),
                LexerMatcher.singleton("semicolon", ";"),
                LexerMatcher.regex("code", "[0-9a-zA-Z_]+"));
    }

    // ==================== 终结符 ====================

    private static void registerTerminals(Dialect d) {
        d.register("NonCodeGrammar", PredicateMatcher.of("non_code", segment -> !segment.isCode()));

        d.register("SemicolonSegment", KeywordMatcher.symbol(";", "statement_terminator", "semicolon"));
        d.register("StartBracketSegment", KeywordMatcher.symbol("(", Bracketed.START_BRACKET, "start_bracket"));
        d.register("EndBracketSegment", KeywordMatcher.symbol(")", Bracketed.END_BRACKET, "end_bracket"));
        d.register("CommaSegment", KeywordMatcher.symbol(",", "comma", "comma"));
        d.register("DotSegment", KeywordMatcher.symbol(".", "dot", "dot"));
        d.register("StarSegment", KeywordMatcher.symbol("*", "star", "star"));
        d.register("TildeSegment", KeywordMatcher.symbol("~", "tilde", "tilde"));
        d.register("CastOperatorSegment", KeywordMatcher.symbol("::", "casting_operator", "casting_operator"));

        d.register("PlusSegment", KeywordMatcher.symbol("+", "binary_operator", "plus"));
        d.register("MinusSegment", KeywordMatcher.symbol("-", "binary_operator", "minus"));
        d.register("DivideSegment", KeywordMatcher.symbol("/", "binary_operator", "divide"));
        d.register("MultiplySegment", KeywordMatcher.symbol("*", "binary_operator", "multiply"));
        d.register("ModuloSegment", KeywordMatcher.symbol("%", "binary_operator", "modulo"));
        d.register("ConcatSegment", KeywordMatcher.symbol("||", "binary_operator", "concat"));

        d.register("EqualsSegment", KeywordMatcher.symbol("=", "comparison_operator", "equals"));
        d.register("GreaterThanSegment", KeywordMatcher.symbol(">", "comparison_operator", "greater_than"));
        d.register("LessThanSegment", KeywordMatcher.symbol("<", "comparison_operator", "less_than"));
        d.register("GreaterThanOrEqualToSegment",
                KeywordMatcher.symbol(">=", "comparison_operator", "greater_than_equal_to"));
        d.register("LessThanOrEqualToSegment",
                KeywordMatcher.symbol("<=", "comparison_operator", "less_than_equal_to"));
        d.register("NotEqualToSegment_a", KeywordMatcher.symbol("!=", "comparison_operator", "not_equal_to"));
        d.register("NotEqualToSegment_b", KeywordMatcher.symbol("<>", "comparison_operator", "not_equal_to"));

        d.register("NakedIdentifierSegment", RegexMatcher.of("[A-Z0-9_]*[A-Z][A-Z0-9_]*",
                reservedPattern(RESERVED_WORDS), "naked_identifier", "identifier"));
        List<String> functionReserved = new ArrayList<>(RESERVED_WORDS);
        functionReserved.removeAll(FUNCTION_NAME_EXCEPTIONS);
        d.register("FunctionNameSegment", RegexMatcher.of("[A-Z][A-Z0-9_]*",
                reservedPattern(functionReserved), "function_name", "function_name"));
        d.register("DatatypeSegment", RegexMatcher.of("[A-Z][A-Z0-9_]*", "data_type", "data_type"));
        d.register("QuotedIdentifierSegment", NamedMatcher.of("double_quote", "quoted_identifier", "identifier"));
        d.register("QuotedLiteralSegment", NamedMatcher.of("single_quote", "quoted_literal", "literal"));
        d.register("NumericLiteralSegment", NamedMatcher.of("numeric_literal", "numeric_literal", "literal"));
        d.register("TrueSegment", KeywordMatcher.symbol("true", "boolean_literal", "true"));
        d.register("FalseSegment", KeywordMatcher.symbol("false", "boolean_literal", "false"));

        d.register("SingleIdentifierGrammar", OneOf.of(ref("NakedIdentifierSegment"), ref("QuotedIdentifierSegment")));
        d.register("BooleanLiteralGrammar", OneOf.of(ref("TrueSegment"), ref("FalseSegment")));
        d.register("ArithmeticBinaryOperatorGrammar", OneOf.of(
                ref("PlusSegment"), ref("MinusSegment"), ref("DivideSegment"),
                ref("MultiplySegment"), ref("ModuloSegment"), ref("ConcatSegment")));
        d.register("BooleanBinaryOperatorGrammar", OneOf.of(kw("and"), kw("or")));
        d.register("ComparisonOperatorGrammar", OneOf.of(
                ref("EqualsSegment"), ref("GreaterThanSegment"), ref("LessThanSegment"),
                ref("GreaterThanOrEqualToSegment"), ref("LessThanOrEqualToSegment"),
                ref("NotEqualToSegment_a"), ref("NotEqualToSegment_b")));
        d.register("LikeGrammar", OneOf.of(kw("like")));
        d.register("LiteralGrammar", OneOf.of(
                ref("QuotedLiteralSegment"), ref("NumericLiteralSegment"), ref("BooleanLiteralGrammar"),
                ref("QualifiedNumericLiteralSegment"), kw("null")));
    }

    private static void registerKeywords(Dialect d) {
        for (String word : KEYWORDS) {
            d.register(keywordName(word), keywordMatcher(word));
        }
    }

    private static KeywordMatcher keywordMatcher(String word) {
        if (word.equals("and") || word.equals("or")) {
            return KeywordMatcher.symbol(word, "binary_operator", word);
        }
        return KeywordMatcher.keyword(word);
    }

    // ==================== 表达式 ====================

    private static void registerExpressions(Dialect d) {
        // 二元运算的右侧只匹配一个操作数，后续运算符由 AnyNumberOf 逐个吃掉，递归深度不随运算符个数增长
        d.register("Expression_A_Grammar", Sequence.of(
                ref("Expression_B_Grammar"),
                AnyNumberOf.of(
                        Sequence.of(
                                OneOf.of(ref("ArithmeticBinaryOperatorGrammar"),
                                        ref("ComparisonOperatorGrammar"),
                                        ref("BooleanBinaryOperatorGrammar")),
                                ref("Expression_B_Grammar")),
                        Sequence.of(
                                kw("not").optional(),
                                kw("in"),
                                Bracketed.of(OneOf.of(
                                        ref("SelectableGrammar"),
                                        Delimited.of(ref("Expression_A_Grammar"), ref("CommaSegment"))))),
                        Sequence.of(
                                kw("not").optional(),
                                ref("LikeGrammar"),
                                ref("Expression_B_Grammar")),
                        Sequence.of(
                                kw("is"),
                                kw("not").optional(),
                                OneOf.of(kw("null"), kw("nan"), ref("BooleanLiteralGrammar"))))));
        d.register("Expression_B_Grammar", OneOf.of(
                Sequence.of(
                        OneOf.of(ref("PlusSegment"), ref("MinusSegment"), ref("TildeSegment"), kw("not")),
                        ref("Expression_B_Grammar")),
                ref("Expression_C_Grammar")));
        d.register("Expression_C_Grammar", OneOf.of(
                ref("CaseExpressionSegment"),
                Sequence.of(kw("exists"), Bracketed.of(ref("SelectableGrammar"))),
                ref("Expression_D_Grammar")));
        d.register("Expression_D_Grammar", Sequence.of(
                OneOf.of(
                        ref("FunctionSegment"),
                        Bracketed.of(OneOf.of(ref("SelectableGrammar"), ref("Expression_A_Grammar"))),
                        ref("LiteralGrammar"),
                        ref("ObjectReferenceSegment")),
                ref("ShorthandCastSegment").optional()).codeOnly(false));

        d.register(SegmentDefinition.of("ObjectReferenceSegment", "object_reference",
                Delimited.of(ref("SingleIdentifierGrammar"), ref("DotSegment"))
                        .terminator(OneOf.of(ref("NonCodeGrammar"), ref("CommaSegment"), ref("CastOperatorSegment")))
                        .codeOnly(false)));
        d.register(SegmentDefinition.of("AliasExpressionSegment", "alias_expression",
                Sequence.of(kw("as").optional(), ref("SingleIdentifierGrammar"))));
        d.register(SegmentDefinition.of("ShorthandCastSegment", "cast_expression",
                Sequence.of(ref("CastOperatorSegment"), ref("DatatypeSegment")).codeOnly(false)));
        d.register(SegmentDefinition.of("QualifiedNumericLiteralSegment", "numeric_literal",
                Sequence.of(OneOf.of(ref("PlusSegment"), ref("MinusSegment")), ref("NumericLiteralSegment"))
                        .codeOnly(false)));

        d.register(SegmentDefinition.of("FunctionSegment", "function",
                Sequence.of(
                        Sequence.of(ref("FunctionNameSegment"), Bracketed.of(Anything.create().optional()))
                                .codeOnly(false),
                        Sequence.of(kw("over"), Bracketed.of(Anything.create().optional())).optional()),
                Sequence.of(
                        Sequence.of(
                                ref("FunctionNameSegment"),
                                Bracketed.of(Sequence.of(
                                        kw("distinct").optional(),
                                        OneOf.of(
                                                ref("StarSegment"),
                                                Delimited.of(ref("ExpressionSegment"), ref("CommaSegment"))))
                                        .optional()))
                                .codeOnly(false),
                        Sequence.of(
                                kw("over"),
                                Bracketed.of(Sequence.of(
                                        ref("PartitionClauseSegment").optional(),
                                        ref("OrderByClauseSegment").optional(),
                                        ref("FrameClauseSegment").optional()).optional()))
                                .optional())));
        d.register(SegmentDefinition.of("PartitionClauseSegment", "partitionby_clause",
                StartsWith.of(kw("partition")).terminator(OneOf.of(kw("order"), kw("rows"))),
                Sequence.of(kw("partition"), kw("by"), Meta.INDENT,
                        Delimited.of(ref("ExpressionSegment"), ref("CommaSegment")), Meta.DEDENT)));
        d.register(SegmentDefinition.of("FrameClauseSegment", "frame_clause", StartsWith.of(kw("rows"))));

        SegmentDefinition expression = SegmentDefinition.of("ExpressionSegment", "expression",
                GreedyUntil.of(ref("CommaSegment"), kw("as"), kw("asc"), kw("desc"))
                        .skipNested(kw("case"), kw("end")),
                ref("Expression_A_Grammar"));
        d.register(expression);
        d.register(expression.withMatchGrammar("ExpressionSegment_TermWhen",
                GreedyUntil.of(kw("when")).skipNested(kw("case"), kw("end"))));
        d.register(expression.withMatchGrammar("ExpressionSegment_TermThen",
                GreedyUntil.of(kw("then")).skipNested(kw("case"), kw("end"))));
        d.register(expression.withMatchGrammar("ExpressionSegment_TermWhenElse",
                GreedyUntil.of(kw("when"), kw("else"), kw("end")).skipNested(kw("case"), kw("end"))));
        d.register(expression.withMatchGrammar("ExpressionSegment_TermEnd",
                GreedyUntil.of(kw("end")).skipNested(kw("case"), kw("end"))));

        d.register(SegmentDefinition.of("CaseExpressionSegment", "case_expression",
                StartsWith.of(kw("case")).terminator(kw("end")).includeTerminator(true),
                Sequence.of(
                        kw("case"),
                        ref("ExpressionSegment_TermWhen").optional(),
                        Meta.INDENT,
                        AnyNumberOf.of(Sequence.of(
                                kw("when"),
                                ref("ExpressionSegment_TermThen"),
                                kw("then"),
                                ref("ExpressionSegment_TermWhenElse"))).minTimes(1),
                        Sequence.of(kw("else"), ref("ExpressionSegment_TermEnd")).optional(),
                        Meta.DEDENT,
                        kw("end"))));
    }

    // ==================== SELECT ====================

    private static void registerSelect(Dialect d) {
        d.register("SelectableGrammar", OneOf.of(
                ref("SetExpressionSegment"),
                ref("SelectStatementSegment"),
                ref("WithCompoundStatementSegment")));

        d.register(SegmentDefinition.of("SelectTargetElementSegment", "select_target_element",
                GreedyUntil.of(ref("CommaSegment")).skipNested(kw("case"), kw("end")),
                OneOf.of(
                        ref("StarSegment"),
                        Sequence.of(ref("SingleIdentifierGrammar"), ref("DotSegment"), ref("StarSegment"))
                                .codeOnly(false),
                        Sequence.of(ref("Expression_A_Grammar"), ref("AliasExpressionSegment").optional()))));
        d.register(SegmentDefinition.of("SelectClauseSegment", "select_clause",
                GreedyUntil.of(kw("from"), kw("where"), kw("group"), kw("order"), kw("having"), kw("limit")),
                Sequence.of(
                        kw("select"),
                        OneOf.of(kw("distinct"), kw("all")).optional(),
                        Meta.INDENT,
                        Delimited.of(ref("SelectTargetElementSegment"), ref("CommaSegment")),
                        Meta.DEDENT)));

        d.register(SegmentDefinition.of("TableExpressionSegment", "table_expression",
                Sequence.of(
                        OneOf.of(Bracketed.of(ref("SelectableGrammar")), ref("ObjectReferenceSegment")),
                        ref("AliasExpressionSegment").optional())));
        d.register(SegmentDefinition.of("JoinClauseSegment", "join_clause",
                OneOf.of(
                        Sequence.of(ref("CommaSegment"), ref("TableExpressionSegment")),
                        Sequence.of(
                                OneOf.of(kw("inner"), kw("left"), kw("right"), kw("full"), kw("cross")).optional(),
                                kw("outer").optional(),
                                kw("join"),
                                Meta.INDENT,
                                ref("TableExpressionSegment"),
                                OneOf.of(
                                        Sequence.of(kw("on"), ref("Expression_A_Grammar")),
                                        Sequence.of(kw("using"), Bracketed.of(
                                                Delimited.of(ref("SingleIdentifierGrammar"), ref("CommaSegment")))))
                                        .optional(),
                                Meta.DEDENT))));
        d.register(SegmentDefinition.of("FromClauseSegment", "from_clause",
                StartsWith.of(kw("from"))
                        .terminator(OneOf.of(kw("where"), kw("limit"), kw("group"), kw("order"), kw("having"))),
                Sequence.of(
                        kw("from"),
                        Meta.INDENT,
                        ref("TableExpressionSegment"),
                        AnyNumberOf.of(ref("JoinClauseSegment")),
                        Meta.DEDENT)));
        d.register(SegmentDefinition.of("WhereClauseSegment", "where_clause",
                StartsWith.of(kw("where"))
                        .terminator(OneOf.of(kw("limit"), kw("group"), kw("order"), kw("having"))),
                Sequence.of(kw("where"), Meta.INDENT, ref("ExpressionSegment"), Meta.DEDENT)));
        d.register(SegmentDefinition.of("GroupByClauseSegment", "groupby_clause",
                StartsWith.of(Sequence.of(kw("group"), kw("by")))
                        .terminator(OneOf.of(kw("order"), kw("limit"), kw("having"))),
                Sequence.of(
                        kw("group"),
                        kw("by"),
                        Meta.INDENT,
                        Delimited.of(ref("ExpressionSegment"), ref("CommaSegment"))
                                .terminator(OneOf.of(kw("order"), kw("limit"), kw("having"))),
                        Meta.DEDENT)));
        d.register(SegmentDefinition.of("HavingClauseSegment", "having_clause",
                StartsWith.of(kw("having")).terminator(OneOf.of(kw("order"), kw("limit"))),
                Sequence.of(kw("having"), Meta.INDENT, ref("ExpressionSegment"), Meta.DEDENT)));
        d.register(SegmentDefinition.of("OrderByClauseSegment", "orderby_clause",
                StartsWith.of(kw("order")).terminator(OneOf.of(kw("limit"), kw("having"), kw("rows"))),
                Sequence.of(
                        kw("order"),
                        kw("by"),
                        Meta.INDENT,
                        Delimited.of(
                                Sequence.of(ref("ExpressionSegment"), OneOf.of(kw("asc"), kw("desc")).optional()),
                                ref("CommaSegment"))
                                .terminator(kw("limit")),
                        Meta.DEDENT)));
        d.register(SegmentDefinition.of("LimitClauseSegment", "limit_clause",
                Sequence.of(
                        kw("limit"),
                        ref("NumericLiteralSegment"),
                        Sequence.of(OneOf.of(kw("offset"), ref("CommaSegment")), ref("NumericLiteralSegment"))
                                .optional())));
        d.register(SegmentDefinition.of("ValuesClauseSegment", "values_clause",
                Sequence.of(
                        OneOf.of(kw("values"), kw("value")),
                        Delimited.of(
                                Bracketed.of(Delimited.of(ref("Expression_A_Grammar"), ref("CommaSegment"))),
                                ref("CommaSegment")))));

        d.register(SegmentDefinition.of("SelectStatementSegment", "select_statement",
                StartsWith.of(kw("select")),
                Sequence.of(
                        ref("SelectClauseSegment"),
                        ref("FromClauseSegment").optional(),
                        ref("WhereClauseSegment").optional(),
                        ref("GroupByClauseSegment").optional(),
                        ref("HavingClauseSegment").optional(),
                        ref("OrderByClauseSegment").optional(),
                        ref("LimitClauseSegment").optional())));
        d.register(SegmentDefinition.of("WithCompoundStatementSegment", "with_compound_statement",
                StartsWith.of(kw("with")),
                Sequence.of(
                        kw("with"),
                        Delimited.of(
                                Sequence.of(
                                        ref("SingleIdentifierGrammar"),
                                        Bracketed.of(Delimited.of(ref("SingleIdentifierGrammar"), ref("CommaSegment")))
                                                .optional(),
                                        kw("as"),
                                        Bracketed.of(ref("SelectableGrammar"))),
                                ref("CommaSegment"))
                                .terminator(kw("select")),
                        OneOf.of(ref("SetExpressionSegment"), ref("SelectStatementSegment")))));
        d.register(SegmentDefinition.of("SetOperatorSegment", "set_operator",
                OneOf.of(
                        Sequence.of(kw("union"), OneOf.of(kw("distinct"), kw("all")).optional()),
                        kw("intersect"),
                        kw("except"),
                        kw("minus"))));
        d.register(SegmentDefinition.of("SetExpressionSegment", "set_expression",
                Delimited.of(
                        OneOf.of(
                                ref("SelectStatementSegment"),
                                ref("ValuesClauseSegment"),
                                ref("WithCompoundStatementSegment"),
                                Bracketed.of(ref("SelectableGrammar"))),
                        ref("SetOperatorSegment"))
                        .minDelimiters(1)));
    }

    // ==================== 其他语句 ====================

    private static void registerStatements(Dialect d) {
        d.register(SegmentDefinition.of("InsertStatementSegment", "insert_statement",
                StartsWith.of(kw("insert")),
                Sequence.of(
                        kw("insert"),
                        kw("overwrite").optional(),
                        kw("into").optional(),
                        ref("ObjectReferenceSegment"),
                        Bracketed.of(Delimited.of(ref("ObjectReferenceSegment"), ref("CommaSegment"))).optional(),
                        OneOf.of(ref("ValuesClauseSegment"), ref("SelectableGrammar")))));
        d.register(SegmentDefinition.of("SetClauseSegment", "set_clause",
                Sequence.of(ref("ObjectReferenceSegment"), ref("EqualsSegment"), ref("Expression_A_Grammar"))));
        d.register(SegmentDefinition.of("SetClauseListSegment", "set_clause_list",
                StartsWith.of(kw("set")).terminator(kw("where")),
                Sequence.of(
                        kw("set"),
                        Meta.INDENT,
                        Delimited.of(ref("SetClauseSegment"), ref("CommaSegment")),
                        Meta.DEDENT)));
        d.register(SegmentDefinition.of("UpdateStatementSegment", "update_statement",
                StartsWith.of(kw("update")),
                Sequence.of(
                        kw("update"),
                        ref("TableExpressionSegment"),
                        ref("SetClauseListSegment"),
                        ref("WhereClauseSegment").optional())));
        d.register(SegmentDefinition.of("DeleteStatementSegment", "delete_statement",
                StartsWith.of(kw("delete")),
                Sequence.of(
                        kw("delete"),
                        kw("from"),
                        ref("TableExpressionSegment"),
                        ref("WhereClauseSegment").optional())));
        d.register(SegmentDefinition.of("EmptyStatementSegment", "empty_statement",
                ContainsOnly.of(SegmentTypes.COMMENT, SegmentTypes.NEWLINE, SegmentTypes.WHITESPACE)
                        .codeOnly(false)));
        d.register(SegmentDefinition.of("TransactionStatementSegment", "transaction_statement",
                Sequence.of(
                        OneOf.of(kw("commit"), kw("rollback")),
                        kw("work").optional(),
                        Sequence.of(kw("and"), kw("no").optional(), kw("chain")).optional())));
        d.register(SegmentDefinition.of("DropStatementSegment", "drop_statement",
                Sequence.of(
                        kw("drop"),
                        OneOf.of(kw("table"), kw("view")),
                        Sequence.of(kw("if"), kw("exists")).optional(),
                        ref("ObjectReferenceSegment"),
                        OneOf.of(kw("restrict"), kw("cascade")).optional())));
        d.register(SegmentDefinition.of("AccessStatementSegment", "access_statement",
                OneOf.of(
                        Sequence.of(
                                kw("grant"),
                                ref("PrivilegeListGrammar"),
                                kw("on"),
                                ref("PrivilegeTargetGrammar"),
                                kw("to"),
                                kw("group").optional(),
                                ref("ObjectReferenceSegment"),
                                Sequence.of(kw("with"), kw("grant"), kw("option")).optional()),
                        Sequence.of(
                                kw("revoke"),
                                Sequence.of(kw("grant"), kw("option"), kw("for")).optional(),
                                ref("PrivilegeListGrammar"),
                                kw("on"),
                                ref("PrivilegeTargetGrammar"),
                                kw("from"),
                                kw("group").optional(),
                                ref("ObjectReferenceSegment"),
                                OneOf.of(kw("restrict"), kw("cascade")).optional()))));
        d.register("PrivilegeListGrammar", Delimited.of(
                Sequence.of(
                        OneOf.of(
                                Sequence.of(kw("all"), kw("privileges").optional()),
                                kw("select"),
                                kw("update"),
                                kw("insert"),
                                kw("delete")),
                        Bracketed.of(Delimited.of(ref("ObjectReferenceSegment"), ref("CommaSegment"))).optional()),
                ref("CommaSegment")));
        d.register("PrivilegeTargetGrammar", OneOf.of(
                Sequence.of(kw("table").optional(), ref("ObjectReferenceSegment")),
                Sequence.of(kw("all"), kw("tables"), kw("in"), kw("schema"), ref("ObjectReferenceSegment"))));

        d.register(SegmentDefinition.of("StatementSegment", "statement",
                GreedyUntil.of(ref("SemicolonSegment")).codeOnly(false),
                OneOf.of(
                        ref("SetExpressionSegment"),
                        ref("SelectStatementSegment"),
                        ref("InsertStatementSegment"),
                        ref("UpdateStatementSegment"),
                        ref("DeleteStatementSegment"),
                        ref("EmptyStatementSegment"),
                        ref("WithCompoundStatementSegment"),
                        ref("TransactionStatementSegment"),
                        ref("DropStatementSegment"),
                        ref("AccessStatementSegment"),
                        ref("CreateTableStatementSegment"),
                        ref("CreateViewStatementSegment"))));

        Grammar statements = Delimited.of(ref("StatementSegment"), ref("SemicolonSegment"))
                .codeOnly(false)
                .allowTrailing(true);
        d.register(SegmentDefinition.of("FileSegment", SegmentTypes.FILE, statements, statements));
    }

    // ==================== DDL ====================

    private static void registerDefinitions(Dialect d) {
        Grammar columnList = Bracketed.of(Delimited.of(ref("ObjectReferenceSegment"), ref("CommaSegment")));

        d.register(SegmentDefinition.of("ColumnConstraintSegment", "column_constraint",
                Sequence.of(
                        Sequence.of(kw("constraint"), ref("ObjectReferenceSegment")).optional(),
                        OneOf.of(
                                Sequence.of(kw("not").optional(), kw("null")),
                                Sequence.of(kw("default"), ref("LiteralGrammar")),
                                Sequence.of(kw("primary"), kw("key")),
                                kw("unique"),
                                Sequence.of(kw("references"), ref("ObjectReferenceSegment"),
                                        Bracketed.of(Delimited.of(ref("ObjectReferenceSegment"),
                                                ref("CommaSegment"))).optional())))));
        d.register(SegmentDefinition.of("ColumnDefinitionSegment", "column_definition",
                Sequence.of(
                        ref("SingleIdentifierGrammar"),
                        ref("DatatypeSegment"),
                        Bracketed.of(Delimited.of(ref("NumericLiteralSegment"), ref("CommaSegment"))).optional(),
                        AnyNumberOf.of(ref("ColumnConstraintSegment")))));
        d.register(SegmentDefinition.of("TableConstraintSegment", "table_constraint_definition",
                Sequence.of(
                        Sequence.of(kw("constraint"), ref("ObjectReferenceSegment")).optional(),
                        OneOf.of(
                                Sequence.of(kw("unique"), columnList),
                                Sequence.of(kw("primary"), kw("key"), columnList),
                                Sequence.of(kw("foreign"), kw("key"), columnList,
                                        kw("references"), ref("ObjectReferenceSegment"), columnList)))));
        d.register(SegmentDefinition.of("CreateTableStatementSegment", "create_table_statement",
                Sequence.of(
                        kw("create"),
                        kw("table"),
                        Sequence.of(kw("if"), kw("not"), kw("exists")).optional(),
                        ref("ObjectReferenceSegment"),
                        Bracketed.of(Delimited.of(
                                OneOf.of(ref("TableConstraintSegment"), ref("ColumnDefinitionSegment")),
                                ref("CommaSegment"))))));
        d.register(SegmentDefinition.of("CreateViewStatementSegment", "create_view_statement",
                Sequence.of(
                        kw("create"),
                        Sequence.of(kw("or"), kw("replace")).optional(),
                        kw("view"),
                        ref("ObjectReferenceSegment"),
                        kw("as"),
                        ref("SelectableGrammar"))));
    }

    // ==================== 辅助 ====================

    static Ref ref(String name) {
        return Ref.of(name);
    }

    static Ref kw(String word) {
        return Ref.of(keywordName(word));
    }
}
