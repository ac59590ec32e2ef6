package com.sqllinter.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sqllinter.dialect.Dialect;
import com.sqllinter.dialect.Dialects;
import com.sqllinter.grammar.Grammar;
import com.sqllinter.grammar.KeywordMatcher;
import com.sqllinter.grammar.OneOf;
import com.sqllinter.grammar.Ref;
import com.sqllinter.grammar.SegmentDefinition;
import com.sqllinter.grammar.Sequence;
import com.sqllinter.grammar.StartsWith;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.Segment;
import com.sqllinter.segment.SegmentTypes;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ParserTest {
    private final Parser parser = new Parser(Dialects.get("ansi"));

    @ParameterizedTest
    @ValueSource(strings = {"ansi", "postgres", "mysql"})
    @DisplayName("所有方言解析夹具文件都能还原原文且没有错误")
    void testFixturesRoundTripInEveryDialect(String dialect) throws IOException {
        Parser dialectParser = new Parser(Dialects.get(dialect));
        for (String fixture : List.of("select_h.sql", "mixed_statements.sql", "inconsistent_case.sql")) {
            String source = fixture(fixture);
            ParsedFile parsed = dialectParser.parse(source);

            assertEquals(source, parsed.tree().raw(), fixture);
            assertTrue(parsed.errors().isEmpty(), () -> fixture + ": " + parsed.errors());
            assertEquals(dialect, parsed.dialect());
        }
    }

    @Test
    void testSelectWithCaseStructure() throws IOException {
        ParsedFile parsed = parser.parse(fixture("select_h.sql"));
        CompositeSegment tree = parsed.tree();

        assertEquals(SegmentTypes.FILE, tree.type());
        assertEquals(CompositeSegment.State.PARSED, tree.state());
        assertEquals(1, count(tree, "select_statement"));
        assertEquals(1, count(tree, "case_expression"));
        assertEquals(1, count(tree, "from_clause"));

        Segment alias = tree.recursiveCrawl(Set.of("alias_expression")).get(0);
        assertEquals("AS tech_support", alias.raw());
        List<Segment> literals = tree.recursiveCrawl(Set.of("quoted_literal"));
        assertEquals(List.of("'tech support'", "'taskus'", "'onc'"), literals.stream().map(Segment::raw).toList());
        Segment reference = tree.recursiveCrawl(Set.of("object_reference")).get(0);
        assertEquals("zendesk.support_team", reference.raw());
    }

    @Test
    void testEveryCompositeIsParsed() throws IOException {
        ParsedFile parsed = parser.parse(fixture("mixed_statements.sql"));

        assertAllParsed(parsed.tree());
        assertEquals(1, count(parsed.tree(), "insert_statement"));
        assertEquals(1, count(parsed.tree(), "update_statement"));
        assertEquals(1, count(parsed.tree(), "delete_statement"));
        assertEquals(1, count(parsed.tree(), "transaction_statement"));
        assertEquals(1, count(parsed.tree(), "with_compound_statement"));
        assertEquals(1, count(parsed.tree(), "set_expression"));
        assertEquals(1, count(parsed.tree(), "create_table_statement"));
        assertEquals(1, count(parsed.tree(), "access_statement"));
        assertEquals(1, count(parsed.tree(), "join_clause"));
    }

    @Test
    void testNestedCaseExpressions() {
        String sql = "select case when a = 1 then case when b = 2 then 'x' else 'y' end else 'z' end as c from t";
        ParsedFile parsed = parser.parse(sql);

        assertFalse(parsed.hasErrors(), () -> parsed.errors().toString());
        assertEquals(2, count(parsed.tree(), "case_expression"));
    }

    @Test
    void testEmptySourceGivesEmptyFile() {
        ParsedFile parsed = parser.parse("");

        assertEquals("", parsed.tree().raw());
        assertTrue(parsed.tree().children().isEmpty());
        assertFalse(parsed.hasErrors());
    }

    @Test
    void testCommentOnlySourceHasNoErrors() {
        ParsedFile parsed = parser.parse("-- nothing here\n/* still nothing */\n");

        assertFalse(parsed.hasErrors());
        assertEquals("-- nothing here\n/* still nothing */\n", parsed.tree().raw());
    }

    @Test
    void testUnparsableRegionKeepsSourceAndReportsPosition() {
        String sql = "select a from t;\nfoo bar baz;\nselect b from u;\n";
        ParsedFile parsed = parser.parse(sql);

        assertEquals(sql, parsed.tree().raw());
        assertEquals(1, parsed.errors().size());
        ParseError error = parsed.errors().get(0);
        assertEquals(2, error.lineNo());
        assertEquals(1, error.linePos());
        assertEquals("foo bar baz", error.found());
        assertTrue(error.describe().contains("第 2 行"));
        // 出错语句前后的语句照常解析
        assertEquals(2, count(parsed.tree(), "select_statement"));
    }

    @Test
    void testDoubleSemicolonIsUnparsable() {
        ParsedFile parsed = parser.parse("select a from t;;");

        assertEquals("select a from t;;", parsed.tree().raw());
        assertTrue(parsed.hasErrors());
    }

    @Test
    void testUnbalancedBracketsAreUnparsable() {
        ParsedFile parsed = parser.parse("select foo(a, (b) from t");

        assertEquals("select foo(a, (b) from t", parsed.tree().raw());
        assertTrue(parsed.hasErrors());
    }

    @Test
    void testLongUnparsableTextIsTruncated() {
        String junk = "foo ".repeat(30).trim();
        ParsedFile parsed = parser.parse(junk);

        assertEquals(1, parsed.errors().size());
        assertTrue(parsed.errors().get(0).found().endsWith("..."));
    }

    @Test
    void testUnparsableSegmentsAreOpaqueToCrawl() {
        ParsedFile parsed = parser.parse("select a from t where ((");

        assertTrue(parsed.hasErrors());
        for (Segment unparsable : parsed.tree().recursiveCrawl(Set.of(SegmentTypes.UNPARSABLE))) {
            assertTrue(unparsable.recursiveCrawl(Set.of("naked_identifier")).isEmpty());
        }
    }

    @Test
    void testDepthLimitRaisesParseException() {
        Parser shallow = new Parser(Dialects.get("ansi"), 3);

        assertThrows(ParseException.class, () -> shallow.parse("select a from t"));
        assertThrows(IllegalArgumentException.class, () -> new Parser(Dialects.get("ansi"), 0));
    }

    @Test
    @DisplayName("很长的平铺布尔条件不会触发深度限制")
    void testLongFlatPredicateStaysWithinDepthLimit() {
        StringBuilder sql = new StringBuilder("select a from t where c0 = 0");
        for (int i = 1; i < 300; i++) {
            sql.append(" and c").append(i).append(" = ").append(i);
        }

        ParsedFile parsed = parser.parse(sql.toString());

        assertEquals(sql.toString(), parsed.tree().raw());
        assertTrue(parsed.errors().isEmpty(), () -> parsed.errors().toString());
    }

    @Test
    @DisplayName("OneOf 选中的分支在展开时失败，不会回退到后面的分支")
    void testChosenBranchFailureIsNotRetried() {
        Grammar choice = OneOf.of(Ref.of("GreetingSegment"), Ref.of("PhraseSegment"));
        Dialect dialect = Dialects.get("ansi").derive("greetings")
                .register(SegmentDefinition.of("GreetingSegment", "greeting",
                        StartsWith.of(KeywordMatcher.keyword("hello")),
                        Sequence.of(KeywordMatcher.keyword("hello"), KeywordMatcher.keyword("world"))))
                .register(SegmentDefinition.of("PhraseSegment", "phrase",
                        Sequence.of(KeywordMatcher.keyword("hello"), KeywordMatcher.keyword("there"))))
                .override(SegmentDefinition.of("FileSegment", SegmentTypes.FILE, choice, choice));

        ParsedFile parsed = new Parser(dialect).parse("hello there");

        assertEquals("hello there", parsed.tree().raw());
        assertTrue(parsed.tree().recursiveCrawl(Set.of("phrase")).isEmpty());
        List<Segment> greetings = parsed.tree().recursiveCrawl(Set.of("greeting"));
        assertEquals(1, greetings.size());
        assertEquals(SegmentTypes.UNPARSABLE, greetings.get(0).children().get(0).type());
        assertEquals(1, parsed.errors().size());
        // 单独使用第二个分支是可以匹配的
        CompositeSegment standalone = new Parser(dialect.derive("phrases")
                .override(SegmentDefinition.of("FileSegment", SegmentTypes.FILE,
                        Ref.of("PhraseSegment"), Ref.of("PhraseSegment"))))
                .parse("hello there").tree();
        assertEquals(1, standalone.recursiveCrawl(Set.of("phrase")).size());
    }

    @Test
    void testTreeStringShowsPositions() {
        String tree = parser.parse("select a\nfrom t").toTreeString();

        assertTrue(tree.startsWith("[L:  1, P:  1]"));
        assertTrue(tree.contains("select_statement:"));
        assertTrue(tree.contains("'\\n'"));
    }

    private static void assertAllParsed(Segment segment) {
        if (segment instanceof CompositeSegment composite) {
            assertEquals(CompositeSegment.State.PARSED, composite.state(), composite::toString);
            for (Segment child : composite.children()) {
                assertAllParsed(child);
            }
        }
    }

    private static int count(Segment tree, String type) {
        return tree.recursiveCrawl(Set.of(type)).size();
    }

    static String fixture(String name) throws IOException {
        try (InputStream input = ParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (input == null) {
                throw new IOException("fixture not found: " + name);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
