package com.sqllinter.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sqllinter.dialect.AnsiDialect;
import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.SegmentTypes;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LexerTest {
    private final Lexer lexer = AnsiDialect.create().lexer();

    @Test
    void testRoundTripPreservesSource() {
        String source = "SELECT a.b, 'it''s' -- note\r\nFROM t /* x\ny */ WHERE c >= 1.5;\n";
        List<RawSegment> tokens = lexer.lex(source);

        String joined = tokens.stream().map(RawSegment::raw).collect(Collectors.joining());
        assertEquals(source, joined);
    }

    @Test
    void testEmptySourceProducesNoTokens() {
        assertTrue(lexer.lex("").isEmpty());
    }

    @Test
    void testWhitespaceAndCommentsAreNotCode() {
        List<RawSegment> tokens = lexer.lex("a -- c\n/* b */");

        assertEquals(List.of("a", " ", "-- c", "\n", "/* b */"), raws(tokens));
        assertTrue(tokens.get(0).isCode());
        assertEquals(SegmentTypes.WHITESPACE, tokens.get(1).type());
        assertTrue(tokens.get(2).isComment());
        assertFalse(tokens.get(2).isCode());
        assertEquals(SegmentTypes.NEWLINE, tokens.get(3).type());
        assertTrue(tokens.get(4).isComment());
    }

    @Test
    void testEarlierRuleShadowsLaterRule() {
        // 注释规则排在减号之前
        List<RawSegment> tokens = lexer.lex("1--2");
        assertEquals(List.of("1", "--2"), raws(tokens));

        List<RawSegment> comparison = lexer.lex("a>=b<>c");
        assertEquals(List.of("a", ">=", "b", "<>", "c"), raws(comparison));
        assertEquals("not_equal", comparison.get(3).lexerName());
    }

    @Test
    void testCrLfIsSingleNewline() {
        List<RawSegment> tokens = lexer.lex("a\r\nb");
        assertEquals(3, tokens.size());
        assertEquals("\r\n", tokens.get(1).raw());
        assertEquals(2, tokens.get(2).position().lineNo());
        assertEquals(1, tokens.get(2).position().linePos());
    }

    @Test
    void testPositionsTrackLinesAndColumns() {
        List<RawSegment> tokens = lexer.lex("select\n  foo");

        RawSegment foo = tokens.get(tokens.size() - 1);
        assertEquals("foo", foo.raw());
        assertEquals(2, foo.position().lineNo());
        assertEquals(3, foo.position().linePos());
        assertEquals(9, foo.position().charPos());
    }

    @Test
    void testUnknownCharacterThrowsWithPosition() {
        LexException exception = assertThrows(LexException.class, () -> lexer.lex("SELECT a\nFROM t WHERE b = @x"));

        assertEquals(2, exception.getPosition().lineNo());
        assertEquals(18, exception.getPosition().linePos());
        assertTrue(exception.getMessage().contains("第 2 行第 18 列"));
        assertTrue(exception.getExcerpt().contains("^"));
    }

    @Test
    void testEmptyMatcherTableRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Lexer(List.of()));
    }

    @Test
    void testInvalidRegexRejectedAtConstruction() {
        assertThrows(java.util.regex.PatternSyntaxException.class, () -> LexerMatcher.regex("broken", "[a-"));
    }

    private static List<String> raws(List<RawSegment> tokens) {
        return tokens.stream().map(RawSegment::raw).toList();
    }
}
