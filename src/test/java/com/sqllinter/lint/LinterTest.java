package com.sqllinter.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sqllinter.config.LinterConfig;
import com.sqllinter.dialect.Dialects;
import com.sqllinter.parser.Parser;
import com.sqllinter.rule.CapitalisationPolicy;
import com.sqllinter.rule.Fix;
import com.sqllinter.rule.LintViolation;
import com.sqllinter.rule.Rule;
import com.sqllinter.rule.StandardRules;
import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.SegmentTypes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LinterTest {
    private static final String INCONSISTENT = "SELECT id, name\nfrom users\nWhere active = 1;\n";

    @TempDir
    Path tempDir;

    private final Linter linter = new Linter(Dialects.get("ansi"),
            StandardRules.select(List.of("L010", "L014"), CapitalisationPolicy.CONSISTENT));

    @Test
    void testLintReportsViolationsInOrder() {
        LintResult result = linter.lint("inconsistent.sql", INCONSISTENT);

        assertFalse(result.isFailed());
        assertTrue(result.parseErrors().isEmpty());
        assertEquals(2, result.violations().size());
        LintViolation first = result.violations().get(0);
        assertEquals("L010", first.ruleCode());
        assertEquals(2, first.lineNo());
        assertEquals(1, first.linePos());
        assertEquals(3, result.violations().get(1).lineNo());
        assertNull(result.fixedSource());
        assertEquals(2, result.fixableCount());
    }

    @Test
    void testFixRewritesOnlyOffendingTokens() {
        LintResult result = linter.fix("inconsistent.sql", INCONSISTENT);

        assertEquals("SELECT id, name\nFROM users\nWHERE active = 1;\n", result.fixedSource());
        assertTrue(result.isChanged());
    }

    @Test
    void testFixIsIdempotent() {
        String once = linter.fix("a.sql", INCONSISTENT).fixedSource();
        LintResult twice = linter.fix("a.sql", once);

        assertTrue(twice.violations().isEmpty());
        assertEquals(once, twice.fixedSource());
        assertFalse(twice.isChanged());
    }

    @Test
    void testFixPreservesCommentsAndWhitespace() {
        String source = "-- header\nselect  a ,\tb\nFROM t /* tail */\n";
        String fixed = linter.fix("c.sql", source).fixedSource();

        assertEquals("-- header\nselect  a ,\tb\nfrom t /* tail */\n", fixed);
    }

    @Test
    void testThrowingRuleIsIsolated() {
        Rule broken = new Rule("X001", "always fails", Set.of(SegmentTypes.KEYWORD), (segment, context) -> {
            throw new IllegalStateException("boom");
        });
        Linter withBroken = new Linter(Dialects.get("ansi"),
                List.of(broken, StandardRules.keywordCapitalisation(CapitalisationPolicy.CONSISTENT)));

        LintResult result = withBroken.lint("x.sql", INCONSISTENT);

        assertEquals(3, result.violations().size());
        LintViolation ruleError = result.violations().get(0);
        assertEquals("X001", ruleError.ruleCode());
        assertEquals(LintViolation.RULE_ERROR_TYPE, ruleError.segmentType());
        assertEquals(1, ruleError.lineNo());
        assertTrue(ruleError.description().contains("boom"));
        assertFalse(ruleError.isFixable());
        assertEquals(2, result.violations().stream().filter(v -> v.ruleCode().equals("L010")).count());
    }

    @Test
    void testFixThatBreaksParsingIsRejected() {
        // 把标识符改写成三个词，重新解析时会多出无法解析的区域
        Rule splitter = new Rule("X002", "splits identifiers", Set.of("naked_identifier"), (segment, context) -> {
            if (!segment.raw().equals("a")) {
                return Optional.empty();
            }
            RawSegment raw = (RawSegment) segment;
            return Optional.of(context.violation(segment, "split", Fix.replace(raw, raw.withRaw("a b c"))));
        });
        Linter mixed = new Linter(Dialects.get("ansi"),
                List.of(splitter, StandardRules.keywordCapitalisation(CapitalisationPolicy.UPPER)));

        LintResult result = mixed.fix("y.sql", "select a from t");

        assertEquals("SELECT a FROM t", result.fixedSource());
        LintViolation rejected = result.violations().stream()
                .filter(v -> v.ruleCode().equals("X002"))
                .findFirst()
                .orElseThrow();
        assertFalse(rejected.isFixable());
        assertEquals(2, result.fixableCount());
    }

    @Test
    void testFixThatChangesNothingIsRejected() {
        Rule echo = new Rule("X003", "rewrites identifiers unchanged", Set.of("naked_identifier"), (segment, context) -> {
            RawSegment raw = (RawSegment) segment;
            return Optional.of(context.violation(segment, "echo", Fix.replace(raw, raw.withRaw(raw.raw()))));
        });
        Linter echoing = new Linter(Dialects.get("ansi"), List.of(echo));

        LintResult result = echoing.fix("z.sql", "SELECT a FROM t");

        assertEquals(2, result.violations().size());
        assertTrue(result.violations().stream().noneMatch(LintViolation::isFixable));
        assertEquals(0, result.fixableCount());
        assertFalse(result.isChanged());
    }

    @Test
    void testSingleLetterIdentifierFixIsIdempotent() {
        String source = "select Foo, Bar as A from Tbl\n";

        LintResult first = linter.fix("a.sql", source);
        LintResult second = linter.fix("a.sql", first.fixedSource());

        assertTrue(first.violations().isEmpty(), () -> first.violations().toString());
        assertFalse(first.isChanged());
        assertTrue(second.violations().isEmpty());
    }

    @Test
    void testParseExceptionFailsOnlyThatFile() {
        Linter shallow = new Linter(new Parser(Dialects.get("ansi"), 3),
                StandardRules.select(List.of("L010"), CapitalisationPolicy.CONSISTENT));

        LintResult linted = shallow.lint("deep.sql", "select a from t");
        LintResult fixed = shallow.fix("deep.sql", "select a from t");

        assertTrue(linted.isFailed());
        assertTrue(linted.failure().contains("最大深度"));
        assertTrue(fixed.isFailed());
    }

    @Test
    void testLongFlatPredicateLintsWithoutFailure() {
        StringBuilder sql = new StringBuilder("select a from t where c0 = 0");
        for (int i = 1; i < 150; i++) {
            sql.append(" and c").append(i).append(" = ").append(i);
        }

        LintResult result = linter.lint("long.sql", sql.toString());

        assertFalse(result.isFailed(), result::failure);
        assertTrue(result.parseErrors().isEmpty());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    void testLexErrorFailsOnlyThatFile() {
        LintResult result = linter.lint("bad.sql", "select @ from t");

        assertTrue(result.isFailed());
        assertTrue(result.hasProblems());
        assertTrue(result.failure().contains("第 1 行"));
    }

    @Test
    void testParseErrorsAreReportedAlongsideViolations() {
        LintResult result = linter.lint("broken.sql", "select a from t;\nfoo bar;\nSELECT b from u;\n");

        assertEquals(1, result.parseErrors().size());
        assertEquals(2, result.parseErrors().get(0).lineNo());
        // 第三行 SELECT 与已出现的小写风格不一致
        assertEquals(1, result.violations().size());
        assertEquals(3, result.violations().get(0).lineNo());
    }

    @Test
    void testLintFilesKeepsInputOrder() throws IOException {
        Path good = tempDir.resolve("good.sql");
        Path bad = tempDir.resolve("bad.sql");
        Path messy = tempDir.resolve("messy.sql");
        Files.writeString(good, "SELECT a FROM t;\n");
        Files.writeString(bad, "select $ from t;\n");
        Files.writeString(messy, INCONSISTENT);

        List<LintResult> results = linter.lintFiles(List.of(good, bad, messy), false, 2);

        assertEquals(3, results.size());
        assertEquals(good.toString(), results.get(0).path());
        assertFalse(results.get(0).hasProblems());
        assertTrue(results.get(1).isFailed());
        assertEquals(2, results.get(2).violations().size());
    }

    @Test
    void testLintFilesWithFixes() throws IOException {
        Path messy = tempDir.resolve("messy.sql");
        Files.writeString(messy, INCONSISTENT);

        List<LintResult> results = linter.lintFiles(List.of(messy), true, 1);

        assertEquals("SELECT id, name\nFROM users\nWHERE active = 1;\n", results.get(0).fixedSource());
        // 文件本身不由 Linter 改写
        assertEquals(INCONSISTENT, Files.readString(messy));
    }

    @Test
    void testFromConfig() {
        LinterConfig config = LinterConfig.defaults();
        config.setDialect("postgres");
        config.setRules(List.of("L014"));
        config.setCapitalisationPolicy("upper");

        Linter configured = Linter.fromConfig(config);

        assertEquals("postgres", configured.getParser().getDialect().getName());
        assertEquals(List.of("L014"), configured.getRules().stream().map(Rule::code).toList());
        assertEquals(2, configured.lint("q.sql", "select a from t").violations().size());
    }
}
