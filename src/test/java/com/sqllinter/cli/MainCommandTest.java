package com.sqllinter.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqllinter.config.Constants;
import com.sqllinter.config.LinterConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {
    private static final String INCONSISTENT = "SELECT id, name\nfrom users\nWhere active = 1;\n";

    @TempDir
    Path tempDir;

    @Test
    void testCallPrintsUsageHint() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--dialect", "postgres", "--rules", "L010,L014",
                "lint", "-f", "json", "a.sql");

        assertNotNull(parseResult.subcommand());
        assertEquals("lint", parseResult.subcommand().commandSpec().name());
        assertEquals(List.of("L010", "L014"), parseResult.matchedOptionValue("--rules", List.of()));
    }

    @Test
    void testResolveConfigAppliesOverrides() throws Exception {
        Path configFile = Files.writeString(tempDir.resolve("config.json"),
                "{\"dialect\": \"mysql\", \"capitalisationPolicy\": \"lower\", \"threads\": 2}");
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "configFile", configFile);
        setField(mainCommand, "dialect", "postgres");
        setField(mainCommand, "rules", List.of("L014"));

        LinterConfig config = mainCommand.resolveConfig();

        assertEquals("postgres", config.getDialect());
        assertEquals(List.of("L014"), config.getRules());
        assertEquals("lower", config.getCapitalisationPolicy());
        assertEquals(2, config.getThreads());
    }

    @Test
    void testResolveThreadCountFallsBack() {
        MainCommand mainCommand = new MainCommand();
        LinterConfig config = LinterConfig.defaults();

        config.setThreads(0);
        assertEquals(Constants.DEFAULT_LINT_THREADS, mainCommand.resolveThreadCount(config));
        config.setThreads(1000);
        assertEquals(Constants.MAX_LINT_THREADS, mainCommand.resolveThreadCount(config));
        config.setThreads(4);
        assertEquals(4, mainCommand.resolveThreadCount(config));
    }

    @Test
    void testLintSubcommandTextOutput() throws Exception {
        Path file = Files.writeString(tempDir.resolve("messy.sql"), INCONSISTENT);
        MainCommand.LintSubcommand lint = new MainCommand.LintSubcommand();
        setField(lint, "main", mainWithDefaults());
        setField(lint, "paths", List.of(file));
        setField(lint, "format", "text");

        CapturedRun run = capture(lint);

        assertEquals(1, run.exitCode());
        assertTrue(run.output().contains("== [" + file + "]"));
        assertTrue(run.output().contains("L:   2 | P:   1 | L010 |"));
        assertTrue(run.output().contains("📊"));
    }

    @Test
    void testLintSubcommandJsonOutput() throws Exception {
        Path file = Files.writeString(tempDir.resolve("messy.sql"), INCONSISTENT);
        MainCommand.LintSubcommand lint = new MainCommand.LintSubcommand();
        setField(lint, "main", mainWithDefaults());
        setField(lint, "paths", List.of(tempDir));
        setField(lint, "format", "json");

        CapturedRun run = capture(lint);

        assertEquals(1, run.exitCode());
        JsonNode report = MainCommand.jsonMapper().readTree(run.output());
        assertEquals("ansi", report.get("dialect").asText());
        assertEquals(1, report.get("fileCount").asInt());
        assertEquals(2, report.get("violationCount").asInt());
        JsonNode violation = report.get("files").get(0).get("violations").get(0);
        assertEquals("L010", violation.get("ruleCode").asText());
        assertTrue(violation.get("fixable").asBoolean());
        assertTrue(report.get("generatedAt").isTextual());
        assertEquals(file.toString(), report.get("files").get(0).get("path").asText());
    }

    @Test
    void testLintCleanFileReturnsZero() throws Exception {
        Path file = Files.writeString(tempDir.resolve("clean.sql"), "SELECT a FROM t;\n");
        MainCommand.LintSubcommand lint = new MainCommand.LintSubcommand();
        setField(lint, "main", mainWithDefaults());
        setField(lint, "paths", List.of(file));
        setField(lint, "format", "text");

        assertEquals(0, capture(lint).exitCode());
    }

    @Test
    void testLintMissingPathReturnsTwo() throws Exception {
        MainCommand.LintSubcommand lint = new MainCommand.LintSubcommand();
        setField(lint, "main", mainWithDefaults());
        setField(lint, "paths", List.of(tempDir.resolve("nowhere.sql")));
        setField(lint, "format", "text");

        assertEquals(2, capture(lint).exitCode());
    }

    @Test
    void testFixSubcommandPreviewDoesNotWrite() throws Exception {
        Path file = Files.writeString(tempDir.resolve("messy.sql"), INCONSISTENT);
        MainCommand.FixSubcommand fix = new MainCommand.FixSubcommand();
        setField(fix, "main", mainWithDefaults());
        setField(fix, "paths", List.of(file));

        CapturedRun run = capture(fix);

        assertEquals(0, run.exitCode());
        assertTrue(run.output().contains("--yes"));
        assertEquals(INCONSISTENT, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testFixSubcommandWritesWhenConfirmed() throws Exception {
        Path file = Files.writeString(tempDir.resolve("messy.sql"), INCONSISTENT);
        MainCommand.FixSubcommand fix = new MainCommand.FixSubcommand();
        setField(fix, "main", mainWithDefaults());
        setField(fix, "paths", List.of(file));
        setField(fix, "confirmed", true);

        assertEquals(0, capture(fix).exitCode());
        assertEquals("SELECT id, name\nFROM users\nWHERE active = 1;\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testFixSubcommandReportsUnparsableRemainder() throws Exception {
        Path file = Files.writeString(tempDir.resolve("broken.sql"), "select a from t;\nfoo bar;\n");
        MainCommand.FixSubcommand fix = new MainCommand.FixSubcommand();
        setField(fix, "main", mainWithDefaults());
        setField(fix, "paths", List.of(file));
        setField(fix, "confirmed", true);

        assertEquals(1, capture(fix).exitCode());
    }

    @Test
    void testParseSubcommandTextAndJson() throws Exception {
        Path file = Files.writeString(tempDir.resolve("query.sql"), "select a from t");
        MainCommand.ParseSubcommand parse = new MainCommand.ParseSubcommand();
        setField(parse, "main", mainWithDefaults());
        setField(parse, "path", file);
        setField(parse, "format", "text");

        CapturedRun text = capture(parse);
        assertEquals(0, text.exitCode());
        assertTrue(text.output().contains("select_statement:"));

        setField(parse, "format", "json");
        CapturedRun json = capture(parse);
        assertEquals(0, json.exitCode());
        JsonNode tree = MainCommand.jsonMapper().readTree(json.output());
        assertEquals("file", tree.get("type").asText());
        assertTrue(tree.get("children").isArray());
        assertTrue(json.output().contains("\"raw\" : \"select\""));
    }

    @Test
    void testParseSubcommandLexErrorReturnsOne() throws Exception {
        Path file = Files.writeString(tempDir.resolve("bad.sql"), "select @");
        MainCommand.ParseSubcommand parse = new MainCommand.ParseSubcommand();
        setField(parse, "main", mainWithDefaults());
        setField(parse, "path", file);
        setField(parse, "format", "text");

        assertEquals(1, capture(parse).exitCode());
    }

    @Test
    void testExecuteThroughCommandLine() throws Exception {
        Path file = Files.writeString(tempDir.resolve("upper.sql"), "select a from t;\n");
        Path config = tempDir.resolve("absent.json");

        int exitCode = new CommandLine(new MainCommand()).execute(
                "--config", config.toString(), "--policy", "upper", "--rules", "L010", "lint", file.toString());

        assertEquals(1, exitCode);
    }

    private MainCommand mainWithDefaults() throws Exception {
        MainCommand mainCommand = new MainCommand();
        // 指向不存在的文件，避免读到工作目录中的配置
        setField(mainCommand, "configFile", tempDir.resolve("absent.json"));
        setField(mainCommand, "threads", 2);
        return mainCommand;
    }

    private record CapturedRun(int exitCode, String output) {
    }

    private static CapturedRun capture(Callable<Integer> command) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int exitCode;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            exitCode = command.call();
        } finally {
            System.setOut(originalOut);
        }
        return new CapturedRun(exitCode, outputBuffer.toString(StandardCharsets.UTF_8));
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
