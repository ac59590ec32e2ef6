package com.sqllinter.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sqllinter.config.ConfigLoader;
import com.sqllinter.config.Constants;
import com.sqllinter.config.LinterConfig;
import com.sqllinter.dialect.Dialects;
import com.sqllinter.lexer.LexException;
import com.sqllinter.lint.LintResult;
import com.sqllinter.lint.Linter;
import com.sqllinter.lint.SqlFileCollector;
import com.sqllinter.parser.ParseError;
import com.sqllinter.parser.ParsedFile;
import com.sqllinter.parser.Parser;
import com.sqllinter.rule.LintViolation;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "sqllint",
    description = "🧹 方言可扩展的 SQL 风格检查工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.LintSubcommand.class,
        MainCommand.FixSubcommand.class,
        MainCommand.ParseSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "配置文件路径，默认读取当前目录下的 " + Constants.CONFIG_FILE_NAME)
    private Path configFile;

    @Option(names = {"--dialect"}, description = "SQL 方言 (ansi|postgres|mysql)")
    private String dialect;

    @Option(names = {"--rules"}, split = ",", description = "启用的规则编码，逗号分隔，例如 L010,L014")
    private List<String> rules;

    @Option(names = {"--policy"}, description = "大小写策略 (consistent|upper|lower|capitalise)")
    private String policy;

    @Option(names = {"--threads"}, description = "检查线程数")
    private Integer threads;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧹 方言可扩展的 SQL 风格检查工具");
        System.out.println("可用方言: " + Dialects.names());
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 读取配置文件，再用命令行选项覆盖。
     */
    LinterConfig resolveConfig() throws IOException {
        LinterConfig config = configFile != null
                ? ConfigLoader.load(configFile)
                : ConfigLoader.loadFromDirectory(Path.of("").toAbsolutePath());
        if (dialect != null) {
            config.setDialect(dialect);
        }
        if (rules != null && !rules.isEmpty()) {
            config.setRules(rules);
        }
        if (policy != null) {
            config.setCapitalisationPolicy(policy);
        }
        if (threads != null) {
            config.setThreads(threads);
        }
        return config;
    }

    int resolveThreadCount(LinterConfig config) {
        int requested = config.getThreads();
        if (requested <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", requested, Constants.DEFAULT_LINT_THREADS);
            return Constants.DEFAULT_LINT_THREADS;
        }
        if (requested > Constants.MAX_LINT_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", requested, Constants.MAX_LINT_THREADS);
            return Constants.MAX_LINT_THREADS;
        }
        return requested;
    }

    static ObjectMapper jsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static void printTextResults(List<LintResult> results) {
        for (LintResult result : results) {
            if (!result.hasProblems()) {
                continue;
            }
            System.out.println("== [" + result.path() + "]");
            if (result.isFailed()) {
                System.out.println("❌ " + result.failure());
                continue;
            }
            for (ParseError error : result.parseErrors()) {
                System.out.println("❌ " + error.describe());
            }
            for (LintViolation violation : result.violations()) {
                System.out.println(violation.describe());
            }
        }
    }

    static void printSummary(List<LintResult> results) {
        long problemFiles = results.stream().filter(LintResult::hasProblems).count();
        long violations = results.stream().mapToLong(result -> result.violations().size()).sum();
        long parseErrors = results.stream().mapToLong(result -> result.parseErrors().size()).sum();
        System.out.println();
        System.out.printf("📊 共检查 %d 个文件，%d 个文件存在问题，违规 %d 条，解析错误 %d 处%n",
                results.size(), problemFiles, violations, parseErrors);
    }

    @Command(name = "lint", description = "🔎 检查 SQL 文件")
    static class LintSubcommand implements Callable<Integer> {

        @Parameters(description = "要检查的文件或目录", arity = "1..*")
        private List<Path> paths;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LinterConfig config = main.resolveConfig();
                Linter linter = Linter.fromConfig(config);
                List<Path> files = SqlFileCollector.collect(paths);
                List<LintResult> results = linter.lintFiles(files, false, main.resolveThreadCount(config));

                if ("json".equalsIgnoreCase(format)) {
                    LintReport report = LintReport.from(config.getDialect(), results);
                    System.out.println(jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(report));
                } else {
                    printTextResults(results);
                    printSummary(results);
                }
                return results.stream().anyMatch(LintResult::hasProblems) ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 检查失败: " + exception.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "fix", description = "🔧 修复可自动修复的违规并写回文件")
    static class FixSubcommand implements Callable<Integer> {

        @Parameters(description = "要修复的文件或目录", arity = "1..*")
        private List<Path> paths;

        @Option(names = {"--yes"}, description = "确认写回文件，否则只预览")
        private boolean confirmed;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LinterConfig config = main.resolveConfig();
                Linter linter = Linter.fromConfig(config);
                List<Path> files = SqlFileCollector.collect(paths);
                List<LintResult> results = linter.lintFiles(files, true, main.resolveThreadCount(config));

                int changed = 0;
                boolean remaining = false;
                for (LintResult result : results) {
                    if (result.isChanged()) {
                        changed++;
                        if (confirmed) {
                            Files.writeString(Path.of(result.path()), result.fixedSource(), StandardCharsets.UTF_8);
                        }
                        System.out.printf("🔧 %s: 修复 %d 处%n", result.path(), result.fixableCount());
                    }
                    if (result.isFailed() || !result.parseErrors().isEmpty()
                            || result.violations().stream().anyMatch(violation -> !violation.isFixable())) {
                        remaining = true;
                    }
                }
                if (!confirmed && changed > 0) {
                    System.out.println("⚠️ 预览模式，未写回文件；使用 --yes 确认修复");
                }
                System.out.printf("📊 共 %d 个文件，%d 个文件%s修改%n", results.size(), changed, confirmed ? "已" : "可");
                return remaining ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 修复失败: " + exception.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "parse", description = "🌳 打印 SQL 文件的语法树")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "要解析的文件", arity = "1")
        private Path path;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                LinterConfig config = main.resolveConfig();
                Parser parser = new Parser(Dialects.get(config.getDialect()), config.getMaxParseDepth());
                ParsedFile parsed = parser.parse(Files.readString(path, StandardCharsets.UTF_8));

                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(jsonMapper().writerWithDefaultPrettyPrinter()
                            .writeValueAsString(TreeNode.from(parsed.tree())));
                } else {
                    System.out.print(parsed.toTreeString());
                }
                for (ParseError error : parsed.errors()) {
                    System.err.println("❌ " + error.describe());
                }
                return parsed.hasErrors() ? 1 : 0;
            } catch (LexException exception) {
                System.err.println("❌ " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 解析失败: " + exception.getMessage());
                return 2;
            }
        }
    }
}
