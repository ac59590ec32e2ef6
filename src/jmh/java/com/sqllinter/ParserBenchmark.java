package com.sqllinter;

import com.sqllinter.dialect.Dialects;
import com.sqllinter.lint.LintResult;
import com.sqllinter.lint.Linter;
import com.sqllinter.parser.ParsedFile;
import com.sqllinter.parser.Parser;
import com.sqllinter.rule.CapitalisationPolicy;
import com.sqllinter.rule.StandardRules;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 解析与检查性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ParserBenchmark {

    @State(Scope.Thread)
    public static class SourceState {
        Parser parser;
        Linter linter;
        String source;

        @Setup
        public void setup() {
            parser = new Parser(Dialects.get("ansi"));
            linter = new Linter(parser, StandardRules.select(List.of("L010", "L014"), CapitalisationPolicy.CONSISTENT));
            StringBuilder builder = new StringBuilder();
            // 200 条语句，大小写故意混杂
            for (int i = 0; i < 200; i++) {
                builder.append(generateStatement(i)).append(";\n");
            }
            source = builder.toString();
        }
    }

    @State(Scope.Benchmark)
    public static class FilesState {
        Path tempDir;
        List<Path> files;
        Linter linter;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("sqllint-benchmark");
            files = new ArrayList<>();
            // 创建100个测试文件
            for (int i = 0; i < 100; i++) {
                StringBuilder builder = new StringBuilder();
                for (int j = 0; j < 20; j++) {
                    builder.append(generateStatement(i * 20 + j)).append(";\n");
                }
                Path file = tempDir.resolve("query" + i + ".sql");
                Files.writeString(file, builder.toString());
                files.add(file);
            }
            linter = new Linter(Dialects.get("ansi"),
                    StandardRules.select(List.of("L010", "L014"), CapitalisationPolicy.CONSISTENT));
        }

        @TearDown
        public void tearDown() throws IOException {
            if (!Files.exists(tempDir)) return;
            try (Stream<Path> paths = Files.walk(tempDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    static String generateStatement(int index) {
        return switch (index % 4) {
            case 0 -> "SELECT id, name, CASE WHEN score > " + index + " THEN 'high' ELSE 'low' END AS band "
                    + "FROM users u LEFT JOIN orders o ON o.user_id = u.id WHERE u.active = 1 ORDER BY name";
            case 1 -> "select count(*) AS total from events where kind IN ('a', 'b') group by day";
            case 2 -> "UPDATE accounts SET balance = balance + " + index + " WHERE id = " + index;
            default -> "insert into audit_log (event) values ('run " + index + "')";
        };
    }

    @Benchmark
    public ParsedFile parseThroughput(SourceState state) {
        return state.parser.parse(state.source);
    }

    @Benchmark
    public LintResult fixThroughput(SourceState state) {
        return state.linter.fix("bench.sql", state.source);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public List<LintResult> lintFilesLatency(FilesState state) throws IOException {
        return state.linter.lintFiles(state.files, false, 4);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(ParserBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
