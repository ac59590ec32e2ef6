package com.sqllinter.lint;

import com.sqllinter.config.LinterConfig;
import com.sqllinter.dialect.Dialect;
import com.sqllinter.dialect.Dialects;
import com.sqllinter.lexer.LexException;
import com.sqllinter.parser.ParseException;
import com.sqllinter.parser.ParsedFile;
import com.sqllinter.parser.Parser;
import com.sqllinter.rule.CapitalisationPolicy;
import com.sqllinter.rule.Fix;
import com.sqllinter.rule.LintViolation;
import com.sqllinter.rule.Rule;
import com.sqllinter.rule.RuleContext;
import com.sqllinter.rule.RuleEvaluationException;
import com.sqllinter.rule.StandardRules;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * 检查流程：解析、逐条执行规则、按需应用并校验修复。
 *
 * <p>各条规则相互隔离，一条规则抛出异常只会产生一条 rule_error 违规，不影响其他规则。
 * 修复应用后会用同一方言重新解析，未通过校验的修复被拒绝，对应违规标记为不可修复。
 */
public class Linter {
    private static final Logger logger = LoggerFactory.getLogger(Linter.class);

    private static final Comparator<LintViolation> POSITION_ORDER = Comparator
            .comparingInt(LintViolation::lineNo)
            .thenComparingInt(LintViolation::linePos)
            .thenComparing(LintViolation::ruleCode);

    private final Parser parser;
    private final List<Rule> rules;

    public Linter(Dialect dialect, List<Rule> rules) {
        this(new Parser(dialect), rules);
    }

    public Linter(Parser parser, List<Rule> rules) {
        this.parser = parser;
        this.rules = List.copyOf(rules);
    }

    /**
     * 按配置构建：方言、启用的规则、大小写策略与解析深度。
     */
    public static Linter fromConfig(LinterConfig config) {
        Dialect dialect = Dialects.get(config.getDialect());
        CapitalisationPolicy policy = CapitalisationPolicy.fromString(config.getCapitalisationPolicy());
        return new Linter(new Parser(dialect, config.getMaxParseDepth()),
                StandardRules.select(config.getRules(), policy));
    }

    public Parser getParser() {
        return parser;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public LintResult lint(String path, String source) {
        return run(path, source, false);
    }

    /**
     * 检查并应用所有通过校验的修复，结果中的 fixedSource 为修复后的文本。
     */
    public LintResult fix(String path, String source) {
        return run(path, source, true);
    }

    private LintResult run(String path, String source, boolean applyFixes) {
        ParsedFile parsed;
        try {
            parsed = parser.parse(source);
        } catch (LexException exception) {
            logger.warn("词法分析失败: {} - {}", path, exception.getMessage());
            return LintResult.failed(path, source, exception.getMessage());
        } catch (ParseException exception) {
            logger.warn("语法分析失败: {} - {}", path, exception.getMessage());
            return LintResult.failed(path, source, exception.getMessage());
        }
        List<LintViolation> violations = evaluate(parsed);
        if (!applyFixes) {
            return new LintResult(path, source, parsed.errors(), violations, null, null);
        }
        FixOutcome outcome = applyFixes(parsed, violations);
        return new LintResult(path, source, parsed.errors(), outcome.violations(), outcome.fixedSource(), null);
    }

    /**
     * 在已解析的文件上执行全部规则，结果按位置排序。
     */
    public List<LintViolation> evaluate(ParsedFile parsed) {
        List<LintViolation> violations = new ArrayList<>();
        for (Rule rule : rules) {
            try {
                violations.addAll(evaluateRule(rule, parsed));
            } catch (RuntimeException exception) {
                logger.warn("规则 {} 执行失败: {}", rule.code(), exception.getMessage(), exception);
                violations.add(LintViolation.ruleError(rule.code(), parsed.tree(), exception.getMessage()));
            }
        }
        violations.sort(POSITION_ORDER);
        return violations;
    }

    private static List<LintViolation> evaluateRule(Rule rule, ParsedFile parsed) {
        RuleContext context = new RuleContext(rule, parsed);
        List<LintViolation> found = new ArrayList<>();
        for (Segment segment : parsed.tree().recursiveCrawl(rule.targetTypes())) {
            rule.evaluator().evaluate(segment, context).ifPresent(found::add);
        }
        return found;
    }

    // ==================== 修复 ====================

    private record FixOutcome(List<LintViolation> violations, String fixedSource) {
    }

    private FixOutcome applyFixes(ParsedFile parsed, List<LintViolation> violations) {
        Set<LintViolation> rejected = Collections.newSetFromMap(new IdentityHashMap<>());
        List<LintViolation> fixable = new ArrayList<>();
        for (LintViolation violation : violations) {
            if (!violation.isFixable()) {
                continue;
            }
            if (isNoOp(violation.fix())) {
                logger.warn("拒绝规则 {} 在第 {} 行第 {} 列的修复: 修复不改变原文", violation.ruleCode(),
                        violation.lineNo(), violation.linePos());
                rejected.add(violation);
            } else {
                fixable.add(violation);
            }
        }
        if (fixable.isEmpty()) {
            return new FixOutcome(markRejected(violations, rejected), parsed.source());
        }
        try {
            return new FixOutcome(markRejected(violations, rejected), verifiedSource(parsed, fixable));
        } catch (RuleEvaluationException exception) {
            logger.warn("整体修复未通过校验，逐条重试: {}", exception.getMessage());
        }

        List<LintViolation> accepted = new ArrayList<>();
        for (LintViolation violation : fixable) {
            try {
                verifiedSource(parsed, List.of(violation));
                accepted.add(violation);
            } catch (RuleEvaluationException exception) {
                logger.warn("拒绝规则 {} 在第 {} 行第 {} 列的修复: {}", violation.ruleCode(),
                        violation.lineNo(), violation.linePos(), exception.getMessage());
                rejected.add(violation);
            }
        }
        String fixedSource = parsed.source();
        if (!accepted.isEmpty()) {
            try {
                fixedSource = verifiedSource(parsed, accepted);
            } catch (RuleEvaluationException exception) {
                logger.warn("单条可用的修复组合后仍未通过校验，全部拒绝: {}", exception.getMessage());
                rejected.addAll(accepted);
            }
        }
        return new FixOutcome(markRejected(violations, rejected), fixedSource);
    }

    private static List<LintViolation> markRejected(List<LintViolation> violations, Set<LintViolation> rejected) {
        if (rejected.isEmpty()) {
            return violations;
        }
        List<LintViolation> marked = new ArrayList<>(violations.size());
        for (LintViolation violation : violations) {
            marked.add(rejected.contains(violation) ? violation.withoutFix() : violation);
        }
        return marked;
    }

    /**
     * 所有编辑的替换文本都与原文相同。
     */
    private static boolean isNoOp(Fix fix) {
        return fix.edits().stream().allMatch(edit -> edit.replacement().raw().equals(edit.target().raw()));
    }

    /**
     * 应用修复并用同一方言重新解析，文本无法解析或出现新的解析错误时抛出 {@link RuleEvaluationException}。
     */
    private String verifiedSource(ParsedFile parsed, List<LintViolation> toApply) {
        String ruleCodes = toApply.stream()
                .map(LintViolation::ruleCode)
                .distinct()
                .collect(Collectors.joining(","));
        List<Fix> fixes = toApply.stream().map(LintViolation::fix).collect(Collectors.toList());
        CompositeSegment fixedTree = FixApplier.apply(parsed.tree(), fixes);
        String fixedSource = fixedTree.raw();

        ParsedFile reparsed;
        try {
            reparsed = parser.parse(fixedSource);
        } catch (LexException | ParseException exception) {
            throw new RuleEvaluationException(ruleCodes, "修复后的文本无法重新解析: " + exception.getMessage(), exception);
        }
        if (reparsed.errors().size() > parsed.errors().size()) {
            throw new RuleEvaluationException(ruleCodes, "修复后出现新的无法解析区域: "
                    + reparsed.errors().get(0).describe());
        }
        return fixedSource;
    }

    // ==================== 多文件 ====================

    /**
     * 并行检查多个文件。所有文本先读入内存再开始解析，单个文件失败不影响其他文件。
     */
    public List<LintResult> lintFiles(List<Path> files, boolean applyFixes, int threads) throws IOException {
        Map<Path, String> sources = new LinkedHashMap<>();
        for (Path file : files) {
            sources.put(file, Files.readString(file, StandardCharsets.UTF_8));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            Map<Path, Future<LintResult>> futures = new LinkedHashMap<>();
            for (Map.Entry<Path, String> entry : sources.entrySet()) {
                String path = entry.getKey().toString();
                String source = entry.getValue();
                futures.put(entry.getKey(), executor.submit(() -> run(path, source, applyFixes)));
            }
            List<LintResult> results = new ArrayList<>(futures.size());
            for (Map.Entry<Path, Future<LintResult>> entry : futures.entrySet()) {
                results.add(await(entry.getKey(), sources.get(entry.getKey()), entry.getValue()));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static LintResult await(Path file, String source, Future<LintResult> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IOException("检查被中断: " + file, exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause() == null ? exception : exception.getCause();
            logger.error("检查文件失败: {}", file, cause);
            return LintResult.failed(file.toString(), source, cause.getMessage());
        }
    }
}
