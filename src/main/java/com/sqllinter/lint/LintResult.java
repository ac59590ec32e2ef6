package com.sqllinter.lint;

import com.sqllinter.parser.ParseError;
import com.sqllinter.rule.LintViolation;

import java.util.List;

/**
 * 单个文件的检查结果。
 *
 * @param path        文件路径或调用方给出的名称
 * @param source      原文
 * @param parseErrors 解析错误
 * @param violations  按位置排序的违规
 * @param fixedSource 修复后的文本，仅在修复模式下非 null
 * @param failure     文件级致命错误（如词法错误），正常时为 null
 */
public record LintResult(String path, String source, List<ParseError> parseErrors,
                         List<LintViolation> violations, String fixedSource, String failure) {

    public LintResult {
        parseErrors = List.copyOf(parseErrors);
        violations = List.copyOf(violations);
    }

    public static LintResult failed(String path, String source, String failure) {
        return new LintResult(path, source, List.of(), List.of(), null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public boolean hasProblems() {
        return isFailed() || !parseErrors.isEmpty() || !violations.isEmpty();
    }

    /**
     * 修复模式下文本是否发生了变化。
     */
    public boolean isChanged() {
        return fixedSource != null && !fixedSource.equals(source);
    }

    public long fixableCount() {
        return violations.stream().filter(LintViolation::isFixable).count();
    }
}
