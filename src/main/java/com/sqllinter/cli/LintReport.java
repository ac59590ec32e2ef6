package com.sqllinter.cli;

import com.sqllinter.lint.LintResult;
import com.sqllinter.parser.ParseError;
import com.sqllinter.rule.LintViolation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 报告结构，只包含可序列化的平面数据。
 */
public record LintReport(Instant generatedAt, String dialect, int fileCount, int violationCount,
                         List<FileReport> files) {

    public record FileReport(String path, String failure, List<ParseError> parseErrors,
                             List<ViolationReport> violations) {
    }

    public record ViolationReport(String ruleCode, String segmentType, int lineNo, int linePos,
                                  String description, boolean fixable) {

        static ViolationReport from(LintViolation violation) {
            return new ViolationReport(violation.ruleCode(), violation.segmentType(), violation.lineNo(),
                    violation.linePos(), violation.description(), violation.isFixable());
        }
    }

    public static LintReport from(String dialect, List<LintResult> results) {
        List<FileReport> files = new ArrayList<>(results.size());
        int violationCount = 0;
        for (LintResult result : results) {
            List<ViolationReport> violations = new ArrayList<>(result.violations().size());
            for (LintViolation violation : result.violations()) {
                violations.add(ViolationReport.from(violation));
            }
            violationCount += violations.size();
            files.add(new FileReport(result.path(), result.failure(), result.parseErrors(), violations));
        }
        return new LintReport(Instant.now(), dialect, results.size(), violationCount, files);
    }
}
