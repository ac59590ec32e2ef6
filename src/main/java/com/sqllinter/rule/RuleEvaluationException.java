package com.sqllinter.rule;

/**
 * 修复应用后的文本无法重新解析时抛出，对应的修复会被拒绝。
 */
public class RuleEvaluationException extends RuntimeException {
    private final String ruleCode;

    public RuleEvaluationException(String ruleCode, String message) {
        super(message);
        this.ruleCode = ruleCode;
    }

    public RuleEvaluationException(String ruleCode, String message, Throwable cause) {
        super(message, cause);
        this.ruleCode = ruleCode;
    }

    public String getRuleCode() {
        return ruleCode;
    }
}
