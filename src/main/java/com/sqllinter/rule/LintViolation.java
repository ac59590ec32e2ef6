package com.sqllinter.rule;

import com.sqllinter.segment.Segment;

/**
 * 一条违规记录。
 *
 * @param ruleCode    规则编码，如 L010
 * @param segmentType 违规段的类型
 * @param lineNo      行号（从 1 开始）
 * @param linePos     列号（从 1 开始）
 * @param description 违规描述
 * @param segment     违规段本身，修复按身份定位它
 * @param fix         修复，无法修复时为 null
 */
public record LintViolation(String ruleCode, String segmentType, int lineNo, int linePos,
                            String description, Segment segment, Fix fix) {

    /** 规则执行失败时使用的段类型 */
    public static final String RULE_ERROR_TYPE = "rule_error";

    public static LintViolation of(String ruleCode, Segment segment, String description, Fix fix) {
        return new LintViolation(ruleCode, segment.type(), segment.position().lineNo(),
                segment.position().linePos(), description, segment, fix);
    }

    /**
     * 规则自身抛出异常时的占位违规，定位在文件开头。
     */
    public static LintViolation ruleError(String ruleCode, Segment root, String message) {
        return new LintViolation(ruleCode, RULE_ERROR_TYPE, 1, 1, "规则执行失败: " + message, root, null);
    }

    public boolean isFixable() {
        return fix != null;
    }

    public LintViolation withoutFix() {
        return new LintViolation(ruleCode, segmentType, lineNo, linePos, description, segment, null);
    }

    public String describe() {
        return String.format("L:%4d | P:%4d | %s | %s", lineNo, linePos, ruleCode, description);
    }
}
