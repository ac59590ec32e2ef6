package com.sqllinter.rule;

import java.util.Objects;
import java.util.Set;

/**
 * 规则：目标段类型集合加上检测与修复逻辑。
 *
 * <p>派生规则通过 {@link #narrowedTo(String, String, Set)} 只替换目标类型，算法原样继承。
 *
 * @param code        规则编码
 * @param description 规则说明
 * @param targetTypes 关注的段类型
 * @param evaluator   检测与修复逻辑
 */
public record Rule(String code, String description, Set<String> targetTypes, RuleEvaluator evaluator) {

    public Rule {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(evaluator, "evaluator");
        if (targetTypes == null || targetTypes.isEmpty()) {
            throw new IllegalArgumentException("规则 " + code + " 至少需要一个目标类型");
        }
        targetTypes = Set.copyOf(targetTypes);
    }

    /**
     * 复用本规则的算法，只更换编码、说明与目标类型。
     */
    public Rule narrowedTo(String newCode, String newDescription, Set<String> newTargetTypes) {
        return new Rule(newCode, newDescription, newTargetTypes, evaluator);
    }
}
