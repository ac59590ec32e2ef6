package com.sqllinter.rule;

import com.sqllinter.segment.Segment;

import java.util.Optional;

/**
 * 规则的检测与修复逻辑，对每个目标类型的段按文档顺序调用一次。
 *
 * <p>实现本身应无状态，跨段的记忆放在 {@link RuleContext} 中。
 */
@FunctionalInterface
public interface RuleEvaluator {

    Optional<LintViolation> evaluate(Segment segment, RuleContext context);
}
