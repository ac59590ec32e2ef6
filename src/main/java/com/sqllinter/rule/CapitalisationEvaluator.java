package com.sqllinter.rule;

import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 大小写一致性检测：识别每个目标词符合的风格，与策略（或已出现的风格）不符时给出改写修复。
 *
 * <p>一个词可能同时符合多种风格（如 {@code A} 既是全大写也是首字母大写），只要其中之一仍未被否定就不算违规。
 * consistent 策略下，每个合规的词会否定它不符合的风格；大小写混杂的词总是违规，且不会成为后续判断的依据。
 * 无大小写之分的词（如运算符、数字）直接跳过。
 */
public final class CapitalisationEvaluator implements RuleEvaluator {
    private static final String REFUTED_STYLES = "refuted_styles";

    /** 词的大小写风格，顺序即无参照时的修复优先级 */
    enum CaseStyle {
        UPPER,
        LOWER,
        CAPITALISE
    }

    private final CapitalisationPolicy policy;

    public CapitalisationEvaluator(CapitalisationPolicy policy) {
        this.policy = policy;
    }

    public CapitalisationPolicy policy() {
        return policy;
    }

    @Override
    public Optional<LintViolation> evaluate(Segment segment, RuleContext context) {
        if (!(segment instanceof RawSegment raw)) {
            return Optional.empty();
        }
        Set<CaseStyle> matching = matchingStyles(raw.raw());
        if (matching == null) {
            return Optional.empty();
        }
        Set<CaseStyle> refuted = context.memory(REFUTED_STYLES, EnumSet.noneOf(CaseStyle.class));
        Set<CaseStyle> allowed = allowedStyles(refuted);
        if (!Collections.disjoint(matching, allowed)) {
            if (policy == CapitalisationPolicy.CONSISTENT) {
                refuted.addAll(EnumSet.complementOf(EnumSet.copyOf(matching)));
            }
            return Optional.empty();
        }

        // allowed 与 matching 不相交，按 allowed 中的首选风格改写必然改变原文
        CaseStyle target = allowed.iterator().next();
        String fixed = apply(target, raw.raw());
        String description = policy == CapitalisationPolicy.CONSISTENT
                ? String.format("'%s' 的大小写与已有风格不一致，应为 '%s'", raw.raw(), fixed)
                : String.format("'%s' 不符合 %s 策略，应为 '%s'", raw.raw(), policy.displayName(), fixed);
        return Optional.of(context.violation(raw, description, Fix.replace(raw, raw.withRaw(fixed))));
    }

    private Set<CaseStyle> allowedStyles(Set<CaseStyle> refuted) {
        if (policy != CapitalisationPolicy.CONSISTENT) {
            return EnumSet.of(CaseStyle.valueOf(policy.name()));
        }
        Set<CaseStyle> allowed = EnumSet.allOf(CaseStyle.class);
        allowed.removeAll(refuted);
        return allowed;
    }

    /**
     * 识别词符合的全部风格；无大小写之分时返回 null，大小写混杂时返回空集合。
     */
    static Set<CaseStyle> matchingStyles(String raw) {
        if (raw.toUpperCase(Locale.ROOT).equals(raw.toLowerCase(Locale.ROOT))) {
            return null;
        }
        Set<CaseStyle> matching = EnumSet.noneOf(CaseStyle.class);
        for (CaseStyle style : CaseStyle.values()) {
            if (apply(style, raw).equals(raw)) {
                matching.add(style);
            }
        }
        return matching;
    }

    static String apply(CaseStyle style, String raw) {
        return switch (style) {
            case UPPER -> raw.toUpperCase(Locale.ROOT);
            case LOWER -> raw.toLowerCase(Locale.ROOT);
            case CAPITALISE -> capitalise(raw);
        };
    }

    /**
     * 首字母大写，其余小写。
     */
    static String capitalise(String raw) {
        if (raw.isEmpty()) {
            return raw;
        }
        return raw.substring(0, 1).toUpperCase(Locale.ROOT) + raw.substring(1).toLowerCase(Locale.ROOT);
    }
}
