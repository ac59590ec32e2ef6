package com.sqllinter.rule;

import java.util.Locale;

/**
 * 大小写策略：consistent 以文件中首次出现的风格为准，其余为固定风格。
 */
public enum CapitalisationPolicy {
    CONSISTENT,
    UPPER,
    LOWER,
    CAPITALISE;

    public static CapitalisationPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("大小写策略不能为空");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // 兼容美式拼写
        if (normalized.equals("CAPITALIZE")) {
            return CAPITALISE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("未知大小写策略: " + value
                    + "，可选: consistent, upper, lower, capitalise", exception);
        }
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
