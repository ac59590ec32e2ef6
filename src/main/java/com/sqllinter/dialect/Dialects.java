package com.sqllinter.dialect;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 内置方言注册表，按名称提供冻结后的共享实例。
 */
public final class Dialects {
    private static final Map<String, Supplier<Dialect>> FACTORIES = Map.of(
            AnsiDialect.NAME, AnsiDialect::create,
            PostgresDialect.NAME, PostgresDialect::create,
            MySqlDialect.NAME, MySqlDialect::create);

    private static final Map<String, Dialect> CACHE = new ConcurrentHashMap<>();

    private Dialects() {
    }

    /**
     * 按名称获取方言（不区分大小写），未知名称抛出 IllegalArgumentException。
     */
    public static Dialect get(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("方言名称不能为空");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        Supplier<Dialect> factory = FACTORIES.get(key);
        if (factory == null) {
            throw new IllegalArgumentException("未知方言: " + name + "，可选: " + names());
        }
        return CACHE.computeIfAbsent(key, ignored -> factory.get().seal());
    }

    public static Set<String> names() {
        return new TreeSet<>(FACTORIES.keySet());
    }
}
