package com.sqllinter.config;

import java.util.List;

/**
 * 全局常量定义
 * 
 * 包含默认方言、默认规则集、解析参数和线程参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 方言参数 ====================
    /** 默认方言名称 */
    public static final String DEFAULT_DIALECT = "ansi";

    // ==================== 规则参数 ====================
    /** 默认启用的规则编码 */
    public static final List<String> DEFAULT_RULES = List.of("L010", "L014");
    /** 默认大小写策略 */
    public static final String DEFAULT_CAPITALISATION_POLICY = "consistent";

    // ==================== 解析参数 ====================
    /** 段展开的最大递归深度，超过视为语法定义错误 */
    public static final int MAX_PARSE_DEPTH = 255;
    /** 错误信息中展示的源码上下文字符数 */
    public static final int ERROR_CONTEXT_CHARS = 40;

    // ==================== 文件参数 ====================
    /** 目录扫描时收集的文件后缀 */
    public static final String SQL_FILE_EXTENSION = ".sql";
    /** 默认配置文件名 */
    public static final String CONFIG_FILE_NAME = ".sqllint.json";

    // ==================== 线程参数 ====================
    /** 默认检查工作线程数 */
    public static final int DEFAULT_LINT_THREADS = Runtime.getRuntime().availableProcessors();
    /** 检查线程数安全上限 */
    public static final int MAX_LINT_THREADS = 64;
}
