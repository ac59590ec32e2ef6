package com.sqllinter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查器运行时配置
 * 
 * 支持从CLI参数或配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinterConfig {
    private String dialect = Constants.DEFAULT_DIALECT;
    private List<String> rules = new ArrayList<>(Constants.DEFAULT_RULES);
    private String capitalisationPolicy = Constants.DEFAULT_CAPITALISATION_POLICY;
    private int maxParseDepth = Constants.MAX_PARSE_DEPTH;
    private int threads = Constants.DEFAULT_LINT_THREADS;

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public List<String> getRules() {
        return rules;
    }

    public void setRules(List<String> rules) {
        this.rules = rules == null ? new ArrayList<>() : new ArrayList<>(rules);
    }

    public String getCapitalisationPolicy() {
        return capitalisationPolicy;
    }

    public void setCapitalisationPolicy(String capitalisationPolicy) {
        this.capitalisationPolicy = capitalisationPolicy;
    }

    public int getMaxParseDepth() {
        return maxParseDepth;
    }

    public void setMaxParseDepth(int maxParseDepth) {
        this.maxParseDepth = maxParseDepth;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    /**
     * 使用默认配置创建实例
     */
    public static LinterConfig defaults() {
        return new LinterConfig();
    }
}
