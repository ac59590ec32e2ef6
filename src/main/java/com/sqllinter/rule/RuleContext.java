package com.sqllinter.rule;

import com.sqllinter.parser.ParsedFile;
import com.sqllinter.segment.Segment;

import java.util.HashMap;
import java.util.Map;

/**
 * 一条规则在一个文件上的执行上下文，持有该次遍历的记忆。
 */
public final class RuleContext {
    private final Rule rule;
    private final ParsedFile parsedFile;
    private final Map<String, Object> memory = new HashMap<>();

    public RuleContext(Rule rule, ParsedFile parsedFile) {
        this.rule = rule;
        this.parsedFile = parsedFile;
    }

    public Rule rule() {
        return rule;
    }

    public ParsedFile parsedFile() {
        return parsedFile;
    }

    /**
     * 读取记忆，不存在时用 initial 初始化。
     */
    @SuppressWarnings("unchecked")
    public <T> T memory(String key, T initial) {
        return (T) memory.computeIfAbsent(key, ignored -> initial);
    }

    public LintViolation violation(Segment segment, String description, Fix fix) {
        return LintViolation.of(rule.code(), segment, description, fix);
    }
}
