package com.sqllinter.grammar;

import com.sqllinter.config.Constants;
import com.sqllinter.dialect.Dialect;
import com.sqllinter.parser.ParseException;

/**
 * 单个文件解析期间的上下文：当前方言与递归深度。
 *
 * <p>每个文件独占一个实例，不在线程间共享；共享的只有只读的方言。
 */
public final class ParseContext {
    private final Dialect dialect;
    private final int maxDepth;
    private int depth;

    public ParseContext(Dialect dialect) {
        this(dialect, Constants.MAX_PARSE_DEPTH);
    }

    public ParseContext(Dialect dialect, int maxDepth) {
        this.dialect = dialect;
        this.maxDepth = maxDepth;
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * 按名称在当前方言中解析语法。
     */
    public Grammar resolve(String name) {
        return dialect.resolve(name);
    }

    void enter(String name) {
        depth++;
        if (depth > maxDepth) {
            throw new ParseException("语法嵌套超过最大深度 " + maxDepth + "，最后进入: " + name);
        }
    }

    void exit() {
        depth--;
    }

    public int depth() {
        return depth;
    }
}
