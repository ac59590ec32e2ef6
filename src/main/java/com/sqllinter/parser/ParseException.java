package com.sqllinter.parser;

/**
 * 解析过程中的致命错误：语法定义递归过深，或解析结果无法还原原文。
 *
 * <p>普通的语法错误不会抛出此异常，而是以 unparsable 段的形式留在树中。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
