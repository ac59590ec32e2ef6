package com.sqllinter.parser;

/**
 * 树中一个 unparsable 区域的描述。
 *
 * @param lineNo   起始行号（从 1 开始）
 * @param linePos  起始列号（从 1 开始）
 * @param found    无法解析的原文片段，过长时截断
 * @param expected 期望的语法描述
 */
public record ParseError(int lineNo, int linePos, String found, String expected) {

    public String describe() {
        return "第 " + lineNo + " 行第 " + linePos + " 列无法解析: '" + found + "'，期望 " + expected;
    }
}
