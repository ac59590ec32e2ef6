package com.sqllinter.parser;

import com.sqllinter.segment.CompositeSegment;

import java.util.List;

/**
 * 单个文件的解析结果：语法树根节点与其中收集到的解析错误。
 *
 * @param source  原文
 * @param dialect 解析使用的方言名称
 * @param tree    file 类型的根节点，原文与 source 完全一致
 * @param errors  按出现顺序排列的解析错误
 */
public record ParsedFile(String source, String dialect, CompositeSegment tree, List<ParseError> errors) {

    public ParsedFile {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String toTreeString() {
        return tree.toTreeString();
    }
}
