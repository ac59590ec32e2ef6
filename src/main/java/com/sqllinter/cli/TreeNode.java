package com.sqllinter.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法树的 JSON 形态：叶子带原文，复合节点带子节点，零宽标记省略。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(String type, int lineNo, int linePos, String raw, List<TreeNode> children) {

    public static TreeNode from(Segment segment) {
        if (!(segment instanceof CompositeSegment)) {
            return new TreeNode(segment.type(), segment.position().lineNo(), segment.position().linePos(),
                    segment.raw(), null);
        }
        List<TreeNode> children = new ArrayList<>();
        for (Segment child : segment.children()) {
            if (!child.isMeta()) {
                children.add(from(child));
            }
        }
        return new TreeNode(segment.type(), segment.position().lineNo(), segment.position().linePos(), null, children);
    }
}
