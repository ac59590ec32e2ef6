package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;

/**
 * 语法匹配器：在一段相邻兄弟段上匹配前缀。
 *
 * <p>失败时不消费任何输入；成功时返回对已消费区间的重组结果。匹配是输入切片的纯函数，
 * 匹配器本身无状态、可复用，可以通过 {@link Ref} 按名称引用其他语法。
 */
public interface Grammar {

    /**
     * 匹配 segments 的前缀。
     */
    MatchResult match(List<Segment> segments, ParseContext context);

    /**
     * 在序列中缺失时是否允许跳过。
     */
    boolean isOptional();

    /**
     * 用于错误提示的期望描述。
     */
    String describe();
}
