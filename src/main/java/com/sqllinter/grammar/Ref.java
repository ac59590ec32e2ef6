package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.List;
import java.util.Objects;

/**
 * 按名称延迟引用方言中的语法，匹配时才解析。
 *
 * <p>派生方言覆盖某个名称后，所有引用该名称的语法自动使用新定义，无需重写语法图。
 */
public final class Ref extends BaseGrammar<Ref> {
    private final String target;

    private Ref(String target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    private Ref(Ref other) {
        super(other);
        this.target = other.target;
    }

    public static Ref of(String target) {
        return new Ref(target);
    }

    public String target() {
        return target;
    }

    @Override
    protected Ref copy() {
        return new Ref(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty()) {
            return MatchResult.noMatch(segments);
        }
        Grammar resolved = context.resolve(target);
        context.enter(target);
        try {
            return resolved.match(segments, context);
        } finally {
            context.exit();
        }
    }

    @Override
    public String describe() {
        return target;
    }
}
