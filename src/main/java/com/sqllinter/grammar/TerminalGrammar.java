package com.sqllinter.grammar;

import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;

import java.util.List;
import java.util.Objects;

/**
 * 终结符：只检查第一个段，命中后产出重新标注类型的叶子。
 *
 * @param <G> 具体终结符类型
 */
public abstract class TerminalGrammar<G extends TerminalGrammar<G>> extends BaseGrammar<G> {
    private final String type;
    private final String name;

    protected TerminalGrammar(String type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
    }

    protected TerminalGrammar(TerminalGrammar<G> other) {
        super(other);
        this.type = other.type;
        this.name = other.name;
    }

    /**
     * 判断该词法单元是否被当前终结符接受。
     */
    protected abstract boolean accepts(RawSegment segment);

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        if (segments.isEmpty() || !(segments.get(0) instanceof RawSegment first) || !accepts(first)) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(List.of(first.retag(type, name)), segments.subList(1, segments.size()));
    }

    public String type() {
        return type;
    }

    public String name() {
        return name;
    }
}
