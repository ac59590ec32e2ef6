package com.sqllinter.grammar;

import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 一个或多个元素，由分隔符隔开。
 *
 * <p>先在顶层（括号之外）定位分隔符，把输入切成片段，再要求每个片段完整匹配元素语法，
 * 从而把失败局部化。末尾悬空的分隔符默认视为匹配失败。
 */
public final class Delimited extends BaseGrammar<Delimited> {
    private final Grammar element;
    /** 分隔符语法，必须设置 */
    private Grammar delimiter;
    /** 遇到即停止扫描的终止符，默认无 */
    private Grammar terminator;
    /** 至少需要的分隔符数量，默认 0 */
    private int minDelimiters;
    /** 是否允许末尾悬空的分隔符，默认 false */
    private boolean allowTrailing;

    private Delimited(Grammar element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    private Delimited(Delimited other) {
        super(other);
        this.element = other.element;
        this.delimiter = other.delimiter;
        this.terminator = other.terminator;
        this.minDelimiters = other.minDelimiters;
        this.allowTrailing = other.allowTrailing;
    }

    public static Delimited of(Grammar element, Grammar delimiter) {
        return new Delimited(element).delimiter(delimiter);
    }

    public Delimited delimiter(Grammar newDelimiter) {
        Delimited copy = copy();
        copy.delimiter = Objects.requireNonNull(newDelimiter, "delimiter");
        return copy;
    }

    public Delimited terminator(Grammar newTerminator) {
        Delimited copy = copy();
        copy.terminator = newTerminator;
        return copy;
    }

    public Delimited minDelimiters(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("minDelimiters 不能为负数: " + count);
        }
        Delimited copy = copy();
        copy.minDelimiters = count;
        return copy;
    }

    public Delimited allowTrailing(boolean allowed) {
        Delimited copy = copy();
        copy.allowTrailing = allowed;
        return copy;
    }

    @Override
    protected Delimited copy() {
        return new Delimited(this);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        int size = segments.size();
        List<Segment> matched = new ArrayList<>();
        int delimiterCount = 0;
        int chunkStart = 0;
        int index = 0;

        while (index < size) {
            Segment current = segments.get(index);
            if (isCodeOnly() && !current.isCode()) {
                index++;
                continue;
            }
            List<Segment> tail = segments.subList(index, size);
            if (terminator != null && terminator.match(tail, context).hasMatch()) {
                break;
            }
            if (SegmentScan.isOpenBracket(current)) {
                int close = SegmentScan.findClosingBracket(segments, index);
                index = close < 0 ? size : close + 1;
                continue;
            }
            MatchResult delimiterMatch = delimiter.match(tail, context);
            if (!delimiterMatch.hasMatch()) {
                index++;
                continue;
            }
            List<Segment> elementMatch = matchWhole(segments.subList(chunkStart, index), context);
            if (elementMatch == null) {
                // 片段不是合法元素，交给下面的尾部匹配处理
                break;
            }
            matched.addAll(elementMatch);
            matched.addAll(delimiterMatch.matched());
            delimiterCount++;
            index += delimiterMatch.consumedFrom(tail);
            chunkStart = index;
        }

        List<Segment> rest = segments.subList(chunkStart, size);
        boolean endsWithDelimiter = delimiterCount > 0;
        boolean restHasContent = isCodeOnly() ? SegmentScan.hasCode(rest) : !rest.isEmpty();
        if (restHasContent) {
            int skip = isCodeOnly() ? SegmentScan.firstCodeIndex(rest, 0) : 0;
            MatchResult tailMatch = element.match(rest.subList(skip, rest.size()), context);
            if (tailMatch.hasMatch()) {
                matched.addAll(rest.subList(0, skip));
                matched.addAll(tailMatch.matched());
                rest = tailMatch.unmatched();
                endsWithDelimiter = false;
            } else if (delimiterCount == 0) {
                return MatchResult.noMatch(segments);
            }
        }
        if (delimiterCount == 0 && matched.isEmpty()) {
            return MatchResult.noMatch(segments);
        }
        if (endsWithDelimiter && !allowTrailing) {
            return MatchResult.noMatch(segments);
        }
        if (delimiterCount < minDelimiters) {
            return MatchResult.noMatch(segments);
        }
        return MatchResult.of(matched, rest);
    }

    /**
     * 要求整个片段完整匹配元素语法，codeOnly 时首尾的非代码段原样保留；失败返回 null。
     */
    private List<Segment> matchWhole(List<Segment> chunk, ParseContext context) {
        int start = 0;
        int end = chunk.size();
        if (isCodeOnly()) {
            start = SegmentScan.firstCodeIndex(chunk, 0);
            if (start < 0) {
                return null;
            }
            end = SegmentScan.lastCodeIndex(chunk) + 1;
        } else if (chunk.isEmpty()) {
            return null;
        }
        MatchResult result = element.match(chunk.subList(start, end), context);
        if (!result.hasMatch() || !result.isComplete()) {
            return null;
        }
        List<Segment> whole = new ArrayList<>(chunk.subList(0, start));
        whole.addAll(result.matched());
        whole.addAll(chunk.subList(end, chunk.size()));
        return whole;
    }

    @Override
    public String describe() {
        return "Delimited(" + element.describe() + " / " + delimiter.describe() + ")";
    }
}
