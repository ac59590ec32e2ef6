package com.sqllinter.parser;

import com.sqllinter.config.Constants;
import com.sqllinter.dialect.Dialect;
import com.sqllinter.grammar.Grammar;
import com.sqllinter.grammar.MatchResult;
import com.sqllinter.grammar.ParseContext;
import com.sqllinter.grammar.SegmentDefinition;
import com.sqllinter.lexer.LexException;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;
import com.sqllinter.segment.SegmentTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 解析驱动：词法切分后构造根节点，再自顶向下逐层展开 MATCHED 段。
 *
 * <p>展开一个段时先用其解析语法匹配子段，未能匹配的部分包装为 unparsable 段，
 * 然后递归展开子段；没有解析语法的段只递归展开子段。
 * 实例本身无状态，可在多个线程之间共享。
 */
public class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);
    private static final String FILE_SEGMENT = "FileSegment";

    private final Dialect dialect;
    private final int maxDepth;

    public Parser(Dialect dialect) {
        this(dialect, Constants.MAX_PARSE_DEPTH);
    }

    public Parser(Dialect dialect, int maxDepth) {
        if (dialect == null) {
            throw new IllegalArgumentException("方言不能为空");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("最大解析深度必须为正数: " + maxDepth);
        }
        this.dialect = dialect;
        this.maxDepth = maxDepth;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * 解析整段 SQL 文本。
     *
     * @throws LexException   存在无法识别的字符
     * @throws ParseException 语法定义递归过深或结果无法还原原文
     */
    public ParsedFile parse(String source) {
        long startNanos = System.nanoTime();
        List<RawSegment> tokens = dialect.lexer().lex(source);
        SegmentDefinition fileDefinition = dialect.segment(FILE_SEGMENT);
        CompositeSegment root = new CompositeSegment(fileDefinition.type(), fileDefinition.name(),
                new ArrayList<Segment>(tokens), CompositeSegment.State.MATCHED);

        CompositeSegment tree;
        if (tokens.isEmpty()) {
            tree = root.withChildren(List.of(), CompositeSegment.State.PARSED);
        } else {
            tree = expand(root, new ParseContext(dialect, maxDepth));
        }
        if (!tree.raw().equals(source)) {
            throw new ParseException("解析结果无法还原原文，方言 '" + dialect.getName() + "' 的语法定义有误");
        }

        List<ParseError> errors = collectErrors(tree);
        if (logger.isDebugEnabled()) {
            logger.debug("解析完成: {} 个词法单元, {} 个错误, 耗时 {} ms",
                    tokens.size(), errors.size(), (System.nanoTime() - startNanos) / 1_000_000);
        }
        return new ParsedFile(source, dialect.getName(), tree, errors);
    }

    private CompositeSegment expand(CompositeSegment segment, ParseContext context) {
        if (segment.state() == CompositeSegment.State.PARSED) {
            return segment;
        }
        Grammar parseGrammar = parseGrammarOf(segment);
        List<Segment> children;
        if (parseGrammar == null) {
            children = segment.children();
        } else {
            List<Segment> input = segment.childrenWithoutMeta();
            MatchResult result = parseGrammar.match(input, context);
            children = new ArrayList<>();
            if (!result.hasMatch()) {
                appendUnparsable(children, input, parseGrammar.describe());
            } else {
                children.addAll(result.matched());
                appendUnparsable(children, result.unmatched(), parseGrammar.describe());
            }
        }

        List<Segment> expanded = new ArrayList<>(children.size());
        for (Segment child : children) {
            if (child instanceof CompositeSegment composite) {
                expanded.add(expand(composite, context));
            } else {
                expanded.add(child);
            }
        }
        return segment.withChildren(expanded, CompositeSegment.State.PARSED);
    }

    private Grammar parseGrammarOf(CompositeSegment segment) {
        if (!dialect.contains(segment.name())) {
            return null;
        }
        Grammar grammar = dialect.resolve(segment.name());
        return grammar instanceof SegmentDefinition definition ? definition.parseGrammar() : null;
    }

    /**
     * 追加未匹配的段：只含非代码段时原样追加，否则首尾的非代码段留在外面，中间包装为 unparsable。
     */
    private static void appendUnparsable(List<Segment> target, List<Segment> segments, String expected) {
        int first = -1;
        int last = -1;
        for (int index = 0; index < segments.size(); index++) {
            if (segments.get(index).isCode()) {
                if (first < 0) {
                    first = index;
                }
                last = index;
            }
        }
        if (first < 0) {
            target.addAll(segments);
            return;
        }
        target.addAll(segments.subList(0, first));
        target.add(CompositeSegment.unparsable(segments.subList(first, last + 1), expected));
        target.addAll(segments.subList(last + 1, segments.size()));
    }

    private static List<ParseError> collectErrors(CompositeSegment tree) {
        List<ParseError> errors = new ArrayList<>();
        for (Segment unparsable : tree.recursiveCrawl(Set.of(SegmentTypes.UNPARSABLE))) {
            String found = unparsable.raw();
            if (found.length() > Constants.ERROR_CONTEXT_CHARS) {
                found = found.substring(0, Constants.ERROR_CONTEXT_CHARS) + "...";
            }
            String expected = ((CompositeSegment) unparsable).expected();
            errors.add(new ParseError(unparsable.position().lineNo(), unparsable.position().linePos(),
                    found, expected));
        }
        return errors;
    }
}
