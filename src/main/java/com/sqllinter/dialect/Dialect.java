package com.sqllinter.dialect;

import com.sqllinter.grammar.Grammar;
import com.sqllinter.grammar.SegmentDefinition;
import com.sqllinter.lexer.Lexer;
import com.sqllinter.lexer.LexerMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 方言：名称到语法的库，外加一张有序的词法规则表。
 *
 * <p>构建阶段可注册、覆盖、派生；{@link #seal()} 之后只读，可在多个线程的解析之间共享。
 * 语法之间通过名称引用，引用在匹配时才解析，所以派生方言的覆盖对基础方言中的引用同样生效。
 */
public final class Dialect {
    private final String name;
    private final Map<String, Grammar> library;
    private final List<LexerMatcher> lexerMatchers;
    private volatile boolean sealed;
    private Lexer lexer;

    public Dialect(String name) {
        this(name, new LinkedHashMap<>(), new ArrayList<>());
    }

    private Dialect(String name, Map<String, Grammar> library, List<LexerMatcher> lexerMatchers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("方言名称不能为空");
        }
        this.name = name;
        this.library = library;
        this.lexerMatchers = lexerMatchers;
    }

    public String getName() {
        return name;
    }

    /**
     * 复制出一个可修改的新方言，库与词法表都是独立副本，修改不会影响本方言。
     */
    public Dialect derive(String newName) {
        return new Dialect(newName, new LinkedHashMap<>(library), new ArrayList<>(lexerMatchers));
    }

    /**
     * 注册新语法，名称已存在时失败；覆盖请使用 {@link #override(String, Grammar)}。
     */
    public Dialect register(String grammarName, Grammar grammar) {
        checkMutable();
        if (library.containsKey(grammarName)) {
            throw new IllegalStateException("方言 '" + name + "' 中重复注册语法: " + grammarName);
        }
        library.put(grammarName, grammar);
        return this;
    }

    public Dialect register(SegmentDefinition definition) {
        return register(definition.name(), definition);
    }

    /**
     * 替换已有语法，名称不存在时失败。
     */
    public Dialect override(String grammarName, Grammar replacement) {
        checkMutable();
        if (!library.containsKey(grammarName)) {
            throw new UnresolvedReferenceException(name, grammarName);
        }
        library.put(grammarName, replacement);
        return this;
    }

    public Dialect override(SegmentDefinition definition) {
        return override(definition.name(), definition);
    }

    /**
     * 按名称查找语法。
     */
    public Grammar resolve(String grammarName) {
        Grammar grammar = library.get(grammarName);
        if (grammar == null) {
            throw new UnresolvedReferenceException(name, grammarName);
        }
        return grammar;
    }

    /**
     * 按名称查找段定义，名称存在但不是段定义时失败。
     */
    public SegmentDefinition segment(String segmentName) {
        Grammar grammar = resolve(segmentName);
        if (!(grammar instanceof SegmentDefinition definition)) {
            throw new IllegalStateException("语法 '" + segmentName + "' 不是段定义");
        }
        return definition;
    }

    public boolean contains(String grammarName) {
        return library.containsKey(grammarName);
    }

    public Set<String> grammarNames() {
        return Collections.unmodifiableSet(library.keySet());
    }

    // ==================== 词法表 ====================

    public Dialect setLexerMatchers(List<LexerMatcher> matchers) {
        checkMutable();
        lexerMatchers.clear();
        lexerMatchers.addAll(matchers);
        return this;
    }

    /**
     * 在指定名称的规则之前插入新规则，用于给方言增加优先级更高的词法单元。
     */
    public Dialect insertLexerMatchers(String before, LexerMatcher... matchers) {
        checkMutable();
        int index = indexOfMatcher(before);
        lexerMatchers.addAll(index, List.of(matchers));
        return this;
    }

    /**
     * 替换同名的词法规则。
     */
    public Dialect replaceLexerMatcher(LexerMatcher replacement) {
        checkMutable();
        lexerMatchers.set(indexOfMatcher(replacement.name()), replacement);
        return this;
    }

    public List<LexerMatcher> getLexerMatchers() {
        return Collections.unmodifiableList(lexerMatchers);
    }

    private int indexOfMatcher(String matcherName) {
        for (int i = 0; i < lexerMatchers.size(); i++) {
            if (lexerMatchers.get(i).name().equals(matcherName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("方言 '" + name + "' 中没有词法规则: " + matcherName);
    }

    // ==================== 生命周期 ====================

    /**
     * 冻结方言并编译词法器，此后任何修改都会失败。
     */
    public synchronized Dialect seal() {
        if (!sealed) {
            lexer = new Lexer(lexerMatchers);
            sealed = true;
        }
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * 获取词法器；未冻结的方言每次按当前词法表新建。
     */
    public Lexer lexer() {
        if (sealed) {
            return lexer;
        }
        return new Lexer(lexerMatchers);
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("方言 '" + name + "' 已冻结，不能再修改");
        }
    }

    @Override
    public String toString() {
        return "Dialect{" + name + ", " + library.size() + " grammars}";
    }
}
