package com.sqllinter.grammar;

/**
 * 组合子的公共配置：optional 与 codeOnly。
 *
 * <p>所有配置方法都返回新实例，已构造的语法对象不可变，可在多个方言和线程间共享。
 *
 * @param <G> 具体组合子类型
 */
public abstract class BaseGrammar<G extends BaseGrammar<G>> implements Grammar {
    /** 在序列中缺失时允许跳过，默认 false */
    private boolean optional;
    /** 自动跳过元素之间的空白与注释，默认 true */
    private boolean codeOnly = true;

    protected BaseGrammar() {
    }

    protected BaseGrammar(BaseGrammar<G> other) {
        this.optional = other.optional;
        this.codeOnly = other.codeOnly;
    }

    /**
     * 复制当前配置，供各配置方法修改。
     */
    protected abstract G copy();

    public G optional() {
        G copy = copy();
        BaseGrammar<G> base = copy;
        base.optional = true;
        return copy;
    }

    public G codeOnly(boolean enabled) {
        G copy = copy();
        BaseGrammar<G> base = copy;
        base.codeOnly = enabled;
        return copy;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    public boolean isCodeOnly() {
        return codeOnly;
    }

    @Override
    public String toString() {
        return describe();
    }
}
