package com.sqllinter.dialect;

/**
 * 在方言中找不到按名称引用的语法时抛出，属于语法定义错误而非输入错误。
 */
public class UnresolvedReferenceException extends RuntimeException {
    private final String dialectName;
    private final String reference;

    public UnresolvedReferenceException(String dialectName, String reference) {
        super("方言 '" + dialectName + "' 中未定义语法: " + reference);
        this.dialectName = dialectName;
        this.reference = reference;
    }

    public String getDialectName() {
        return dialectName;
    }

    public String getReference() {
        return reference;
    }
}
