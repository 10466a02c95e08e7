package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;
    // 源码原文，数值字面量按原样输出
    private final String lexeme;

    public Literal(SourceLocation location, Object value, LiteralKind kind, String lexeme) {
        super(location);
        this.value = value;
        this.kind = kind;
        this.lexeme = lexeme;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getLexeme() {
        return lexeme;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        BOOL
    }
}
