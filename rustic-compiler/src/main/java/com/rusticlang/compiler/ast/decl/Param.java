package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Param extends AstNode {
    private final String name;
    private final TypeRef type;
    private final Expression defaultValue;  // null 表示调用时必须传入
    private int symbolId = -1;

    public Param(SourceLocation location, String name, TypeRef type) {
        this(location, name, type, null);
    }

    public Param(SourceLocation location, String name, TypeRef type, Expression defaultValue) {
        super(location);
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    /** 默认值，只能是字面量或带负号的数字字面量 */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public void setSymbolId(int symbolId) {
        this.symbolId = symbolId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParam(this, context);
    }
}
