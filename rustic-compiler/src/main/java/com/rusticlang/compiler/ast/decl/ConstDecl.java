package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.type.TypeRef;

/**
 * 常量声明：const MAX: int = 10
 */
public class ConstDecl extends Declaration {
    private final TypeRef type;
    private final Expression value;
    private int symbolId = -1;

    public ConstDecl(SourceLocation location, String name, TypeRef type, Expression value) {
        super(location, name);
        this.type = type;
        this.value = value;
    }

    public TypeRef getType() {
        return type;
    }

    /** 字面量，或取负的数值字面量 */
    public Expression getValue() {
        return value;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public void setSymbolId(int symbolId) {
        this.symbolId = symbolId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}
