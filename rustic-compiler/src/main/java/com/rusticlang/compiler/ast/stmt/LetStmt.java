package com.rusticlang.compiler.ast.stmt;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.type.TypeRef;

/**
 * 变量声明：let x: T = e（不可重新赋值）或 var x: T = e
 */
public class LetStmt extends Statement {
    private final String name;
    private final boolean reassignable;
    private final TypeRef type;
    private final Expression initializer;
    private final SourceLocation nameLocation;
    private int symbolId = -1;

    public LetStmt(SourceLocation location, String name, boolean reassignable, TypeRef type,
                   Expression initializer, SourceLocation nameLocation) {
        super(location);
        this.name = name;
        this.reassignable = reassignable;
        this.type = type;
        this.initializer = initializer;
        this.nameLocation = nameLocation;
    }

    public String getName() {
        return name;
    }

    /** true = var */
    public boolean isReassignable() {
        return reassignable;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public SourceLocation getNameLocation() {
        return nameLocation;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public void setSymbolId(int symbolId) {
        this.symbolId = symbolId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
