package com.rusticlang.compiler.ast.stmt;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;

/**
 * 赋值语句：x = e 或 a.b.c = e
 */
public class AssignStmt extends Statement {
    // Identifier 或以 Identifier 为根的 FieldAccessExpr
    private final Expression target;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
