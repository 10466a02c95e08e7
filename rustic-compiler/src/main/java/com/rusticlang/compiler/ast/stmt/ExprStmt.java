package com.rusticlang.compiler.ast.stmt;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public class ExprStmt extends Statement {
    private final Expression expression;

    public ExprStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExprStmt(this, context);
    }
}
