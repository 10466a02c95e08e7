package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 字段访问：a.b
 */
public class FieldAccessExpr extends Expression {
    private final Expression receiver;
    private final String field;
    private final SourceLocation fieldLocation;

    public FieldAccessExpr(SourceLocation location, Expression receiver, String field, SourceLocation fieldLocation) {
        super(location);
        this.receiver = receiver;
        this.field = field;
        this.fieldLocation = fieldLocation;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getField() {
        return field;
    }

    public SourceLocation getFieldLocation() {
        return fieldLocation;
    }

    /** 字段路径的根标识符，根不是标识符时返回 null */
    public Identifier getRoot() {
        Expression e = receiver;
        while (e instanceof FieldAccessExpr) {
            e = ((FieldAccessExpr) e).getReceiver();
        }
        return e instanceof Identifier ? (Identifier) e : null;
    }

    @Override
    public boolean isPlace() {
        return getRoot() != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
