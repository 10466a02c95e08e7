package com.rusticlang.compiler.ast.stmt;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;

/**
 * For-in 循环：for x in items { ... }
 */
public class ForStmt extends Statement {
    private final String variable;
    private final SourceLocation variableLocation;
    private final Expression iterable;
    private final Block body;
    private int symbolId = -1;

    public ForStmt(SourceLocation location, String variable, SourceLocation variableLocation,
                   Expression iterable, Block body) {
        super(location);
        this.variable = variable;
        this.variableLocation = variableLocation;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public SourceLocation getVariableLocation() {
        return variableLocation;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public void setSymbolId(int symbolId) {
        this.symbolId = symbolId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
