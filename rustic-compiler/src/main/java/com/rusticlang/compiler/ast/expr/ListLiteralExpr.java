package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 列表字面量：[a, b, c]
 */
public class ListLiteralExpr extends Expression {
    private final List<Expression> elements;

    public ListLiteralExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListLiteralExpr(this, context);
    }
}
