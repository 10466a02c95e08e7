package com.rusticlang.compiler.ast.type;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 具名类型（如 int, string, Point）
 */
public final class NamedTypeRef extends TypeRef {
    private final String name;

    public NamedTypeRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toSourceString() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedTypeRef(this, context);
    }
}
