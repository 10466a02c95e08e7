package com.rusticlang.compiler.ast.type;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 列表类型：list[T]
 */
public final class ListTypeRef extends TypeRef {
    private final TypeRef elementType;

    public ListTypeRef(SourceLocation location, TypeRef elementType) {
        super(location);
        this.elementType = elementType;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    @Override
    public String toSourceString() {
        return "list[" + elementType.toSourceString() + "]";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListTypeRef(this, context);
    }
}
