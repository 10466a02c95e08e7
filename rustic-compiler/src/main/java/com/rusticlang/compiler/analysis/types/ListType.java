package com.rusticlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 列表类型 list[T]
 */
public final class ListType extends RusticType {

    private final RusticType elementType;

    public ListType(RusticType elementType) {
        this.elementType = elementType;
    }

    public RusticType getElementType() {
        return elementType;
    }

    @Override
    public String getTypeName() {
        return "list";
    }

    @Override
    public String toDisplayString() {
        return "list[" + elementType.toDisplayString() + "]";
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListType)) return false;
        return elementType.equals(((ListType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("list", elementType);
    }
}
