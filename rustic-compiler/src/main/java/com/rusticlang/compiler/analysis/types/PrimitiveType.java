package com.rusticlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 原始类型: int, float, bool, string, void
 */
public final class PrimitiveType extends RusticType {

    private final String name;

    PrimitiveType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    public boolean isNumeric() {
        return this == Types.INT || this == Types.FLOAT;
    }

    @Override
    public boolean isCopy() {
        return this == Types.INT || this == Types.FLOAT || this == Types.BOOL;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return name.equals(((PrimitiveType) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("primitive", name);
    }
}
