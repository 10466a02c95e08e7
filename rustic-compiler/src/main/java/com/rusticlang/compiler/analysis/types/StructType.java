package com.rusticlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 结构体类型，按名称区分。字段信息存放在结构体符号上。
 */
public final class StructType extends RusticType {

    private final String name;

    public StructType(String name) {
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

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        return name.equals(((StructType) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("struct", name);
    }
}
