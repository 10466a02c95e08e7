package com.rusticlang.compiler.analysis.types;

import java.util.Objects;

/**
 * 类型变量，仅出现在内置函数签名中（如 list.push(list[T], T)）
 */
public final class TypeVariable extends RusticType {

    private final String name;

    public TypeVariable(String name) {
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
        return visitor.visitTypeVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeVariable)) return false;
        return name.equals(((TypeVariable) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("var", name);
    }
}
