package com.rusticlang.compiler.analysis.types;

/**
 * 未解析类型（单例）。解析完成后不应再出现在 AST 上。
 */
public final class UnresolvedType extends RusticType {

    public static final UnresolvedType INSTANCE = new UnresolvedType();

    private UnresolvedType() {
    }

    @Override
    public String getTypeName() {
        return "<unresolved>";
    }

    @Override
    public String toDisplayString() {
        return "<unresolved>";
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitUnresolved(this);
    }

    @Override
    public boolean equals(Object o) {
        return o == this;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
