package com.rusticlang.compiler.analysis.types;

/**
 * 结构化类型表示基类。
 * 封闭的类型变体：原始类型、结构体、列表、未解析类型以及内置签名中使用的类型变量。
 */
public abstract class RusticType {

    /**
     * 返回类型的简单名称（如 "int", "Point", "list"）。
     */
    public abstract String getTypeName();

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 TypeVisitor 进行类型分派 */
    public abstract <R> R accept(TypeVisitor<R> visitor);

    /** 按值复制的类型（int, float, bool） */
    public boolean isCopy() {
        return false;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
