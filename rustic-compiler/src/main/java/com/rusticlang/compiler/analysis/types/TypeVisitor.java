package com.rusticlang.compiler.analysis.types;

/**
 * RusticType 访问者接口，用于替代 instanceof 分派。
 */
public interface TypeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitStruct(StructType type);
    R visitList(ListType type);
    R visitTypeVariable(TypeVariable type);
    R visitUnresolved(UnresolvedType type);
}
