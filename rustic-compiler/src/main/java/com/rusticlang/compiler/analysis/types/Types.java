package com.rusticlang.compiler.analysis.types;

/**
 * 预定义类型常量和工厂方法。
 */
public final class Types {

    private Types() {}

    public static final PrimitiveType INT = new PrimitiveType("int");
    public static final PrimitiveType FLOAT = new PrimitiveType("float");
    public static final PrimitiveType BOOL = new PrimitiveType("bool");
    public static final PrimitiveType STRING = new PrimitiveType("string");
    public static final PrimitiveType VOID = new PrimitiveType("void");

    public static final UnresolvedType UNRESOLVED = UnresolvedType.INSTANCE;

    /** 创建 list[elem] 类型 */
    public static ListType listOf(RusticType elem) {
        return new ListType(elem);
    }

    /** 根据类型名查找内置原始类型，非内置返回 null */
    public static PrimitiveType fromName(String name) {
        switch (name) {
            case "int": return INT;
            case "float": return FLOAT;
            case "bool": return BOOL;
            case "string": return STRING;
            case "void": return VOID;
            default: return null;
        }
    }

    public static boolean isString(RusticType type) {
        return STRING.equals(type);
    }

    public static boolean isVoid(RusticType type) {
        return VOID.equals(type);
    }

    public static boolean isNumeric(RusticType type) {
        return INT.equals(type) || FLOAT.equals(type);
    }

    /** 是否包含类型变量 */
    public static boolean isGeneric(RusticType type) {
        if (type instanceof TypeVariable) return true;
        if (type instanceof ListType) return isGeneric(((ListType) type).getElementType());
        return false;
    }
}
