package com.rusticlang.compiler.analysis.types;

import java.util.Map;

/**
 * 类型兼容性检查。
 *
 * <p>唯一的隐式转换是 int 到 float 的拓宽，且只发生在调用、赋值、初始化、
 * 返回、结构体字段和列表元素等边界处，算术运算内部不拓宽。</p>
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * 检查 source 类型的值是否可以放入 target 类型的位置
     */
    public static boolean isAssignable(RusticType target, RusticType source) {
        if (target == null || source == null) return false;
        if (target.equals(source)) return true;
        return needsWidening(target, source);
    }

    /** 是否需要 int → float 拓宽 */
    public static boolean needsWidening(RusticType target, RusticType source) {
        return Types.FLOAT.equals(target) && Types.INT.equals(source);
    }

    /**
     * 把签名类型与实参类型做匹配，同时绑定类型变量。
     *
     * @param pattern  可能含类型变量的签名类型
     * @param actual   实参类型
     * @param bindings 已有绑定，成功时就地更新
     * @return 匹配成功返回 true
     */
    public static boolean unify(RusticType pattern, RusticType actual, Map<String, RusticType> bindings) {
        return unify(pattern, actual, bindings, true);
    }

    private static boolean unify(RusticType pattern, RusticType actual, Map<String, RusticType> bindings,
                                 boolean allowWidening) {
        if (pattern instanceof TypeVariable) {
            String name = ((TypeVariable) pattern).getName();
            RusticType bound = bindings.get(name);
            if (bound == null) {
                if (Types.isVoid(actual)) return false;
                bindings.put(name, actual);
                return true;
            }
            return allowWidening ? isAssignable(bound, actual) : bound.equals(actual);
        }
        if (pattern instanceof ListType) {
            if (!(actual instanceof ListType)) return false;
            // 列表元素不做拓宽：list[int] 不是 list[float]
            return unify(((ListType) pattern).getElementType(), ((ListType) actual).getElementType(),
                    bindings, false);
        }
        return allowWidening ? isAssignable(pattern, actual) : pattern.equals(actual);
    }

    /** 用绑定替换类型中的类型变量，未绑定的变量保持原样 */
    public static RusticType substitute(RusticType type, Map<String, RusticType> bindings) {
        if (type instanceof TypeVariable) {
            RusticType bound = bindings.get(((TypeVariable) type).getName());
            return bound != null ? bound : type;
        }
        if (type instanceof ListType) {
            return Types.listOf(substitute(((ListType) type).getElementType(), bindings));
        }
        return type;
    }
}
