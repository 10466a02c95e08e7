package com.rusticlang.compiler.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Rust 标识符转换：避开 Rust 关键字与生成代码依赖的类型名
 */
public final class RustNames {

    private RustNames() {}

    private static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            // 严格关键字
            "as", "break", "const", "continue", "else", "enum", "extern", "false", "fn", "for",
            "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref",
            "return", "static", "struct", "trait", "true", "type", "unsafe", "use", "where",
            "while", "async", "await", "dyn",
            // 保留关键字
            "abstract", "become", "box", "do", "final", "macro", "override", "priv", "typeof",
            "unsized", "virtual", "yield", "try", "gen"
    )));

    // 不能写成 r#name 的关键字
    private static final Set<String> NON_RAW = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "self", "Self", "super", "crate"
    )));

    // 生成代码直接引用的类型与路径，用户声明同名符号会遮蔽它们
    private static final Set<String> PRELUDE = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "String", "Vec", "str", "i64", "f64", "bool", "usize", "std"
    )));

    /**
     * 转换为合法的 Rust 标识符
     *
     * <p>关键字写成 r#name；不能写成原始标识符的关键字与 String、Vec 等预置名字加一个下划线后缀。
     * 为保证不同的名字映射到不同的标识符，形如 self_、String__ 的名字同样多加一个下划线。</p>
     */
    public static String ident(String name) {
        if (KEYWORDS.contains(name)) {
            return "r#" + name;
        }
        if (isReserved(stripUnderscores(name))) {
            return name + "_";
        }
        return name;
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name) || NON_RAW.contains(name);
    }

    /**
     * 是否必须改名才能在生成代码中使用
     */
    public static boolean isReserved(String name) {
        return NON_RAW.contains(name) || PRELUDE.contains(name);
    }

    private static String stripUnderscores(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '_') {
            end--;
        }
        return name.substring(0, end);
    }
}
