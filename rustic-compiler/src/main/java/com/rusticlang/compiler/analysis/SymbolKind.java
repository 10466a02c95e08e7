package com.rusticlang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // let/var 局部变量
    PARAMETER,          // 函数参数
    LOOP_VARIABLE,      // for 循环变量
    CONSTANT,           // const 声明
    FUNCTION,           // fn 声明
    STRUCT,             // struct 声明
    MODULE;             // import 导入的内置模块

    /** 可作为值使用的局部绑定 */
    public boolean isLocal() {
        return this == VARIABLE || this == PARAMETER || this == LOOP_VARIABLE;
    }
}
