package com.rusticlang.compiler.ownership;

/**
 * 参数传递方式，按声明顺序构成单调格：COPY &lt; SHARED &lt; EXCLUSIVE &lt; MOVE
 */
public enum ParamMode {
    /** int / float / bool 按值复制 */
    COPY,
    /** 共享引用 */
    SHARED,
    /** 独占引用 */
    EXCLUSIVE,
    /** 获取所有权 */
    MOVE;

    public boolean isReference() {
        return this == SHARED || this == EXCLUSIVE;
    }

    static ParamMode max(ParamMode a, ParamMode b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
