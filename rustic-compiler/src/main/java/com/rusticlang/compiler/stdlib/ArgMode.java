package com.rusticlang.compiler.stdlib;

/**
 * 内置函数实参的所有权要求
 */
public enum ArgMode {
    /** 按值传递，非 Copy 值被消费 */
    VALUE,
    /** 共享借用（&T） */
    REF,
    /** 独占借用（&mut T） */
    REF_MUT,
    /** 方法接收者，只读 */
    RECEIVER,
    /** 方法接收者，可变（两阶段借用） */
    RECEIVER_MUT;

    public boolean isExclusive() {
        return this == REF_MUT || this == RECEIVER_MUT;
    }

    public boolean isReceiver() {
        return this == RECEIVER || this == RECEIVER_MUT;
    }
}
