package com.rusticlang.compiler.ownership;

/**
 * 表达式所处的使用上下文
 */
enum UseKind {
    CONSUME,         // 需要所有权：初始化、返回、按值实参、字段/元素、for 迭代对象
    READ,            // 只读：运算数、比较、条件
    BORROW_ARG,      // 共享借用实参
    BORROW_MUT_ARG,  // 独占借用实参
    RECEIVER,        // 只读方法接收者
    RECEIVER_MUT,    // 可变方法接收者（两阶段借用）
    MUTATE;          // 字段赋值的根

    boolean isExclusive() {
        return this == BORROW_MUT_ARG || this == RECEIVER_MUT || this == MUTATE;
    }

    boolean isBorrow() {
        return this != CONSUME;
    }
}
