package com.rusticlang.compiler.ownership;

/**
 * 单个使用点上的所有权决策
 */
public enum OwnershipDecision {
    /** 转移所有权，原绑定此后不可再用 */
    MOVE,
    /** 共享借用（&x） */
    BORROW_SHARED,
    /** 独占借用（&mut x） */
    BORROW_EXCLUSIVE,
    /** 显式复制后转移副本 */
    CLONE
}
