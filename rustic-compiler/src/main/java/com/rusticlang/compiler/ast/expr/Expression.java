package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    // 类型信息（语义分析后填充）
    protected RusticType type;
    // int 在 float 位置上被隐式拓宽
    protected boolean widened;

    protected Expression(SourceLocation location) {
        super(location);
    }

    public RusticType getType() {
        return type;
    }

    public void setType(RusticType type) {
        this.type = type;
    }

    public boolean isWidened() {
        return widened;
    }

    public void setWidened(boolean widened) {
        this.widened = widened;
    }

    /** 是否为位置表达式（标识符或以标识符为根的字段路径） */
    public boolean isPlace() {
        return false;
    }
}
