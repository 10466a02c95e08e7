package com.rusticlang.compiler.ast.type;

import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 类型引用基类（源码中书写的类型）
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后解析的结构化类型
    protected RusticType resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public RusticType getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(RusticType type) {
        this.resolvedType = type;
    }

    /** 源码形式，用于诊断消息 */
    public abstract String toSourceString();
}
