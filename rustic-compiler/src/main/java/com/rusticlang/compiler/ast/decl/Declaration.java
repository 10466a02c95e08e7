package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;
    /** 名称标识符的精确位置，null 表示与声明位置相同 */
    private SourceLocation nameLocation;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public SourceLocation getNameLocation() {
        return nameLocation != null ? nameLocation : location;
    }

    public void setNameLocation(SourceLocation loc) {
        this.nameLocation = loc;
    }
}
