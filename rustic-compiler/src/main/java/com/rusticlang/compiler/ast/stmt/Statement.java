package com.rusticlang.compiler.ast.stmt;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
