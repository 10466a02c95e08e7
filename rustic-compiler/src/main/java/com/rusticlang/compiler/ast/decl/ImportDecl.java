package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 导入声明：import math / import a.b
 */
public class ImportDecl extends AstNode {
    private final List<String> parts;

    public ImportDecl(SourceLocation location, List<String> parts) {
        super(location);
        this.parts = parts;
    }

    public List<String> getParts() {
        return parts;
    }

    public String getFullName() {
        return String.join(".", parts);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
