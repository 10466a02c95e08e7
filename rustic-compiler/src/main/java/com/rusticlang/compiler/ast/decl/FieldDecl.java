package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.type.TypeRef;

/**
 * 结构体字段
 */
public class FieldDecl extends AstNode {
    private final String name;
    private final TypeRef type;

    public FieldDecl(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}
