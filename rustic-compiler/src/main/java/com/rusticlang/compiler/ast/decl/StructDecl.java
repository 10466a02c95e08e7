package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Declaration {
    private final List<FieldDecl> fields;

    public StructDecl(SourceLocation location, String name, List<FieldDecl> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
