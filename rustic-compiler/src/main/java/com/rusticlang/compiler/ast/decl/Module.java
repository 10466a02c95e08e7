package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 编译单元（一个 .rsc 源文件）
 */
public class Module extends AstNode {
    private final String name;
    private final List<ImportDecl> imports;
    private final List<Declaration> declarations;

    public Module(SourceLocation location, String name, List<ImportDecl> imports, List<Declaration> declarations) {
        super(location);
        this.name = name;
        this.imports = imports;
        this.declarations = declarations;
    }

    public String getName() {
        return name;
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    /** 按源码顺序排列的 struct / const / fn 声明 */
    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<StructDecl> getStructs() {
        List<StructDecl> result = new ArrayList<StructDecl>();
        for (Declaration d : declarations) {
            if (d instanceof StructDecl) result.add((StructDecl) d);
        }
        return result;
    }

    public List<FnDecl> getFunctions() {
        List<FnDecl> result = new ArrayList<FnDecl>();
        for (Declaration d : declarations) {
            if (d instanceof FnDecl) result.add((FnDecl) d);
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
