package com.rusticlang.compiler.ast.decl;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.stmt.Block;
import com.rusticlang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 函数声明
 */
public class FnDecl extends Declaration {
    private final List<Param> params;
    private final TypeRef returnType;  // 可选，null 表示 void
    private final Block body;
    private int symbolId = -1;

    public FnDecl(SourceLocation location, String name, List<Param> params, TypeRef returnType, Block body) {
        super(location, name);
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<Param> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public Block getBody() {
        return body;
    }

    public int getSymbolId() {
        return symbolId;
    }

    public void setSymbolId(int symbolId) {
        this.symbolId = symbolId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFnDecl(this, context);
    }
}
