package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.stdlib.MappingEntry;

import java.util.List;

/**
 * 函数调用：f(a, b) 或内置模块调用 math.sqrt(x)
 */
public class CallExpr extends Expression {
    private final String module;  // null 表示调用本模块函数
    private final String name;
    private final SourceLocation nameLocation;
    private final List<Expression> args;

    // 语义分析后填充（二者其一）
    private int functionSymbolId = -1;
    private MappingEntry builtin;

    public CallExpr(SourceLocation location, String module, String name, SourceLocation nameLocation,
                    List<Expression> args) {
        super(location);
        this.module = module;
        this.name = name;
        this.nameLocation = nameLocation;
        this.args = args;
    }

    public String getModule() {
        return module;
    }

    public boolean isBuiltinCall() {
        return module != null;
    }

    public String getName() {
        return name;
    }

    /** 调用名，内置调用为 module.name */
    public String getQualifiedName() {
        return module != null ? module + "." + name : name;
    }

    public SourceLocation getNameLocation() {
        return nameLocation;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public int getFunctionSymbolId() {
        return functionSymbolId;
    }

    public void setFunctionSymbolId(int functionSymbolId) {
        this.functionSymbolId = functionSymbolId;
    }

    public MappingEntry getBuiltin() {
        return builtin;
    }

    public void setBuiltin(MappingEntry builtin) {
        this.builtin = builtin;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
