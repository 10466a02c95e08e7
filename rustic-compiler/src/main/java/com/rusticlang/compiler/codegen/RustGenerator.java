package com.rusticlang.compiler.codegen;

import com.rusticlang.compiler.analysis.Symbol;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.decl.*;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.ownership.FunctionContract;
import com.rusticlang.compiler.ownership.OwnershipTable;

import java.util.List;
import java.util.logging.Logger;

/**
 * Rust 代码生成器
 *
 * <p>遍历经过类型与所有权分析的 AST，按声明顺序输出 Rust 源码。
 * 输出只依赖 AST 与分析结果，相同输入总是得到逐字节相同的输出。</p>
 */
public class RustGenerator implements AstVisitor<Void, GeneratorContext> {

    private static final Logger LOG = Logger.getLogger(RustGenerator.class.getName());

    private final SymbolTable symbols;
    private final OwnershipTable ownership;
    private final RustExprEmitter exprs;
    private final RustTypeMapper types = RustTypeMapper.INSTANCE;

    public RustGenerator(SymbolTable symbols, OwnershipTable ownership) {
        this.symbols = symbols;
        this.ownership = ownership;
        this.exprs = new RustExprEmitter(symbols, ownership);
    }

    /**
     * 生成模块源码
     */
    public String generate(Module module, GeneratorConfig config) {
        GeneratorContext ctx = new GeneratorContext(config);
        visitModule(module, ctx);
        String output = ctx.getOutput();
        LOG.fine("Generated " + output.length() + " chars for module '" + module.getName() + "'");
        return output;
    }

    /**
     * 使用默认配置生成
     */
    public String generate(Module module) {
        return generate(module, new GeneratorConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitModule(Module node, GeneratorContext ctx) {
        String header = ctx.getConfig().getHeaderComment();
        if (header != null && !header.isEmpty()) {
            for (String line : header.split("\n", -1)) {
                ctx.line(line.isEmpty() ? "//" : "// " + line);
            }
            ctx.line("// Source module: " + node.getName());
            ctx.newLine();
        }
        ctx.line("#![allow(dead_code, unused_parens)]");

        for (Declaration decl : node.getDeclarations()) {
            ctx.blankLine();
            decl.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, GeneratorContext ctx) {
        ctx.line("#[derive(Debug, Clone, PartialEq)]");
        String name = RustNames.ident(node.getName());
        if (node.getFields().isEmpty()) {
            ctx.line("pub struct " + name + " {}");
            return null;
        }
        ctx.line("pub struct " + name + " {");
        ctx.indent();
        for (FieldDecl field : node.getFields()) {
            ctx.line("pub " + RustNames.ident(field.getName()) + ": "
                    + types.map(field.getType().getResolvedType()) + ",");
        }
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, GeneratorContext ctx) {
        ctx.line("pub const " + RustNames.ident(node.getName()) + ": "
                + types.map(node.getType().getResolvedType()) + " = " + exprs.emit(node.getValue()) + ";");
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, GeneratorContext ctx) {
        Symbol fn = symbols.get(node.getSymbolId());
        FunctionContract contract = ownership.getContract(node.getSymbolId());

        StringBuilder sig = new StringBuilder("pub fn ").append(RustNames.ident(node.getName())).append('(');
        List<Param> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sig.append(", ");
            Param param = params.get(i);
            if (ownership.isMutable(param.getSymbolId())) {
                sig.append("mut ");
            }
            sig.append(RustNames.ident(param.getName())).append(": ")
                    .append(types.mapParam(param.getType().getResolvedType(), contract.getMode(i)));
        }
        sig.append(')');
        if (node.hasReturnType()) {
            sig.append(" -> ").append(types.map(fn.getType()));
        }
        ctx.append(sig.toString() + " ");
        block(node.getBody(), ctx);
        ctx.newLine();
        return null;
    }

    // ============ 语句 ============

    private void block(Block block, GeneratorContext ctx) {
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
        }
        ctx.dedent();
        ctx.append("}");
    }

    @Override
    public Void visitBlock(Block node, GeneratorContext ctx) {
        block(node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, GeneratorContext ctx) {
        String mut = ownership.isMutable(node.getSymbolId()) ? "mut " : "";
        ctx.line("let " + mut + RustNames.ident(node.getName()) + ": "
                + types.map(node.getType().getResolvedType()) + " = " + exprs.value(node.getInitializer()) + ";");
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, GeneratorContext ctx) {
        ctx.line(exprs.emit(node.getTarget()) + " = " + exprs.value(node.getValue()) + ";");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, GeneratorContext ctx) {
        if (node.hasValue()) {
            ctx.line("return " + exprs.value(node.getValue()) + ";");
        } else {
            ctx.line("return;");
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, GeneratorContext ctx) {
        ifChain(node, ctx);
        ctx.newLine();
        return null;
    }

    private void ifChain(IfStmt node, GeneratorContext ctx) {
        ctx.append("if " + exprs.emit(node.getCondition()) + " ");
        block(node.getThenBranch(), ctx);
        if (node.hasElse()) {
            ctx.append(" else ");
            if (node.getElseBranch() instanceof IfStmt) {
                ifChain((IfStmt) node.getElseBranch(), ctx);
            } else {
                block((Block) node.getElseBranch(), ctx);
            }
        }
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, GeneratorContext ctx) {
        ctx.append("while " + exprs.emit(node.getCondition()) + " ");
        block(node.getBody(), ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, GeneratorContext ctx) {
        String mut = ownership.isMutable(node.getSymbolId()) ? "mut " : "";
        ctx.append("for " + mut + RustNames.ident(node.getVariable()) + " in "
                + exprs.value(node.getIterable()) + " ");
        block(node.getBody(), ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node, GeneratorContext ctx) {
        ctx.line(exprs.emit(node.getExpression()) + ";");
        return null;
    }
}
