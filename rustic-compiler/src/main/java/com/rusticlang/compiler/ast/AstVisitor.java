package com.rusticlang.compiler.ast;

import com.rusticlang.compiler.ast.decl.*;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitModule(Module node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    default R visitFnDecl(FnDecl node, C ctx) { return null; }

    default R visitParam(Param node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitExprStmt(ExprStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitStructLiteralExpr(StructLiteralExpr node, C ctx) { return null; }

    default R visitListLiteralExpr(ListLiteralExpr node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitNamedTypeRef(NamedTypeRef node, C ctx) { return null; }

    default R visitListTypeRef(ListTypeRef node, C ctx) { return null; }
}
