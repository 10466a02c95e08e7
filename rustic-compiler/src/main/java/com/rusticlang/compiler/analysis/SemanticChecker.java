package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.StructType;
import com.rusticlang.compiler.analysis.types.TypeCompatibility;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.FieldDecl;
import com.rusticlang.compiler.ast.decl.StructDecl;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.stmt.Block;
import com.rusticlang.compiler.ast.stmt.IfStmt;
import com.rusticlang.compiler.ast.stmt.ReturnStmt;
import com.rusticlang.compiler.ast.stmt.Statement;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 语义检查：类型兼容、返回路径、结构体递归
 */
final class SemanticChecker {

    /**
     * 检查赋值兼容性，需要 int → float 拓宽时在表达式上打标记
     *
     * @param context 诊断消息中的位置描述（如 "参数 'x'"）
     */
    RusticType checkAssignable(Expression expr, RusticType actual, RusticType target, String context) {
        if (!TypeCompatibility.isAssignable(target, actual)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    context + ": 类型不匹配，期望 '" + target.toDisplayString()
                            + "' 但得到 '" + actual.toDisplayString() + "'",
                    expr.getLocation());
        }
        if (TypeCompatibility.needsWidening(target, actual)) {
            expr.setWidened(true);
        }
        return target;
    }

    /**
     * 代码块是否在所有路径上都以 return 结束
     */
    boolean alwaysReturns(Block block) {
        for (Statement stmt : block.getStatements()) {
            if (alwaysReturns(stmt)) return true;
        }
        return false;
    }

    private boolean alwaysReturns(Statement stmt) {
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof Block) return alwaysReturns((Block) stmt);
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            return ifStmt.hasElse()
                    && alwaysReturns(ifStmt.getThenBranch())
                    && alwaysReturns(ifStmt.getElseBranch());
        }
        // while / for 可能一次都不执行
        return false;
    }

    /**
     * 结构体不能按值直接或间接包含自身（经由 list 的递归允许）
     */
    void checkRecursiveStructs(List<StructDecl> structs, Map<String, Symbol> structSymbols) {
        for (StructDecl decl : structs) {
            Deque<String> path = new ArrayDeque<String>();
            Set<String> done = new HashSet<String>();
            visitStruct(decl.getName(), decl.getName(), structs, structSymbols, path, done);
        }
    }

    private void visitStruct(String origin, String current, List<StructDecl> structs,
                             Map<String, Symbol> structSymbols, Deque<String> path, Set<String> done) {
        if (!done.add(current)) return;
        path.addLast(current);
        Symbol sym = structSymbols.get(current);
        for (Map.Entry<String, RusticType> field : sym.getFields().entrySet()) {
            if (!(field.getValue() instanceof StructType)) continue;
            String target = ((StructType) field.getValue()).getName();
            if (target.equals(origin)) {
                path.addLast(target);
                throw new CompileException(ErrorKind.RECURSIVE_STRUCT,
                        "结构体 '" + origin + "' 按值包含自身（" + String.join(" -> ", path)
                                + "），请改用 list[" + target + "]",
                        fieldLocation(structs, current, field.getKey()));
            }
            visitStruct(origin, target, structs, structSymbols, path, done);
        }
        path.removeLast();
    }

    private static SourceLocation fieldLocation(List<StructDecl> structs, String struct, String field) {
        for (StructDecl decl : structs) {
            if (!decl.getName().equals(struct)) continue;
            for (FieldDecl f : decl.getFields()) {
                if (f.getName().equals(field)) return f.getLocation();
            }
            return decl.getNameLocation();
        }
        return null;
    }
}
