package com.rusticlang.compiler.ownership;

import com.rusticlang.compiler.analysis.Symbol;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.FnDecl;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.expr.StructLiteralExpr.FieldInit;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;

import java.util.HashMap;
import java.util.Map;

/**
 * 移动安全检查：按求值顺序正向执行决策表，被 MOVE 的绑定在重新初始化之前不得再使用
 *
 * <p>分支在汇合处取并集（任一路径上已移动即视为已移动），循环体执行两遍以覆盖回边。</p>
 */
public final class MoveChecker implements AstVisitor<Void, MoveChecker.State> {

    private final SymbolTable symbols;
    private final OwnershipTable table;

    public MoveChecker(SymbolTable symbols, OwnershipTable table) {
        this.symbols = symbols;
        this.table = table;
    }

    /**
     * 检查模块中的全部函数
     *
     * @throws CompileException USE_AFTER_MOVE，携带使用位置与移动位置
     */
    public void check(Module module) {
        for (FnDecl fn : module.getFunctions()) {
            fn.getBody().accept(this, new State());
        }
    }

    // ============ 移动状态 ============

    /**
     * 当前程序点上已被移动的绑定；unreachable 表示 return 之后
     */
    static final class State {
        private Map<Integer, SourceLocation> moved = new HashMap<Integer, SourceLocation>();
        private boolean reachable = true;

        State copy() {
            State s = new State();
            s.moved = new HashMap<Integer, SourceLocation>(moved);
            s.reachable = reachable;
            return s;
        }

        /** 汇合另一条路径的状态 */
        void merge(State other) {
            if (!other.reachable) return;
            if (!reachable) {
                moved = new HashMap<Integer, SourceLocation>(other.moved);
                reachable = true;
                return;
            }
            for (Map.Entry<Integer, SourceLocation> e : other.moved.entrySet()) {
                if (!moved.containsKey(e.getKey())) moved.put(e.getKey(), e.getValue());
            }
        }

        void assignFrom(State other) {
            moved = other.moved;
            reachable = other.reachable;
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, State state) {
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, state);
        }
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, State state) {
        node.getInitializer().accept(this, state);
        state.moved.remove(node.getSymbolId());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, State state) {
        node.getValue().accept(this, state);
        Expression target = node.getTarget();
        if (target instanceof Identifier) {
            state.moved.remove(((Identifier) target).getSymbolId());
        } else {
            target.accept(this, state);
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, State state) {
        if (node.hasValue()) {
            node.getValue().accept(this, state);
        }
        state.moved.clear();
        state.reachable = false;
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, State state) {
        node.getCondition().accept(this, state);
        State thenState = state.copy();
        node.getThenBranch().accept(this, thenState);
        State elseState = state.copy();
        if (node.hasElse()) {
            node.getElseBranch().accept(this, elseState);
        }
        thenState.merge(elseState);
        state.assignFrom(thenState);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, State state) {
        node.getCondition().accept(this, state);
        for (int round = 0; round < 2; round++) {
            State body = state.copy();
            node.getBody().accept(this, body);
            state.merge(body);
            node.getCondition().accept(this, state);
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, State state) {
        node.getIterable().accept(this, state);
        for (int round = 0; round < 2; round++) {
            State body = state.copy();
            body.moved.remove(node.getSymbolId());
            node.getBody().accept(this, body);
            state.merge(body);
        }
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node, State state) {
        node.getExpression().accept(this, state);
        return null;
    }

    // ============ 表达式（按 Rust 求值顺序：从左到右） ============

    @Override
    public Void visitIdentifier(Identifier node, State state) {
        if (!state.reachable || node.getSymbolId() < 0) return null;
        Symbol sym = symbols.get(node.getSymbolId());
        if (!sym.getKind().isLocal()) return null;

        SourceLocation movedAt = state.moved.get(sym.getId());
        if (movedAt != null) {
            throw new CompileException(ErrorKind.USE_AFTER_MOVE,
                    "'" + sym.getName() + "' 在所有权转移之后被使用", node.getLocation(), movedAt);
        }
        if (table.getDecision(node) == OwnershipDecision.MOVE) {
            state.moved.put(sym.getId(), node.getLocation());
        }
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, State state) {
        node.getReceiver().accept(this, state);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, State state) {
        for (Expression arg : node.getArgs()) {
            arg.accept(this, state);
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, State state) {
        node.getLeft().accept(this, state);
        node.getRight().accept(this, state);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, State state) {
        node.getOperand().accept(this, state);
        return null;
    }

    @Override
    public Void visitStructLiteralExpr(StructLiteralExpr node, State state) {
        for (FieldInit init : node.getFields()) {
            init.getValue().accept(this, state);
        }
        return null;
    }

    @Override
    public Void visitListLiteralExpr(ListLiteralExpr node, State state) {
        for (Expression element : node.getElements()) {
            element.accept(this, state);
        }
        return null;
    }
}
