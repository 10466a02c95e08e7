package com.rusticlang.compiler.ownership;

import com.rusticlang.compiler.analysis.Symbol;
import com.rusticlang.compiler.analysis.SymbolKind;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.FnDecl;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.decl.Param;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.expr.StructLiteralExpr.FieldInit;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.stdlib.ArgMode;
import com.rusticlang.compiler.stdlib.MappingEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 所有权分析器
 *
 * <p>对每个函数体做反向活跃性分析（语句逆序，表达式内从右到左），
 * 为每个非 Copy 绑定的使用点给出 MOVE / BORROW_SHARED / BORROW_EXCLUSIVE / CLONE 决策：</p>
 * <ul>
 *   <li>需要所有权且之后不再活跃、也没有被同一调用的其他实参借用：MOVE</li>
 *   <li>需要所有权但仍活跃、被其他实参借用，或绑定本身是引用参数：CLONE</li>
 *   <li>只读使用：BORROW_SHARED</li>
 *   <li>修改使用：BORROW_EXCLUSIVE</li>
 * </ul>
 *
 * <p>参数契约通过对全部函数的单调不动点迭代求得，递归与互递归函数在迭代中收敛。
 * 迭代期间不报告歧义错误，最后一遍使用收敛后的契约记录决策并报告错误。</p>
 */
public final class OwnershipAnalyzer {

    private static final Logger LOG = Logger.getLogger(OwnershipAnalyzer.class.getName());

    private final SymbolTable symbols;

    // 函数符号 id -> 参数传递方式 / 参数是否被修改
    private final Map<Integer, ParamMode[]> modes = new HashMap<Integer, ParamMode[]>();
    private final Map<Integer, boolean[]> mutatedParams = new HashMap<Integer, boolean[]>();

    public OwnershipAnalyzer(SymbolTable symbols) {
        this.symbols = symbols;
    }

    /**
     * 分析整个模块，返回决策表
     */
    public OwnershipTable analyze(Module module) {
        List<FnDecl> functions = module.getFunctions();
        modes.clear();
        mutatedParams.clear();
        for (FnDecl fn : functions) {
            ParamMode[] initial = new ParamMode[fn.getParams().size()];
            for (int i = 0; i < initial.length; i++) {
                initial[i] = paramType(fn, i).isCopy() ? ParamMode.COPY : ParamMode.SHARED;
            }
            modes.put(fn.getSymbolId(), initial);
            mutatedParams.put(fn.getSymbolId(), new boolean[initial.length]);
        }

        int rounds = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            rounds++;
            for (FnDecl fn : functions) {
                FunctionPass pass = new FunctionPass(fn, false);
                pass.run();
                changed |= updateContract(fn, pass);
            }
        }
        LOG.fine("Parameter contracts converged after " + rounds + " round(s)");

        OwnershipTable table = new OwnershipTable();
        for (FnDecl fn : functions) {
            table.putContract(contractOf(fn), paramSymbolIds(fn));
        }
        for (FnDecl fn : functions) {
            FunctionPass pass = new FunctionPass(fn, true);
            pass.run();
            pass.commit(table);
        }
        LOG.fine("Ownership analysis of '" + module.getName() + "': " + table.getDecisions().size() + " decisions");
        return table;
    }

    private boolean updateContract(FnDecl fn, FunctionPass pass) {
        ParamMode[] current = modes.get(fn.getSymbolId());
        boolean[] mutated = mutatedParams.get(fn.getSymbolId());
        boolean changed = false;
        for (int i = 0; i < current.length; i++) {
            if (current[i] == ParamMode.COPY) continue;
            int id = fn.getParams().get(i).getSymbolId();
            ParamMode derived;
            if (pass.moveCandidates.containsValue(id)) {
                derived = ParamMode.MOVE;
            } else if (pass.mutated.contains(id)) {
                derived = ParamMode.EXCLUSIVE;
            } else {
                derived = ParamMode.SHARED;
            }
            ParamMode next = ParamMode.max(current[i], derived);
            if (next != current[i]) {
                current[i] = next;
                changed = true;
            }
            if (!mutated[i] && pass.mutated.contains(id)) {
                mutated[i] = true;
                changed = true;
            }
        }
        return changed;
    }

    private FunctionContract contractOf(FnDecl fn) {
        ParamMode[] m = modes.get(fn.getSymbolId());
        boolean[] mutated = mutatedParams.get(fn.getSymbolId());
        List<ParamMode> modeList = new ArrayList<ParamMode>();
        List<Boolean> mutatedList = new ArrayList<Boolean>();
        for (int i = 0; i < m.length; i++) {
            modeList.add(m[i]);
            mutatedList.add(mutated[i]);
        }
        return new FunctionContract(fn.getSymbolId(), modeList, mutatedList);
    }

    private static int[] paramSymbolIds(FnDecl fn) {
        int[] ids = new int[fn.getParams().size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = fn.getParams().get(i).getSymbolId();
        }
        return ids;
    }

    private RusticType paramType(FnDecl fn, int index) {
        return symbols.get(fn.getParams().get(index).getSymbolId()).getType();
    }

    // ============ 借用占用 ============

    /** 同一调用中其他实参对绑定的占用强度 */
    private enum Hold {
        SHARED,
        TWO_PHASE_MUT,
        EXCLUSIVE
    }

    /**
     * 被占用的位置：绑定本身（path 为空）或其字段路径 p.a.b
     */
    private static final class HeldPlace {
        final Hold hold;
        final List<String> path;
        final SourceLocation location;

        HeldPlace(Hold hold, List<String> path, SourceLocation location) {
            this.hold = hold;
            this.path = path;
            this.location = location;
        }

        /** 一条路径是另一条的前缀时两处位置重叠；p.xs 与 p.ys 互不相交 */
        boolean overlaps(List<String> other) {
            int n = Math.min(path.size(), other.size());
            return path.subList(0, n).equals(other.subList(0, n));
        }
    }

    /** 位置表达式相对根绑定的字段路径 */
    private static List<String> pathOf(Expression place) {
        List<String> path = new ArrayList<String>();
        Expression e = place;
        while (e instanceof FieldAccessExpr) {
            path.add(0, ((FieldAccessExpr) e).getField());
            e = ((FieldAccessExpr) e).getReceiver();
        }
        return path;
    }

    // ============ 单个函数的一遍分析 ============

    private final class FunctionPass implements AstVisitor<Set<Integer>, Set<Integer>> {
        private final FnDecl fn;
        private final boolean reportAmbiguity;
        private final Map<Integer, ParamMode> ownParams = new HashMap<Integer, ParamMode>();

        private final Map<Expression, OwnershipDecision> decisions = new IdentityHashMap<Expression, OwnershipDecision>();
        // 若参数是引用本可以 MOVE 的使用点 -> 参数符号 id
        private final Map<Expression, Integer> moveCandidates = new IdentityHashMap<Expression, Integer>();
        private final Set<Integer> mutated = new HashSet<Integer>();
        private final Set<Integer> assigned = new HashSet<Integer>();
        private final Deque<Map<Integer, List<HeldPlace>>> frames = new ArrayDeque<Map<Integer, List<HeldPlace>>>();

        FunctionPass(FnDecl fn, boolean reportAmbiguity) {
            this.fn = fn;
            this.reportAmbiguity = reportAmbiguity;
            ParamMode[] m = modes.get(fn.getSymbolId());
            List<Param> params = fn.getParams();
            for (int i = 0; i < params.size(); i++) {
                ownParams.put(params.get(i).getSymbolId(), m[i]);
            }
        }

        void run() {
            fn.getBody().accept(this, Collections.<Integer>emptySet());
        }

        void commit(OwnershipTable table) {
            for (Map.Entry<Expression, OwnershipDecision> e : decisions.entrySet()) {
                table.record(e.getKey(), e.getValue());
            }
            Set<Integer> candidates = new HashSet<Integer>(mutated);
            candidates.addAll(assigned);
            for (Integer id : candidates) {
                Symbol sym = symbols.get(id);
                if (sym.getKind() == SymbolKind.PARAMETER) {
                    if (ownParams.get(id) == ParamMode.MOVE) table.markMutable(id);
                } else if (sym.getKind() == SymbolKind.VARIABLE || sym.getKind() == SymbolKind.LOOP_VARIABLE) {
                    table.markMutable(id);
                }
            }
        }

        // ============ 语句：参数为出口活跃集，返回入口活跃集 ============

        @Override
        public Set<Integer> visitBlock(Block node, Set<Integer> liveOut) {
            Set<Integer> live = liveOut;
            List<Statement> stmts = node.getStatements();
            for (int i = stmts.size() - 1; i >= 0; i--) {
                live = stmts.get(i).accept(this, live);
            }
            return live;
        }

        @Override
        public Set<Integer> visitLetStmt(LetStmt node, Set<Integer> liveOut) {
            return expr(node.getInitializer(), UseKind.CONSUME, without(liveOut, node.getSymbolId()));
        }

        @Override
        public Set<Integer> visitAssignStmt(AssignStmt node, Set<Integer> liveOut) {
            Expression target = node.getTarget();
            Set<Integer> live;
            if (target instanceof Identifier) {
                int id = ((Identifier) target).getSymbolId();
                assigned.add(id);
                live = without(liveOut, id);
            } else {
                // p.a.b = v：先求值 v，再写入 p 的字段
                live = identifier(((FieldAccessExpr) target).getRoot(), UseKind.MUTATE, liveOut, pathOf(target));
            }
            return expr(node.getValue(), UseKind.CONSUME, live);
        }

        @Override
        public Set<Integer> visitReturnStmt(ReturnStmt node, Set<Integer> liveOut) {
            Set<Integer> live = Collections.emptySet();
            if (node.hasValue()) {
                live = expr(node.getValue(), UseKind.CONSUME, live);
            }
            return live;
        }

        @Override
        public Set<Integer> visitIfStmt(IfStmt node, Set<Integer> liveOut) {
            Set<Integer> live = new HashSet<Integer>(node.getThenBranch().accept(this, liveOut));
            if (node.hasElse()) {
                live.addAll(node.getElseBranch().accept(this, liveOut));
            } else {
                live.addAll(liveOut);
            }
            return expr(node.getCondition(), UseKind.READ, live);
        }

        @Override
        public Set<Integer> visitWhileStmt(WhileStmt node, Set<Integer> liveOut) {
            Set<Integer> head = liveOut;
            while (true) {
                Set<Integer> bodyIn = node.getBody().accept(this, head);
                Set<Integer> next = expr(node.getCondition(), UseKind.READ, union(liveOut, bodyIn));
                next = union(head, next);
                if (next.equals(head)) return head;
                head = next;
            }
        }

        @Override
        public Set<Integer> visitForStmt(ForStmt node, Set<Integer> liveOut) {
            Set<Integer> head = liveOut;
            while (true) {
                Set<Integer> bodyIn = node.getBody().accept(this, head);
                Set<Integer> next = union(head, without(bodyIn, node.getSymbolId()));
                if (next.equals(head)) break;
                head = next;
            }
            return expr(node.getIterable(), UseKind.CONSUME, head);
        }

        @Override
        public Set<Integer> visitExprStmt(ExprStmt node, Set<Integer> liveOut) {
            return expr(node.getExpression(), UseKind.CONSUME, liveOut);
        }

        // ============ 表达式：参数为求值之后的活跃集，返回求值之前的活跃集 ============

        private Set<Integer> expr(Expression e, UseKind kind, Set<Integer> live) {
            if (e instanceof Identifier) {
                return identifier((Identifier) e, kind, live);
            }
            if (e instanceof FieldAccessExpr) {
                return fieldAccess((FieldAccessExpr) e, kind, live);
            }
            if (e instanceof CallExpr) {
                CallExpr call = (CallExpr) e;
                return operands(call.getArgs(), argKinds(call), live);
            }
            if (e instanceof BinaryExpr) {
                return binary((BinaryExpr) e, live);
            }
            if (e instanceof UnaryExpr) {
                return expr(((UnaryExpr) e).getOperand(), UseKind.READ, live);
            }
            if (e instanceof StructLiteralExpr) {
                List<FieldInit> fields = ((StructLiteralExpr) e).getFields();
                for (int i = fields.size() - 1; i >= 0; i--) {
                    live = expr(fields.get(i).getValue(), UseKind.CONSUME, live);
                }
                return live;
            }
            if (e instanceof ListLiteralExpr) {
                List<Expression> elements = ((ListLiteralExpr) e).getElements();
                for (int i = elements.size() - 1; i >= 0; i--) {
                    live = expr(elements.get(i), UseKind.CONSUME, live);
                }
                return live;
            }
            return live;
        }

        private Set<Integer> identifier(Identifier id, UseKind kind, Set<Integer> live) {
            return identifier(id, kind, live, Collections.<String>emptyList());
        }

        /**
         * @param path 经由字段访问使用时的字段路径，直接使用绑定时为空
         */
        private Set<Integer> identifier(Identifier id, UseKind kind, Set<Integer> live, List<String> path) {
            Symbol sym = symbols.get(id.getSymbolId());
            if (!sym.getKind().isLocal() || sym.getType().isCopy()) {
                return live;
            }
            int s = sym.getId();
            HeldPlace held = findHeld(s, path);
            OwnershipDecision decision;
            if (kind == UseKind.CONSUME) {
                if (held != null && held.hold == Hold.EXCLUSIVE) ambiguous(id, sym, held);
                boolean wouldMove = !live.contains(s) && held == null;
                if (wouldMove && sym.getKind() == SymbolKind.PARAMETER) {
                    moveCandidates.put(id, s);
                } else {
                    moveCandidates.remove(id);
                }
                decision = wouldMove && !isReference(s) ? OwnershipDecision.MOVE : OwnershipDecision.CLONE;
            } else if (kind.isExclusive()) {
                if (held != null) ambiguous(id, sym, held);
                mutated.add(s);
                decision = OwnershipDecision.BORROW_EXCLUSIVE;
            } else {
                if (held != null && held.hold == Hold.EXCLUSIVE) ambiguous(id, sym, held);
                decision = OwnershipDecision.BORROW_SHARED;
            }
            decisions.put(id, decision);
            return with(live, s);
        }

        private Set<Integer> fieldAccess(FieldAccessExpr node, UseKind kind, Set<Integer> live) {
            Identifier root = node.getRoot();
            if (root == null) {
                // 临时值的字段：整体按值求值
                return expr(node.getReceiver(), UseKind.CONSUME, live);
            }
            if (node.getType().isCopy()) {
                return identifier(root, UseKind.READ, live, pathOf(node));
            }
            if (kind == UseKind.CONSUME) {
                decisions.put(node, OwnershipDecision.CLONE);
                return identifier(root, UseKind.READ, live, pathOf(node));
            }
            if (kind.isExclusive()) {
                decisions.put(node, OwnershipDecision.BORROW_EXCLUSIVE);
                return identifier(root, UseKind.MUTATE, live, pathOf(node));
            }
            decisions.put(node, OwnershipDecision.BORROW_SHARED);
            return identifier(root, UseKind.READ, live, pathOf(node));
        }

        private Set<Integer> binary(BinaryExpr node, Set<Integer> live) {
            if (node.getLeft().getType().isCopy()) {
                live = expr(node.getRight(), UseKind.READ, live);
                return expr(node.getLeft(), UseKind.READ, live);
            }
            // 非 Copy 的比较与拼接：所有操作数同时被借用
            List<Expression> operands = node.isStringConcat()
                    ? node.flattenConcat()
                    : Arrays.asList(node.getLeft(), node.getRight());
            UseKind[] kinds = new UseKind[operands.size()];
            Arrays.fill(kinds, UseKind.READ);
            return operands(operands, kinds, live);
        }

        /**
         * 逆序处理同时求值的一组操作数；处理第 i 个时，其余操作数中的借用位置处于占用状态
         */
        private Set<Integer> operands(List<Expression> args, UseKind[] kinds, Set<Integer> live) {
            for (int i = args.size() - 1; i >= 0; i--) {
                frames.push(holdsExcept(args, kinds, i));
                try {
                    live = expr(args.get(i), kinds[i], live);
                } finally {
                    frames.pop();
                }
            }
            return live;
        }

        private Map<Integer, List<HeldPlace>> holdsExcept(List<Expression> args, UseKind[] kinds, int skip) {
            Map<Integer, List<HeldPlace>> holds = new LinkedHashMap<Integer, List<HeldPlace>>();
            for (int j = 0; j < args.size(); j++) {
                if (j == skip || !kinds[j].isBorrow()) continue;
                Expression arg = args.get(j);
                if (!arg.isPlace() || arg.getType().isCopy()) continue;
                Identifier root = arg instanceof Identifier ? (Identifier) arg : ((FieldAccessExpr) arg).getRoot();
                Symbol sym = symbols.get(root.getSymbolId());
                if (!sym.getKind().isLocal()) continue;
                Hold hold;
                if (kinds[j] == UseKind.BORROW_MUT_ARG) {
                    hold = Hold.EXCLUSIVE;
                } else if (kinds[j] == UseKind.RECEIVER_MUT) {
                    hold = Hold.TWO_PHASE_MUT;
                } else {
                    hold = Hold.SHARED;
                }
                List<HeldPlace> places = holds.get(sym.getId());
                if (places == null) {
                    places = new ArrayList<HeldPlace>();
                    holds.put(sym.getId(), places);
                }
                places.add(new HeldPlace(hold, pathOf(arg), arg.getLocation()));
            }
            return holds;
        }

        /**
         * 与 path 重叠的占用中最强的一个
         */
        private HeldPlace findHeld(int symbolId, List<String> path) {
            HeldPlace strongest = null;
            for (Map<Integer, List<HeldPlace>> frame : frames) {
                List<HeldPlace> places = frame.get(symbolId);
                if (places == null) continue;
                for (HeldPlace h : places) {
                    if (h.overlaps(path) && (strongest == null || strongest.hold.ordinal() < h.hold.ordinal())) {
                        strongest = h;
                    }
                }
            }
            return strongest;
        }

        private UseKind[] argKinds(CallExpr call) {
            UseKind[] kinds = new UseKind[call.getArgs().size()];
            MappingEntry builtin = call.getBuiltin();
            if (builtin != null) {
                for (int i = 0; i < kinds.length; i++) {
                    kinds[i] = kindOf(builtin.getArgMode(i));
                }
                return kinds;
            }
            ParamMode[] callee = modes.get(call.getFunctionSymbolId());
            for (int i = 0; i < kinds.length; i++) {
                kinds[i] = kindOf(callee[i]);
            }
            return kinds;
        }

        private boolean isReference(int symbolId) {
            ParamMode mode = ownParams.get(symbolId);
            return mode != null && mode.isReference();
        }

        private void ambiguous(Expression use, Symbol sym, HeldPlace held) {
            if (!reportAmbiguity) return;
            String detail = held.hold == Hold.SHARED
                    ? "'" + sym.getName() + "' 在同一次调用中被共享借用，同时又被可变地使用"
                    : "'" + sym.getName() + "' 在同一次调用中被可变借用，同时又被再次使用";
            throw new CompileException(ErrorKind.AMBIGUOUS_OWNERSHIP, detail, use.getLocation(), held.location);
        }
    }

    private static UseKind kindOf(ArgMode mode) {
        switch (mode) {
            case REF: return UseKind.BORROW_ARG;
            case REF_MUT: return UseKind.BORROW_MUT_ARG;
            case RECEIVER: return UseKind.RECEIVER;
            case RECEIVER_MUT: return UseKind.RECEIVER_MUT;
            default: return UseKind.CONSUME;
        }
    }

    private static UseKind kindOf(ParamMode mode) {
        switch (mode) {
            case COPY: return UseKind.READ;
            case SHARED: return UseKind.BORROW_ARG;
            case EXCLUSIVE: return UseKind.BORROW_MUT_ARG;
            default: return UseKind.CONSUME;
        }
    }

    // ============ 集合工具 ============

    private static Set<Integer> with(Set<Integer> set, int id) {
        if (set.contains(id)) return set;
        Set<Integer> result = new HashSet<Integer>(set);
        result.add(id);
        return result;
    }

    private static Set<Integer> without(Set<Integer> set, int id) {
        if (!set.contains(id)) return set;
        Set<Integer> result = new HashSet<Integer>(set);
        result.remove(id);
        return result;
    }

    private static Set<Integer> union(Set<Integer> a, Set<Integer> b) {
        if (a.containsAll(b)) return a;
        Set<Integer> result = new HashSet<Integer>(a);
        result.addAll(b);
        return result;
    }
}
