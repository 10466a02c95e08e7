package com.rusticlang.compiler.ownership;

import com.rusticlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 所有权分析结果：使用点决策、需要 mut 的绑定、函数契约
 *
 * <p>决策以表达式节点（标识符或字段路径）为键，按节点身份比较。</p>
 */
public final class OwnershipTable {
    private final Map<Expression, OwnershipDecision> decisions = new IdentityHashMap<Expression, OwnershipDecision>();
    private final Set<Integer> mutableBindings = new HashSet<Integer>();
    private final Map<Integer, FunctionContract> contracts = new HashMap<Integer, FunctionContract>();
    private final Map<Integer, ParamMode> paramModes = new HashMap<Integer, ParamMode>();

    /** 记录使用点决策，同一节点的后一次记录覆盖前一次 */
    public void record(Expression node, OwnershipDecision decision) {
        decisions.put(node, decision);
    }

    /** 使用点决策，Copy 类型与非绑定表达式返回 null */
    public OwnershipDecision getDecision(Expression node) {
        return decisions.get(node);
    }

    public Map<Expression, OwnershipDecision> getDecisions() {
        return Collections.unmodifiableMap(decisions);
    }

    public void markMutable(int symbolId) {
        mutableBindings.add(symbolId);
    }

    /** 绑定在生成代码中需要 mut */
    public boolean isMutable(int symbolId) {
        return mutableBindings.contains(symbolId);
    }

    void putContract(FunctionContract contract, int[] paramSymbolIds) {
        contracts.put(contract.getFunctionSymbolId(), contract);
        for (int i = 0; i < paramSymbolIds.length; i++) {
            paramModes.put(paramSymbolIds[i], contract.getMode(i));
        }
    }

    public FunctionContract getContract(int functionSymbolId) {
        return contracts.get(functionSymbolId);
    }

    /** 参数符号的传递方式，非参数返回 null */
    public ParamMode getParamMode(int symbolId) {
        return paramModes.get(symbolId);
    }

    /** 绑定本身是引用（共享或独占引用参数） */
    public boolean isReferenceBinding(int symbolId) {
        ParamMode mode = paramModes.get(symbolId);
        return mode != null && mode.isReference();
    }
}
