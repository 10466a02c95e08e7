package com.rusticlang.compiler.ownership;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数的所有权契约：每个参数的传递方式，以及按值参数在函数体内是否被修改
 */
public final class FunctionContract {
    private final int functionSymbolId;
    private final List<ParamMode> modes;
    private final List<Boolean> mutated;

    FunctionContract(int functionSymbolId, List<ParamMode> modes, List<Boolean> mutated) {
        this.functionSymbolId = functionSymbolId;
        this.modes = Collections.unmodifiableList(new ArrayList<ParamMode>(modes));
        this.mutated = Collections.unmodifiableList(new ArrayList<Boolean>(mutated));
    }

    public int getFunctionSymbolId() {
        return functionSymbolId;
    }

    public List<ParamMode> getModes() {
        return modes;
    }

    public ParamMode getMode(int index) {
        return modes.get(index);
    }

    /** 参数在函数体内被修改（字段赋值、可变借用） */
    public boolean isMutated(int index) {
        return mutated.get(index);
    }

    public int size() {
        return modes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionContract)) return false;
        FunctionContract that = (FunctionContract) o;
        return functionSymbolId == that.functionSymbolId
                && modes.equals(that.modes) && mutated.equals(that.mutated);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * functionSymbolId + modes.hashCode()) + mutated.hashCode();
    }

    @Override
    public String toString() {
        return "Contract#" + functionSymbolId + modes;
    }
}
