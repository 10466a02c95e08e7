package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 符号表：按 id 索引所有符号与作用域
 */
public final class SymbolTable {
    private final List<Symbol> symbols = new ArrayList<Symbol>();
    private final List<Scope> scopes = new ArrayList<Scope>();
    private final Scope moduleScope;

    public SymbolTable() {
        this.moduleScope = newScope(Scope.ScopeKind.MODULE, null, null);
    }

    public Scope getModuleScope() {
        return moduleScope;
    }

    Scope newScope(Scope.ScopeKind kind, Scope parent, AstNode node) {
        Scope scope = new Scope(scopes.size(), kind, parent, node);
        scopes.add(scope);
        if (parent != null) parent.addChild(scope);
        return scope;
    }

    /** 创建符号并登记到作用域（调用方负责重复检查） */
    Symbol newSymbol(String name, SymbolKind kind, RusticType type, AstNode declaration,
                     SourceLocation location, Scope scope, boolean reassignable) {
        Symbol symbol = new Symbol(symbols.size(), name, kind, type, declaration, location,
                scope.getId(), reassignable);
        symbols.add(symbol);
        scope.define(symbol);
        return symbol;
    }

    /**
     * 按 id 取符号
     */
    public Symbol get(int id) {
        if (id < 0 || id >= symbols.size()) {
            throw new IllegalArgumentException("Unknown symbol id " + id);
        }
        return symbols.get(id);
    }

    public Scope getScope(int id) {
        return scopes.get(id);
    }

    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public int size() {
        return symbols.size();
    }
}
