package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域。子作用域可以遮蔽父作用域中的同名绑定，生命周期与所在代码块一致。
 */
public final class Scope {

    public enum ScopeKind {
        MODULE,     // 顶层
        FUNCTION,   // 函数参数
        BLOCK,      // 代码块
        LOOP        // for 循环变量
    }

    private final int id;
    private final ScopeKind kind;
    private final Scope parent;
    private final AstNode node;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    private final List<Scope> children = new ArrayList<Scope>();

    Scope(int id, ScopeKind kind, Scope parent, AstNode node) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.node = node;
    }

    public int getId() { return id; }
    public ScopeKind getKind() { return kind; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    public Map<String, Symbol> getSymbols() { return symbols; }
    public List<Scope> getChildren() { return children; }

    void addChild(Scope child) { children.add(child); }

    /** 注册符号到当前作用域 */
    void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }
}
