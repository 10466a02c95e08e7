package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号表中的符号。AST 节点通过 id 引用符号，符号通过 declaration 反查声明节点（非拥有关系）。
 */
public final class Symbol {
    private final int id;
    private final String name;
    private final SymbolKind kind;
    private final RusticType type;        // 函数为返回类型
    private final AstNode declaration;    // 声明的 AST 节点
    private final SourceLocation location;// 声明位置
    private final int scopeId;
    private final boolean reassignable;   // true = var

    // 额外信息
    private List<Symbol> parameters;      // 函数参数
    private Map<String, RusticType> fields; // 结构体字段（声明顺序）

    Symbol(int id, String name, SymbolKind kind, RusticType type, AstNode declaration,
           SourceLocation location, int scopeId, boolean reassignable) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.declaration = declaration;
        this.location = location;
        this.scopeId = scopeId;
        this.reassignable = reassignable;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public RusticType getType() { return type; }
    public AstNode getDeclaration() { return declaration; }
    public SourceLocation getLocation() { return location; }
    public int getScopeId() { return scopeId; }
    public boolean isReassignable() { return reassignable; }

    public List<Symbol> getParameters() {
        return parameters != null ? parameters : Collections.<Symbol>emptyList();
    }

    public void setParameters(List<Symbol> parameters) { this.parameters = parameters; }

    public Map<String, RusticType> getFields() {
        return fields != null ? fields : Collections.<String, RusticType>emptyMap();
    }

    public void addField(String fieldName, RusticType fieldType) {
        if (fields == null) {
            fields = new LinkedHashMap<String, RusticType>();
        }
        fields.put(fieldName, fieldType);
    }

    @Override
    public String toString() {
        return kind + " " + name + "#" + id + ": " + type;
    }
}
