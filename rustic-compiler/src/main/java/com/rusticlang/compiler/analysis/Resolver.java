package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.analysis.types.ListType;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.StructType;
import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.ast.AstNode;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.*;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.expr.CallExpr;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.expr.FieldAccessExpr;
import com.rusticlang.compiler.ast.expr.Identifier;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.ast.type.ListTypeRef;
import com.rusticlang.compiler.ast.type.NamedTypeRef;
import com.rusticlang.compiler.ast.type.TypeRef;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.stdlib.MappingTable;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 符号与类型解析
 *
 * <p>分多遍处理一个模块：</p>
 * <ol>
 *   <li>导入：把内置模块登记为 MODULE 符号</li>
 *   <li>结构体名称</li>
 *   <li>结构体字段、常量、函数签名（先声明后解析函数体，允许前向引用与递归）</li>
 *   <li>结构体递归检查</li>
 *   <li>函数体：语句检查与表达式类型推断</li>
 * </ol>
 *
 * <p>解析结果直接写回 AST：标识符的符号 id、表达式类型、拓宽标记以及内置调用的映射条目。
 * 遇到第一个错误即抛出 {@link CompileException}。</p>
 */
public final class Resolver implements AstVisitor<Void, Scope> {

    private static final Logger LOG = Logger.getLogger(Resolver.class.getName());

    private final MappingTable mappingTable;
    private final SemanticChecker checker = new SemanticChecker();

    private SymbolTable symbolTable;
    private TypeInference inference;
    private final Map<String, Symbol> structs = new LinkedHashMap<String, Symbol>();
    private final Map<FnDecl, Scope> functionScopes = new IdentityHashMap<FnDecl, Scope>();

    // 当前函数
    private Symbol currentFunction;

    public Resolver(MappingTable mappingTable) {
        this.mappingTable = mappingTable;
    }

    /**
     * 解析模块，返回填充完毕的符号表
     */
    public SymbolTable resolve(Module module) {
        symbolTable = new SymbolTable();
        inference = new TypeInference(this, mappingTable, checker);
        structs.clear();
        functionScopes.clear();
        Scope moduleScope = symbolTable.getModuleScope();

        for (ImportDecl imp : module.getImports()) {
            declareImport(imp, moduleScope);
        }
        for (StructDecl decl : module.getStructs()) {
            Symbol sym = declare(decl.getName(), SymbolKind.STRUCT, new StructType(decl.getName()),
                    decl, decl.getNameLocation(), moduleScope, false);
            structs.put(decl.getName(), sym);
        }
        for (Declaration decl : module.getDeclarations()) {
            if (decl instanceof StructDecl) {
                declareFields((StructDecl) decl);
            } else if (decl instanceof ConstDecl) {
                declareConst((ConstDecl) decl, moduleScope);
            } else if (decl instanceof FnDecl) {
                declareFunction((FnDecl) decl, moduleScope);
            }
        }
        checker.checkRecursiveStructs(module.getStructs(), structs);

        for (FnDecl fn : module.getFunctions()) {
            fn.accept(this, functionScopes.get(fn));
        }

        LOG.fine("Resolved module '" + module.getName() + "': " + symbolTable.size() + " symbols");
        return symbolTable;
    }

    // ============ 公共操作 ============

    /**
     * 在作用域中声明符号，同一作用域重名时报告两处位置
     */
    public Symbol declare(String name, SymbolKind kind, RusticType type, AstNode node,
                          SourceLocation location, Scope scope, boolean reassignable) {
        Symbol existing = scope.resolveLocal(name);
        if (existing != null) {
            throw new CompileException(ErrorKind.DUPLICATE_DECLARATION,
                    "'" + name + "' 在此作用域中已定义", location, existing.getLocation());
        }
        return symbolTable.newSymbol(name, kind, type, node, location, scope, reassignable);
    }

    /**
     * 由内向外查找标识符，并把符号 id 写回节点
     */
    public Symbol resolve(Identifier identifier, Scope scope) {
        Symbol sym = scope.resolve(identifier.getName());
        if (sym == null) {
            throw new CompileException(ErrorKind.UNRESOLVED_NAME,
                    "未定义的名称 '" + identifier.getName() + "'", identifier.getLocation());
        }
        identifier.setSymbolId(sym.getId());
        return sym;
    }

    /**
     * 推断表达式类型
     */
    public RusticType typeOf(Expression expr, Scope scope) {
        return inference.infer(expr, scope);
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    Symbol structSymbol(String name) {
        return structs.get(name);
    }

    // ============ 声明 ============

    private void declareImport(ImportDecl imp, Scope moduleScope) {
        List<String> parts = imp.getParts();
        String name = parts.get(parts.size() - 1);
        if (!mappingTable.hasModule(name)) {
            throw new CompileException(ErrorKind.UNRESOLVED_NAME,
                    "未知的模块 '" + imp.getFullName() + "'，可用模块: "
                            + String.join(", ", mappingTable.getModules()),
                    imp.getLocation());
        }
        declare(name, SymbolKind.MODULE, Types.VOID, imp, imp.getLocation(), moduleScope, false);
    }

    private void declareFields(StructDecl decl) {
        Symbol sym = structs.get(decl.getName());
        Map<String, FieldDecl> seen = new LinkedHashMap<String, FieldDecl>();
        for (FieldDecl field : decl.getFields()) {
            FieldDecl previous = seen.put(field.getName(), field);
            if (previous != null) {
                throw new CompileException(ErrorKind.DUPLICATE_DECLARATION,
                        "结构体 '" + decl.getName() + "' 中字段 '" + field.getName() + "' 重复定义",
                        field.getLocation(), previous.getLocation());
            }
            RusticType type = resolveType(field.getType());
            requireValueType(type, field.getType(), "字段 '" + field.getName() + "'");
            sym.addField(field.getName(), type);
        }
    }

    private void declareConst(ConstDecl decl, Scope moduleScope) {
        RusticType type = resolveType(decl.getType());
        if (!type.isCopy()) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "常量 '" + decl.getName() + "' 只能是 int、float 或 bool 类型，得到 '"
                            + type.toDisplayString() + "'",
                    decl.getType().getLocation());
        }
        inference.coerce(decl.getValue(), type, moduleScope, "常量 '" + decl.getName() + "'");
        Symbol sym = declare(decl.getName(), SymbolKind.CONSTANT, type, decl,
                decl.getNameLocation(), moduleScope, false);
        decl.setSymbolId(sym.getId());
    }

    private void declareFunction(FnDecl decl, Scope moduleScope) {
        RusticType returnType = decl.hasReturnType() ? resolveType(decl.getReturnType()) : Types.VOID;
        Symbol fn = declare(decl.getName(), SymbolKind.FUNCTION, returnType, decl,
                decl.getNameLocation(), moduleScope, false);
        decl.setSymbolId(fn.getId());

        Scope scope = symbolTable.newScope(Scope.ScopeKind.FUNCTION, moduleScope, decl);
        List<Symbol> params = new ArrayList<Symbol>();
        for (Param param : decl.getParams()) {
            RusticType type = resolveType(param.getType());
            requireValueType(type, param.getType(), "参数 '" + param.getName() + "'");
            Symbol p = declare(param.getName(), SymbolKind.PARAMETER, type, param,
                    param.getLocation(), scope, false);
            param.setSymbolId(p.getId());
            if (param.hasDefault()) {
                inference.coerce(param.getDefaultValue(), type, moduleScope, "参数 '" + param.getName() + "' 的默认值");
            }
            params.add(p);
        }
        fn.setParameters(params);
        functionScopes.put(decl, scope);
    }

    /**
     * 把类型标注解析为 {@link RusticType} 并写回节点
     */
    private RusticType resolveType(TypeRef ref) {
        RusticType type;
        if (ref instanceof ListTypeRef) {
            RusticType element = resolveType(((ListTypeRef) ref).getElementType());
            requireValueType(element, ref, "列表元素");
            type = Types.listOf(element);
        } else {
            String name = ((NamedTypeRef) ref).getName();
            type = Types.fromName(name);
            if (type == null) {
                Symbol sym = structs.get(name);
                if (sym == null) {
                    throw new CompileException(ErrorKind.UNRESOLVED_NAME,
                            "未定义的类型 '" + name + "'", ref.getLocation());
                }
                type = sym.getType();
            }
        }
        ref.setResolvedType(type);
        return type;
    }

    private static void requireValueType(RusticType type, TypeRef ref, String context) {
        if (Types.isVoid(type)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    context + " 不能是 void 类型", ref.getLocation());
        }
    }

    // ============ 函数体与语句 ============

    @Override
    public Void visitFnDecl(FnDecl node, Scope scope) {
        currentFunction = symbolTable.get(node.getSymbolId());
        node.getBody().accept(this, scope);
        if (!Types.isVoid(currentFunction.getType()) && !checker.alwaysReturns(node.getBody())) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "函数 '" + node.getName() + "' 声明返回 '" + currentFunction.getType().toDisplayString()
                            + "'，但并非所有路径都有 return",
                    node.getNameLocation());
        }
        currentFunction = null;
        return null;
    }

    @Override
    public Void visitBlock(Block node, Scope scope) {
        Scope blockScope = symbolTable.newScope(Scope.ScopeKind.BLOCK, scope, node);
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, blockScope);
        }
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, Scope scope) {
        RusticType type = resolveType(node.getType());
        requireValueType(type, node.getType(), "变量 '" + node.getName() + "'");
        // 初始化表达式在声明之前解析，`let x: T = x` 引用外层的 x
        inference.coerce(node.getInitializer(), type, scope, "变量 '" + node.getName() + "'");
        Symbol sym = declare(node.getName(), SymbolKind.VARIABLE, type, node,
                node.getNameLocation(), scope, node.isReassignable());
        node.setSymbolId(sym.getId());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Scope scope) {
        Expression target = node.getTarget();
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            Symbol sym = resolve(id, scope);
            if (sym.getKind() != SymbolKind.VARIABLE || !sym.isReassignable()) {
                throw new CompileException(ErrorKind.IMMUTABLE_ASSIGNMENT,
                        "不能给" + describe(sym) + " '" + sym.getName() + "' 重新赋值",
                        id.getLocation(), sym.getLocation());
            }
        } else {
            Identifier root = ((FieldAccessExpr) target).getRoot();
            Symbol sym = resolve(root, scope);
            if (!sym.getKind().isLocal()) {
                throw new CompileException(ErrorKind.IMMUTABLE_ASSIGNMENT,
                        "不能修改" + describe(sym) + " '" + sym.getName() + "' 的字段",
                        root.getLocation());
            }
        }
        RusticType targetType = inference.infer(target, scope);
        inference.coerce(node.getValue(), targetType, scope, "赋值");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Scope scope) {
        RusticType expected = currentFunction.getType();
        if (node.hasValue()) {
            if (Types.isVoid(expected)) {
                throw new CompileException(ErrorKind.TYPE_MISMATCH,
                        "函数 '" + currentFunction.getName() + "' 没有返回类型，不能返回值",
                        node.getValue().getLocation());
            }
            inference.coerce(node.getValue(), expected, scope, "返回值");
        } else if (!Types.isVoid(expected)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "函数 '" + currentFunction.getName() + "' 需要返回 '" + expected.toDisplayString() + "'",
                    node.getLocation());
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Scope scope) {
        checkCondition(node.getCondition(), scope, "if");
        node.getThenBranch().accept(this, scope);
        if (node.hasElse()) {
            node.getElseBranch().accept(this, scope);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Scope scope) {
        checkCondition(node.getCondition(), scope, "while");
        node.getBody().accept(this, scope);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Scope scope) {
        RusticType iterable = inference.infer(node.getIterable(), scope);
        if (!(iterable instanceof ListType)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "for 循环只能遍历 list，得到 '" + iterable.toDisplayString() + "'",
                    node.getIterable().getLocation());
        }
        Scope loopScope = symbolTable.newScope(Scope.ScopeKind.LOOP, scope, node);
        Symbol var = declare(node.getVariable(), SymbolKind.LOOP_VARIABLE,
                ((ListType) iterable).getElementType(), node, node.getVariableLocation(), loopScope, false);
        node.setSymbolId(var.getId());
        node.getBody().accept(this, loopScope);
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node, Scope scope) {
        Expression expr = node.getExpression();
        if (!(expr instanceof CallExpr)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    "表达式语句必须是函数调用", expr.getLocation());
        }
        inference.infer(expr, scope);
        return null;
    }

    // ============ 工具方法 ============

    private void checkCondition(Expression condition, Scope scope, String keyword) {
        RusticType type = inference.infer(condition, scope);
        if (!Types.BOOL.equals(type)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                    keyword + " 条件必须是 bool，得到 '" + type.toDisplayString() + "'",
                    condition.getLocation());
        }
    }

    private static String describe(Symbol sym) {
        switch (sym.getKind()) {
            case VARIABLE: return sym.isReassignable() ? "变量" : "let 绑定";
            case PARAMETER: return "参数";
            case LOOP_VARIABLE: return "循环变量";
            case CONSTANT: return "常量";
            case FUNCTION: return "函数";
            case STRUCT: return "结构体";
            default: return "模块";
        }
    }
}
