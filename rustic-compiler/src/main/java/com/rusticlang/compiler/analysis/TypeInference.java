package com.rusticlang.compiler.analysis;

import com.rusticlang.compiler.analysis.types.ListType;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.StructType;
import com.rusticlang.compiler.analysis.types.TypeCompatibility;
import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.Param;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.rusticlang.compiler.ast.expr.StructLiteralExpr.FieldInit;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.stdlib.MappingEntry;
import com.rusticlang.compiler.stdlib.MappingTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式类型推断：自底向上为每个表达式计算类型并写回 AST。
 */
final class TypeInference implements AstVisitor<RusticType, Scope> {

    private final Resolver resolver;
    private final MappingTable mappingTable;
    private final SemanticChecker checker;

    TypeInference(Resolver resolver, MappingTable mappingTable, SemanticChecker checker) {
        this.resolver = resolver;
        this.mappingTable = mappingTable;
        this.checker = checker;
    }

    /**
     * 计算表达式类型
     */
    RusticType infer(Expression expr, Scope scope) {
        RusticType type = expr.accept(this, scope);
        expr.setType(type);
        return type;
    }

    /**
     * 在给定目标类型的位置上检查表达式（允许 int → float 拓宽，空列表从目标类型取元素类型）
     */
    RusticType coerce(Expression expr, RusticType target, Scope scope, String context) {
        if (expr instanceof ListLiteralExpr && target instanceof ListType) {
            RusticType actual = inferList((ListLiteralExpr) expr, ((ListType) target).getElementType(), scope);
            return checker.checkAssignable(expr, actual, target, context);
        }
        RusticType actual = infer(expr, scope);
        return checker.checkAssignable(expr, actual, target, context);
    }

    // ============ 基本表达式 ============

    @Override
    public RusticType visitLiteral(Literal node, Scope scope) {
        switch (node.getKind()) {
            case INT: return Types.INT;
            case FLOAT: return Types.FLOAT;
            case STRING: return Types.STRING;
            default: return Types.BOOL;
        }
    }

    @Override
    public RusticType visitIdentifier(Identifier node, Scope scope) {
        Symbol sym = resolver.resolve(node, scope);
        switch (sym.getKind()) {
            case FUNCTION:
                throw mismatch("函数 '" + node.getName() + "' 不能作为值使用，是否缺少调用括号？", node);
            case STRUCT:
                throw mismatch("结构体 '" + node.getName() + "' 不能作为值使用", node);
            case MODULE:
                throw mismatch("模块 '" + node.getName() + "' 不能作为值使用", node);
            default:
                return sym.getType();
        }
    }

    // ============ 运算 ============

    @Override
    public RusticType visitBinaryExpr(BinaryExpr node, Scope scope) {
        RusticType left = infer(node.getLeft(), scope);
        RusticType right = infer(node.getRight(), scope);
        BinaryOp op = node.getOperator();

        if (op.isLogical()) {
            if (!Types.BOOL.equals(left) || !Types.BOOL.equals(right)) {
                throw operandMismatch(node, left, right);
            }
            return Types.BOOL;
        }
        if (op == BinaryOp.ADD && Types.isString(left) && Types.isString(right)) {
            return Types.STRING;
        }
        if (op.isArithmetic()) {
            if (!Types.isNumeric(left) || !left.equals(right)) {
                throw operandMismatch(node, left, right);
            }
            return left;
        }
        // 比较
        if (!left.equals(right) || Types.isVoid(left)) {
            throw operandMismatch(node, left, right);
        }
        if (!op.isEquality() && !Types.isNumeric(left) && !Types.isString(left)) {
            throw mismatch("运算符 '" + op.toSourceString() + "' 只能比较数值或字符串，得到 '"
                    + left.toDisplayString() + "'", node);
        }
        return Types.BOOL;
    }

    @Override
    public RusticType visitUnaryExpr(UnaryExpr node, Scope scope) {
        RusticType operand = infer(node.getOperand(), scope);
        if (node.getOperator() == UnaryExpr.UnaryOp.NEG) {
            if (!Types.isNumeric(operand)) {
                throw mismatch("一元 '-' 需要数值操作数，得到 '" + operand.toDisplayString() + "'", node);
            }
            return operand;
        }
        if (!Types.BOOL.equals(operand)) {
            throw mismatch("'!' 需要 bool 操作数，得到 '" + operand.toDisplayString() + "'", node);
        }
        return Types.BOOL;
    }

    // ============ 调用 ============

    @Override
    public RusticType visitCallExpr(CallExpr node, Scope scope) {
        if (node.isBuiltinCall()) {
            return inferBuiltinCall(node, scope);
        }
        Symbol fn = scope.resolve(node.getName());
        if (fn == null) {
            throw new CompileException(ErrorKind.UNRESOLVED_NAME,
                    "未定义的函数 '" + node.getName() + "'", node.getNameLocation());
        }
        if (fn.getKind() != SymbolKind.FUNCTION) {
            throw mismatch("'" + node.getName() + "' 不是函数", node);
        }
        node.setFunctionSymbolId(fn.getId());

        List<Symbol> params = fn.getParameters();
        List<Expression> args = node.getArgs();
        int required = requiredCount(params);
        if (args.size() < required || args.size() > params.size()) {
            String expected = required == params.size()
                    ? String.valueOf(required) : required + " 到 " + params.size();
            throw new CompileException(ErrorKind.ARITY,
                    "函数 '" + fn.getName() + "' 需要 " + expected + " 个参数，实际传入 " + args.size() + " 个",
                    node.getLocation(), fn.getLocation());
        }
        // 省略的参数在调用处补上默认值
        for (int i = args.size(); i < params.size(); i++) {
            args.add(defaultArgument(paramOf(params.get(i)).getDefaultValue(), node.getLocation()));
        }
        for (int i = 0; i < args.size(); i++) {
            coerce(args.get(i), params.get(i).getType(), scope, "参数 '" + params.get(i).getName() + "'");
        }
        return fn.getType();
    }

    private static int requiredCount(List<Symbol> params) {
        int required = 0;
        for (Symbol p : params) {
            if (!paramOf(p).hasDefault()) required++;
        }
        return required;
    }

    private static Param paramOf(Symbol symbol) {
        return (Param) symbol.getDeclaration();
    }

    /**
     * 复制默认值，每个调用点持有自己的节点
     */
    private static Expression defaultArgument(Expression template, SourceLocation at) {
        if (template instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) template;
            return new UnaryExpr(at, unary.getOperator(), defaultArgument(unary.getOperand(), at));
        }
        Literal literal = (Literal) template;
        return new Literal(at, literal.getValue(), literal.getKind(), literal.getLexeme());
    }

    private RusticType inferBuiltinCall(CallExpr node, Scope scope) {
        Symbol shadow = scope.resolve(node.getModule());
        if (shadow != null && shadow.getKind() != SymbolKind.MODULE) {
            throw mismatch("'" + node.getModule() + "' 不是模块，值没有方法；请使用内置模块函数，如 list.len(xs)", node);
        }

        int argc = node.getArgs().size();
        MappingEntry entry = mappingTable.lookup(node.getModule(), node.getName(), argc);
        if (entry == null) {
            List<MappingEntry> overloads = mappingTable.overloads(node.getModule(), node.getName());
            if (!overloads.isEmpty()) {
                Set<Integer> arities = new LinkedHashSet<Integer>();
                for (MappingEntry e : overloads) arities.add(e.getArity());
                throw new CompileException(ErrorKind.ARITY,
                        "内置函数 '" + node.getQualifiedName() + "' 需要 " + joinArities(arities)
                                + " 个参数，实际传入 " + argc + " 个",
                        node.getLocation());
            }
            throw new CompileException(ErrorKind.UNKNOWN_BUILTIN,
                    "未知的内置函数 '" + node.getQualifiedName() + "'（" + argc + " 个参数）",
                    node.getNameLocation());
        }
        node.setBuiltin(entry);

        Map<String, RusticType> bindings = new HashMap<String, RusticType>();
        List<Expression> args = node.getArgs();
        for (int i = 0; i < argc; i++) {
            Expression arg = args.get(i);
            RusticType pattern = TypeCompatibility.substitute(entry.getParamTypes().get(i), bindings);
            String context = "'" + node.getQualifiedName() + "' 的第 " + (i + 1) + " 个参数";
            if (!Types.isGeneric(pattern)) {
                coerce(arg, pattern, scope, context);
                continue;
            }
            if (arg instanceof ListLiteralExpr && ((ListLiteralExpr) arg).isEmpty()) {
                throw mismatch(context + ": 无法推断空列表的元素类型", arg);
            }
            RusticType actual = infer(arg, scope);
            if (!TypeCompatibility.unify(pattern, actual, bindings)) {
                throw new CompileException(ErrorKind.TYPE_MISMATCH,
                        context + ": 类型不匹配，期望 '" + pattern.toDisplayString()
                                + "' 但得到 '" + actual.toDisplayString() + "'",
                        arg.getLocation());
            }
        }
        RusticType result = TypeCompatibility.substitute(entry.getReturnType(), bindings);
        if (Types.isGeneric(result)) {
            throw mismatch("无法推断 '" + node.getQualifiedName() + "' 的返回类型", node);
        }
        return result;
    }

    private static String joinArities(Set<Integer> arities) {
        StringBuilder sb = new StringBuilder();
        for (Integer a : arities) {
            if (sb.length() > 0) sb.append(" 或 ");
            sb.append(a);
        }
        return sb.toString();
    }

    // ============ 结构体与列表 ============

    @Override
    public RusticType visitFieldAccessExpr(FieldAccessExpr node, Scope scope) {
        RusticType receiver = infer(node.getReceiver(), scope);
        if (!(receiver instanceof StructType)) {
            throw new CompileException(ErrorKind.UNKNOWN_FIELD,
                    "类型 '" + receiver.toDisplayString() + "' 没有字段 '" + node.getField() + "'",
                    node.getFieldLocation());
        }
        Symbol struct = resolver.structSymbol(((StructType) receiver).getName());
        RusticType fieldType = struct.getFields().get(node.getField());
        if (fieldType == null) {
            throw new CompileException(ErrorKind.UNKNOWN_FIELD,
                    "结构体 '" + struct.getName() + "' 没有字段 '" + node.getField() + "'",
                    node.getFieldLocation());
        }
        return fieldType;
    }

    @Override
    public RusticType visitStructLiteralExpr(StructLiteralExpr node, Scope scope) {
        Symbol struct = scope.resolve(node.getStructName());
        if (struct == null) {
            throw new CompileException(ErrorKind.UNRESOLVED_NAME,
                    "未定义的结构体 '" + node.getStructName() + "'", node.getLocation());
        }
        if (struct.getKind() != SymbolKind.STRUCT) {
            throw mismatch("'" + node.getStructName() + "' 不是结构体", node);
        }

        Map<String, RusticType> fields = struct.getFields();
        Set<String> seen = new HashSet<String>();
        for (FieldInit init : node.getFields()) {
            RusticType fieldType = fields.get(init.getName());
            if (fieldType == null) {
                throw new CompileException(ErrorKind.UNKNOWN_FIELD,
                        "结构体 '" + struct.getName() + "' 没有字段 '" + init.getName() + "'",
                        init.getLocation());
            }
            if (!seen.add(init.getName())) {
                throw new CompileException(ErrorKind.UNKNOWN_FIELD,
                        "字段 '" + init.getName() + "' 被重复初始化", init.getLocation());
            }
            coerce(init.getValue(), fieldType, scope, "字段 '" + init.getName() + "'");
        }
        List<String> missing = new ArrayList<String>();
        for (String name : fields.keySet()) {
            if (!seen.contains(name)) missing.add(name);
        }
        if (!missing.isEmpty()) {
            throw new CompileException(ErrorKind.MISSING_FIELD,
                    "结构体 '" + struct.getName() + "' 缺少字段: " + String.join(", ", missing),
                    node.getLocation());
        }
        return new StructType(struct.getName());
    }

    @Override
    public RusticType visitListLiteralExpr(ListLiteralExpr node, Scope scope) {
        return inferList(node, null, scope);
    }

    /**
     * 列表字面量：元素类型取自期望类型，没有期望时由元素推断（int 与 float 混合时取 float）
     */
    private RusticType inferList(ListLiteralExpr node, RusticType expectedElement, Scope scope) {
        List<Expression> elements = node.getElements();
        RusticType[] types = new RusticType[elements.size()];
        RusticType element = expectedElement;

        if (element == null) {
            for (int i = 0; i < elements.size(); i++) {
                Expression e = elements.get(i);
                if (e instanceof ListLiteralExpr && ((ListLiteralExpr) e).isEmpty()) continue;
                types[i] = infer(e, scope);
                if (element == null || Types.INT.equals(element) && Types.FLOAT.equals(types[i])) {
                    element = types[i];
                }
            }
            if (element == null) {
                throw mismatch("无法推断空列表的元素类型，请在有类型标注的位置使用 []", node);
            }
        }
        if (Types.isVoid(element)) {
            throw mismatch("列表元素不能是 void", node);
        }
        for (int i = 0; i < elements.size(); i++) {
            Expression e = elements.get(i);
            if (types[i] != null) {
                checker.checkAssignable(e, types[i], element, "列表元素");
            } else {
                coerce(e, element, scope, "列表元素");
            }
        }
        ListType type = Types.listOf(element);
        node.setType(type);
        return type;
    }

    // ============ 工具方法 ============

    private static CompileException operandMismatch(BinaryExpr node, RusticType left, RusticType right) {
        return mismatch("运算符 '" + node.getOperator().toSourceString() + "' 的操作数类型不匹配: '"
                + left.toDisplayString() + "' 与 '" + right.toDisplayString() + "'", node);
    }

    private static CompileException mismatch(String message, Expression node) {
        return new CompileException(ErrorKind.TYPE_MISMATCH, message, node.getLocation());
    }
}
