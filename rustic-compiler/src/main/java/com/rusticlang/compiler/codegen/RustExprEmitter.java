package com.rusticlang.compiler.codegen;

import com.rusticlang.compiler.analysis.Symbol;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.analysis.types.ListType;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.expr.Literal.LiteralKind;
import com.rusticlang.compiler.ast.expr.StructLiteralExpr.FieldInit;
import com.rusticlang.compiler.ownership.FunctionContract;
import com.rusticlang.compiler.ownership.OwnershipDecision;
import com.rusticlang.compiler.ownership.OwnershipTable;
import com.rusticlang.compiler.ownership.ParamMode;
import com.rusticlang.compiler.stdlib.MappingEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式生成：把带类型与所有权决策的表达式渲染为 Rust 表达式文本
 *
 * <p>{@link #emit} 给出表达式本身的形式（含 CLONE 与 int → float 转换），
 * 所在位置需要的借用标记由 {@link #value}、{@link #sharedRef}、{@link #exclusiveRef}、
 * {@link #receiver} 补上。</p>
 */
final class RustExprEmitter implements AstVisitor<String, Void> {

    private final SymbolTable symbols;
    private final OwnershipTable ownership;

    RustExprEmitter(SymbolTable symbols, OwnershipTable ownership) {
        this.symbols = symbols;
        this.ownership = ownership;
    }

    // ============ 位置 ============

    /** 表达式本身 */
    String emit(Expression e) {
        String text = e.accept(this, null);
        if (e.isWidened()) {
            if (e instanceof Literal && ((Literal) e).getKind() == LiteralKind.INT) {
                return ((Literal) e).getLexeme() + ".0";
            }
            // as 的优先级高于二元运算符，复合表达式先加括号
            String operand = isAtomicForm(e) ? text : "(" + text + ")";
            return "(" + operand + " as f64)";
        }
        return text;
    }

    /** 需要拥有所有权的值 */
    String value(Expression e) {
        if (isStringLiteral(e)) {
            return quote((String) ((Literal) e).getValue()) + ".to_string()";
        }
        return emit(e);
    }

    /**
     * 共享借用实参
     *
     * @param declared 形参声明类型；内置函数的泛型形参要求精确的 &amp;T
     */
    String sharedRef(Expression e, RusticType declared) {
        boolean generic = Types.isGeneric(declared);
        if (isStringLiteral(e)) {
            String lit = quote((String) ((Literal) e).getValue());
            return generic ? "&" + lit + ".to_string()" : lit;
        }
        if (e instanceof Identifier && !e.isWidened()) {
            Identifier id = (Identifier) e;
            String name = emit(id);
            if (isReference(id)) {
                if (generic && ownership.getParamMode(id.getSymbolId()) == ParamMode.SHARED) {
                    if (Types.isString(id.getType())) return "&" + name + ".to_string()";
                    if (id.getType() instanceof ListType) return "&" + name + ".to_vec()";
                }
                return name;
            }
            return "&" + name;
        }
        if (e instanceof FieldAccessExpr && e.isPlace()) {
            return "&" + emit(e);
        }
        return "&" + wrap(value(e), e);
    }

    /** 独占借用实参 */
    String exclusiveRef(Expression e) {
        if (e instanceof Identifier) {
            Identifier id = (Identifier) e;
            return isReference(id) ? emit(id) : "&mut " + emit(id);
        }
        if (e instanceof FieldAccessExpr && e.isPlace()) {
            return "&mut " + emit(e);
        }
        return "&mut " + wrap(value(e), e);
    }

    /** 方法接收者，原样使用 */
    String receiver(Expression e) {
        return wrap(emit(e), e);
    }

    // ============ 基本表达式 ============

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        if (node.getKind() == LiteralKind.STRING) {
            return quote((String) node.getValue());
        }
        return node.getLexeme();
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        Symbol sym = symbols.get(node.getSymbolId());
        String name = RustNames.ident(sym.getName());
        if (ownership.getDecision(node) != OwnershipDecision.CLONE) {
            return name;
        }
        if (ownership.getParamMode(sym.getId()) == ParamMode.SHARED) {
            if (Types.isString(sym.getType())) return name + ".to_string()";
            if (sym.getType() instanceof ListType) return name + ".to_vec()";
        }
        return name + ".clone()";
    }

    @Override
    public String visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
        Expression receiver = node.getReceiver();
        String base = receiver instanceof Identifier || receiver instanceof FieldAccessExpr
                ? emit(receiver)
                : wrap(emit(receiver), receiver);
        String text = base + "." + RustNames.ident(node.getField());
        if (ownership.getDecision(node) == OwnershipDecision.CLONE) {
            text += ".clone()";
        }
        return text;
    }

    // ============ 运算 ============

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        if (node.isStringConcat()) {
            return concat(node);
        }
        String op = " " + node.getOperator().toSourceString() + " ";
        RusticType operandType = node.getLeft().getType();
        if (Types.isString(operandType)) {
            return stringOperand(node.getLeft()) + op + stringOperand(node.getRight());
        }
        if (!operandType.isCopy()) {
            return derefOperand(node.getLeft()) + op + derefOperand(node.getRight());
        }
        return child(node.getLeft(), node, false) + op + child(node.getRight(), node, true);
    }

    /** a + b + "x" → format!("{}{}x", a, b) */
    private String concat(BinaryExpr node) {
        StringBuilder format = new StringBuilder();
        List<String> args = new ArrayList<String>();
        for (Expression operand : node.flattenConcat()) {
            if (isStringLiteral(operand)) {
                String escaped = escape((String) ((Literal) operand).getValue());
                format.append(escaped.replace("{", "{{").replace("}", "}}"));
            } else {
                format.append("{}");
                args.add(emit(operand));
            }
        }
        StringBuilder sb = new StringBuilder("format!(\"").append(format).append('"');
        for (String arg : args) {
            sb.append(", ").append(arg);
        }
        return sb.append(')').toString();
    }

    /** 字符串比较统一比较 &amp;str */
    private String stringOperand(Expression e) {
        if (isStringLiteral(e)) {
            return emit(e);
        }
        if (e instanceof Identifier && ownership.getParamMode(((Identifier) e).getSymbolId()) == ParamMode.SHARED) {
            return emit(e);
        }
        return wrap(emit(e), e) + ".as_str()";
    }

    /** 结构体 / 列表相等比较：引用绑定解引用后比较 */
    private String derefOperand(Expression e) {
        if (e instanceof Identifier && isReference((Identifier) e)) {
            return "*" + emit(e);
        }
        return wrap(emit(e), e);
    }

    private String child(Expression child, BinaryExpr parent, boolean right) {
        String text = emit(child);
        if (!(child instanceof BinaryExpr) || child.isWidened() || ((BinaryExpr) child).isStringConcat()) {
            return text;
        }
        BinaryExpr.BinaryOp c = ((BinaryExpr) child).getOperator();
        BinaryExpr.BinaryOp p = parent.getOperator();
        boolean parens = c.getPrecedence() < p.getPrecedence()
                || (right && c.getPrecedence() == p.getPrecedence())
                || (c.isComparison() && p.isComparison());
        return parens ? "(" + text + ")" : text;
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        Expression operand = node.getOperand();
        String text = emit(operand);
        if (operand instanceof BinaryExpr && !operand.isWidened()) {
            text = "(" + text + ")";
        }
        return node.getOperator().toSourceString() + text;
    }

    // ============ 调用 ============

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        List<Expression> args = node.getArgs();
        MappingEntry builtin = node.getBuiltin();
        if (builtin != null) {
            List<String> rendered = new ArrayList<String>();
            for (int i = 0; i < args.size(); i++) {
                Expression arg = args.get(i);
                switch (builtin.getArgMode(i)) {
                    case REF:
                        rendered.add(sharedRef(arg, builtin.getParamTypes().get(i)));
                        break;
                    case REF_MUT:
                        rendered.add(exclusiveRef(arg));
                        break;
                    case RECEIVER:
                    case RECEIVER_MUT:
                        rendered.add(receiver(arg));
                        break;
                    default:
                        rendered.add(wrap(value(arg), arg));
                        break;
                }
            }
            return builtin.expand(rendered);
        }

        FunctionContract contract = ownership.getContract(node.getFunctionSymbolId());
        Symbol fn = symbols.get(node.getFunctionSymbolId());
        StringBuilder sb = new StringBuilder(RustNames.ident(fn.getName())).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            Expression arg = args.get(i);
            switch (contract.getMode(i)) {
                case SHARED:
                    sb.append(sharedRef(arg, fn.getParameters().get(i).getType()));
                    break;
                case EXCLUSIVE:
                    sb.append(exclusiveRef(arg));
                    break;
                default:
                    sb.append(value(arg));
                    break;
            }
        }
        return sb.append(')').toString();
    }

    // ============ 结构体与列表 ============

    @Override
    public String visitStructLiteralExpr(StructLiteralExpr node, Void ctx) {
        String name = RustNames.ident(node.getStructName());
        if (node.getFields().isEmpty()) {
            return name + " {}";
        }
        StringBuilder sb = new StringBuilder(name).append(" { ");
        for (int i = 0; i < node.getFields().size(); i++) {
            FieldInit init = node.getFields().get(i);
            if (i > 0) sb.append(", ");
            sb.append(RustNames.ident(init.getName())).append(": ").append(value(init.getValue()));
        }
        return sb.append(" }").toString();
    }

    @Override
    public String visitListLiteralExpr(ListLiteralExpr node, Void ctx) {
        if (node.isEmpty()) {
            return "Vec::new()";
        }
        StringBuilder sb = new StringBuilder("vec![");
        for (int i = 0; i < node.getElements().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(value(node.getElements().get(i)));
        }
        return sb.append(']').toString();
    }

    // ============ 工具方法 ============

    private boolean isReference(Identifier id) {
        return ownership.isReferenceBinding(id.getSymbolId());
    }

    private static boolean isStringLiteral(Expression e) {
        return e instanceof Literal && ((Literal) e).getKind() == LiteralKind.STRING;
    }

    /**
     * 非原子表达式加括号，以便作为方法接收者、模板实参或比较操作数
     */
    static String wrap(String text, Expression e) {
        return isAtomic(e) ? text : "(" + text + ")";
    }

    private static boolean isAtomic(Expression e) {
        return e.isWidened() || isAtomicForm(e);
    }

    private static boolean isAtomicForm(Expression e) {
        if (e instanceof Literal) {
            // i64::MIN 字面量自带负号
            return !((Literal) e).getLexeme().startsWith("-");
        }
        if (e instanceof Identifier || e instanceof FieldAccessExpr || e instanceof ListLiteralExpr) {
            return true;
        }
        if (e instanceof CallExpr) {
            MappingEntry builtin = ((CallExpr) e).getBuiltin();
            return builtin == null || !builtin.getTemplate().startsWith("{");
        }
        return e instanceof BinaryExpr && ((BinaryExpr) e).isStringConcat();
    }

    static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u{%x}", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }
}
