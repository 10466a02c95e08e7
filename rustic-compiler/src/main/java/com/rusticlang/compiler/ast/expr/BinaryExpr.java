package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    /** 字符串拼接（类型分析之后才有意义） */
    public boolean isStringConcat() {
        return operator == BinaryOp.ADD && Types.isString(type);
    }

    /**
     * 把左结合的拼接链 a + b + c 展开为操作数列表
     */
    public List<Expression> flattenConcat() {
        List<Expression> operands = new ArrayList<Expression>();
        collectConcat(this, operands);
        return operands;
    }

    private static void collectConcat(Expression e, List<Expression> out) {
        if (e instanceof BinaryExpr && ((BinaryExpr) e).isStringConcat()) {
            collectConcat(((BinaryExpr) e).left, out);
            collectConcat(((BinaryExpr) e).right, out);
        } else {
            out.add(e);
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符，precedence 越大绑定越紧
     */
    public enum BinaryOp {
        // 逻辑
        OR("||", 1),
        AND("&&", 2),

        // 比较
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 3),
        GT(">", 3),
        LE("<=", 3),
        GE(">=", 3),

        // 算术
        ADD("+", 4),
        SUB("-", 4),
        MUL("*", 5),
        DIV("/", 5),
        MOD("%", 5);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符（与 Rust 相同） */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isComparison() {
            return precedence == 3;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isArithmetic() {
            return precedence >= 4;
        }
    }
}
