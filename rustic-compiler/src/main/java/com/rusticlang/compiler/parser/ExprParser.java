package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.rusticlang.compiler.ast.expr.StructLiteralExpr.FieldInit;
import com.rusticlang.compiler.lexer.LexException;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.rusticlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级（低 → 高）：|| &lt; &amp;&amp; &lt; 比较 &lt; + - &lt; * / % &lt; 一元 &lt; 后缀 &lt; 基本表达式。
 * 二元运算符后允许换行。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseOr();
    }

    /**
     * 解析 if/while/for 头部表达式（不允许结构体字面量）
     */
    Expression parseHeaderExpression() {
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = true;
        try {
            return parseExpression();
        } finally {
            parser.noStructLiteral = saved;
        }
    }

    /**
     * 解析括号、方括号、实参等嵌套位置中的表达式（重新允许结构体字面量）
     */
    private Expression parseNested() {
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;
        try {
            parser.skipNewlines();
            Expression e = parseExpression();
            parser.skipNewlines();
            return e;
        } finally {
            parser.noStructLiteral = saved;
        }
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(OR)) {
            left = binary(left, BinaryOp.OR, true);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseComparison();
        while (parser.check(AND)) {
            left = binary(left, BinaryOp.AND, false);
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        while (parser.current.getType().isComparisonOp()) {
            BinaryOp op;
            switch (parser.current.getType()) {
                case EQ: op = BinaryOp.EQ; break;
                case NE: op = BinaryOp.NE; break;
                case LT: op = BinaryOp.LT; break;
                case GT: op = BinaryOp.GT; break;
                case LE: op = BinaryOp.LE; break;
                default: op = BinaryOp.GE; break;
            }
            SourceLocation loc = parser.location();
            parser.advance();
            parser.skipNewlines();
            Expression right = parseAdditive();
            left = new BinaryExpr(loc, left, op, right);
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryOp op = parser.check(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            SourceLocation loc = parser.location();
            parser.advance();
            parser.skipNewlines();
            left = new BinaryExpr(loc, left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(MUL, DIV, MOD)) {
            BinaryOp op = parser.check(MUL) ? BinaryOp.MUL : parser.check(DIV) ? BinaryOp.DIV : BinaryOp.MOD;
            SourceLocation loc = parser.location();
            parser.advance();
            parser.skipNewlines();
            left = new BinaryExpr(loc, left, op, parseUnary());
        }
        return left;
    }

    private Expression binary(Expression left, BinaryOp op, boolean or) {
        SourceLocation loc = parser.location();
        parser.advance();
        parser.skipNewlines();
        Expression right = or ? parseAnd() : parseComparison();
        return new BinaryExpr(loc, left, op, right);
    }

    private Expression parseUnary() {
        if (parser.checkAny(MINUS, NOT)) {
            SourceLocation loc = parser.location();
            UnaryExpr.UnaryOp op = parser.advance().getType() == MINUS ? UnaryExpr.UnaryOp.NEG : UnaryExpr.UnaryOp.NOT;
            if (op == UnaryExpr.UnaryOp.NEG && atMinIntMagnitude()) {
                return parseMinIntLiteral(loc);
            }
            return new UnaryExpr(loc, op, parseUnary());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            if (parser.check(LPAREN)) {
                if (!(expr instanceof Identifier)) {
                    throw parser.error("Only named functions can be called", "operator or end of expression");
                }
                Identifier callee = (Identifier) expr;
                expr = new CallExpr(callee.getLocation(), null, callee.getName(), callee.getLocation(), parseArguments());
            } else if (parser.check(DOT)) {
                parser.advance();
                Token member = parser.expectIdentifier("Expected field name after '.'");
                SourceLocation memberLoc = parser.locationOf(member);
                if (parser.check(LPAREN)) {
                    if (!(expr instanceof Identifier)) {
                        throw parser.error("Methods are not supported; call module functions such as list.push(xs, x)",
                                "field name without '('");
                    }
                    Identifier module = (Identifier) expr;
                    expr = new CallExpr(module.getLocation(), module.getName(), member.getLexeme(), memberLoc,
                            parseArguments());
                } else {
                    expr = new FieldAccessExpr(expr.getLocation(), expr, member.getLexeme(), memberLoc);
                }
            } else {
                return expr;
            }
        }
    }

    private List<Expression> parseArguments() {
        parser.expect(LPAREN, "Expected '('");
        List<Expression> args = new ArrayList<Expression>();
        parser.skipNewlines();
        if (!parser.check(RPAREN)) {
            do {
                parser.skipNewlines();
                if (parser.check(RPAREN)) break;  // 尾随逗号
                args.add(parseNested());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();

        if (parser.checkAny(INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE)) {
            return parseLiteral();
        }

        // string.len(s) / list.push(xs, x)：内置模块名恰好是类型关键词
        if (parser.checkAny(KW_STRING, KW_LIST) && parser.peek().getType() == DOT) {
            Token module = parser.advance();
            parser.advance();  // .
            Token member = parser.expectIdentifier("Expected function name after '" + module.getLexeme() + ".'");
            SourceLocation memberLoc = parser.locationOf(member);
            if (!parser.check(LPAREN)) {
                throw parser.error("Expected '(' after built-in function name", "'('");
            }
            return new CallExpr(loc, module.getLexeme(), member.getLexeme(), memberLoc, parseArguments());
        }

        if (parser.check(IDENTIFIER)) {
            Token name = parser.advance();
            if (parser.check(LBRACE) && !parser.noStructLiteral) {
                return parseStructLiteral(loc, name.getLexeme());
            }
            return new Identifier(loc, name.getLexeme());
        }

        if (parser.match(LPAREN)) {
            Expression inner = parseNested();
            parser.expect(RPAREN, "Expected ')' after expression");
            return inner;
        }

        if (parser.match(LBRACKET)) {
            List<Expression> elements = new ArrayList<Expression>();
            parser.skipNewlines();
            if (!parser.check(RBRACKET)) {
                do {
                    parser.skipNewlines();
                    if (parser.check(RBRACKET)) break;
                    elements.add(parseNested());
                } while (parser.match(COMMA));
            }
            parser.expect(RBRACKET, "Expected ']' after list elements");
            return new ListLiteralExpr(loc, elements);
        }

        throw parser.error("Expected expression", "expression");
    }

    private StructLiteralExpr parseStructLiteral(SourceLocation loc, String structName) {
        parser.expect(LBRACE, "Expected '{'");
        List<FieldInit> fields = new ArrayList<FieldInit>();
        parser.skipNewlines();
        while (!parser.check(RBRACE)) {
            SourceLocation fieldLoc = parser.location();
            String fieldName = parser.expectIdentifier("Expected field name in struct literal").getLexeme();
            parser.expect(COLON, "Expected ':' after field name");
            Expression value = parseNested();
            fields.add(new FieldInit(fieldLoc, fieldName, value));
            if (!parser.match(COMMA)) {
                parser.skipNewlines();
                break;
            }
            parser.skipNewlines();
        }
        parser.expect(RBRACE, "Expected '}' after struct literal fields");
        return new StructLiteralExpr(loc, structName, fields);
    }

    /**
     * 当前 token 是否为 i64::MIN 的绝对值
     */
    boolean atMinIntMagnitude() {
        return parser.check(INT_LITERAL) && Lexer.I64_MIN_MAGNITUDE.equals(parser.current.getLexeme());
    }

    /**
     * -9223372036854775808：负号与绝对值折叠为一个字面量
     *
     * @param minusLoc 已消费的负号位置
     */
    Literal parseMinIntLiteral(SourceLocation minusLoc) {
        Token token = parser.advance();
        SourceLocation loc = new SourceLocation(minusLoc.getFile(), minusLoc.getLine(), minusLoc.getColumn(),
                minusLoc.getOffset(), token.getOffset() + token.getLexeme().length() - minusLoc.getOffset());
        return new Literal(loc, Long.MIN_VALUE, Literal.LiteralKind.INT, "-" + token.getLexeme());
    }

    /**
     * 解析字面量 token
     */
    Literal parseLiteral() {
        SourceLocation loc = parser.location();
        Token token = parser.advance();
        switch (token.getType()) {
            case INT_LITERAL:
                if (Lexer.I64_MIN_MAGNITUDE.equals(token.getLexeme())) {
                    throw new LexException(LexException.Kind.MALFORMED_NUMBER,
                            "Integer literal out of range: " + token.getLexeme(), loc);
                }
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT, token.getLexeme());
            case FLOAT_LITERAL:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT, token.getLexeme());
            case STRING_LITERAL:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING, token.getLexeme());
            case KW_TRUE:
            case KW_FALSE:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.BOOL, token.getLexeme());
            default:
                throw new ParseException("Expected literal", token, "literal", parser.locationOf(token));
        }
    }
}
