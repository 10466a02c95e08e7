package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.ast.type.TypeRef;
import com.rusticlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.rusticlang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析代码块 { stmt* }
     */
    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Statement stmt = parseStatement();
            statements.add(stmt);
            if (!endsWithBlock(stmt) && !parser.checkAny(NEWLINE, SEMICOLON, RBRACE)) {
                throw parser.error("Expected end of statement", "newline or ';'");
            }
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}' to close block");
        return new Block(loc, statements);
    }

    private static boolean endsWithBlock(Statement stmt) {
        return stmt instanceof IfStmt || stmt instanceof WhileStmt || stmt instanceof ForStmt;
    }

    Statement parseStatement() {
        if (parser.checkAny(KW_LET, KW_VAR)) {
            return parseLetStmt();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        return parseExpressionOrAssignment();
    }

    private LetStmt parseLetStmt() {
        SourceLocation loc = parser.location();
        boolean reassignable = parser.advance().getType() == KW_VAR;
        Token name = parser.expectIdentifier("Expected variable name");
        parser.expect(COLON, "Expected ':' and a type after variable name");
        TypeRef type = parser.typeParser.parseType();
        parser.expect(ASSIGN, "Expected '=' in variable declaration");
        parser.skipNewlines();
        Expression init = parser.exprParser.parseExpression();
        return new LetStmt(loc, name.getLexeme(), reassignable, type, init, parser.locationOf(name));
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        Expression condition = parser.exprParser.parseHeaderExpression();
        Block thenBranch = parseBlock();

        Statement elseBranch = null;
        // 允许 else 另起一行
        parser.skipNewlines();
        if (parser.match(KW_ELSE)) {
            parser.skipNewlines();
            if (parser.check(KW_IF)) {
                elseBranch = parseIfStmt();
            } else {
                elseBranch = parseBlock();
            }
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parser.exprParser.parseHeaderExpression();
        Block body = parseBlock();
        return new WhileStmt(loc, condition, body);
    }

    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        Token variable = parser.expectIdentifier("Expected loop variable name");
        parser.expect(KW_IN, "Expected 'in' after loop variable");
        Expression iterable = parser.exprParser.parseHeaderExpression();
        Block body = parseBlock();
        return new ForStmt(loc, variable.getLexeme(), parser.locationOf(variable), iterable, body);
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.checkAny(NEWLINE, SEMICOLON, RBRACE, EOF)) {
            value = parser.exprParser.parseExpression();
        }
        return new ReturnStmt(loc, value);
    }

    private Statement parseExpressionOrAssignment() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();
        if (parser.check(ASSIGN)) {
            if (!expr.isPlace()) {
                throw parser.error("Invalid assignment target", "variable or field path");
            }
            parser.advance();
            parser.skipNewlines();
            Expression value = parser.exprParser.parseExpression();
            return new AssignStmt(loc, expr, value);
        }
        return new ExprStmt(loc, expr);
    }
}
