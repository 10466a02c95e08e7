package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.ConstDecl;
import com.rusticlang.compiler.ast.decl.FieldDecl;
import com.rusticlang.compiler.ast.decl.FnDecl;
import com.rusticlang.compiler.ast.decl.ImportDecl;
import com.rusticlang.compiler.ast.decl.Param;
import com.rusticlang.compiler.ast.decl.StructDecl;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.expr.Literal;
import com.rusticlang.compiler.ast.expr.UnaryExpr;
import com.rusticlang.compiler.ast.stmt.Block;
import com.rusticlang.compiler.ast.type.TypeRef;
import com.rusticlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.rusticlang.compiler.lexer.TokenType.*;

/**
 * 顶层声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * import a.b.c
     */
    ImportDecl parseImportDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");
        List<String> parts = new ArrayList<String>();
        parts.add(parser.expectIdentifier("Expected module name after 'import'").getLexeme());
        while (parser.match(DOT)) {
            parts.add(parser.expectIdentifier("Expected name after '.'").getLexeme());
        }
        return new ImportDecl(loc, parts);
    }

    /**
     * struct Name { field: type, ... }
     */
    StructDecl parseStructDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_STRUCT, "Expected 'struct'");
        Token name = parser.expectIdentifier("Expected struct name");
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after struct name");

        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        skipFieldSeparators();
        while (!parser.check(RBRACE)) {
            SourceLocation fieldLoc = parser.location();
            String fieldName = parser.expectIdentifier("Expected field name").getLexeme();
            parser.expect(COLON, "Expected ':' after field name");
            TypeRef type = parser.typeParser.parseType();
            fields.add(new FieldDecl(fieldLoc, fieldName, type));
            if (!parser.checkAny(COMMA, NEWLINE, RBRACE)) {
                throw parser.error("Expected ',' or newline between fields", "',' or '}'");
            }
            skipFieldSeparators();
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");

        StructDecl decl = new StructDecl(loc, name.getLexeme(), fields);
        decl.setNameLocation(parser.locationOf(name));
        return decl;
    }

    private void skipFieldSeparators() {
        while (parser.matchAny(COMMA, NEWLINE)) {
            // 逗号与换行均可分隔字段
        }
    }

    /**
     * const NAME: type = [-]literal
     */
    ConstDecl parseConstDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CONST, "Expected 'const'");
        Token name = parser.expectIdentifier("Expected constant name");
        parser.expect(COLON, "Expected ':' and a type after constant name");
        TypeRef type = parser.typeParser.parseType();
        parser.expect(ASSIGN, "Expected '=' in constant declaration");

        Expression value = literalValue("Constant value");

        ConstDecl decl = new ConstDecl(loc, name.getLexeme(), type, value);
        decl.setNameLocation(parser.locationOf(name));
        return decl;
    }

    /**
     * [-]literal，常量值与参数默认值共用
     */
    private Expression literalValue(String what) {
        SourceLocation valueLoc = parser.location();
        if (parser.match(MINUS)) {
            if (!parser.checkAny(INT_LITERAL, FLOAT_LITERAL)) {
                throw parser.error("Expected numeric literal after '-'", "number");
            }
            return parser.exprParser.atMinIntMagnitude()
                    ? parser.exprParser.parseMinIntLiteral(valueLoc)
                    : new UnaryExpr(valueLoc, UnaryExpr.UnaryOp.NEG, literal());
        }
        if (parser.checkAny(INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE)) {
            return literal();
        }
        throw parser.error(what + " must be a literal", "literal");
    }

    private Literal literal() {
        return parser.exprParser.parseLiteral();
    }

    /**
     * fn name(p: T, q: T = literal, ...) -> R { ... }
     */
    FnDecl parseFnDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FN, "Expected 'fn'");
        Token name = parser.expectIdentifier("Expected function name");
        parser.expect(LPAREN, "Expected '(' after function name");

        List<Param> params = new ArrayList<Param>();
        boolean defaulted = false;
        parser.skipNewlines();
        if (!parser.check(RPAREN)) {
            do {
                parser.skipNewlines();
                if (parser.check(RPAREN)) break;  // 尾随逗号
                SourceLocation paramLoc = parser.location();
                String paramName = parser.expectIdentifier("Expected parameter name").getLexeme();
                parser.expect(COLON, "Expected ':' and a type after parameter name");
                TypeRef type = parser.typeParser.parseType();
                Expression defaultValue = null;
                if (parser.match(ASSIGN)) {
                    defaultValue = literalValue("Default value");
                    defaulted = true;
                } else if (defaulted) {
                    throw parser.error("Parameter '" + paramName + "' needs a default value after a defaulted parameter",
                            "'='");
                }
                params.add(new Param(paramLoc, paramName, type, defaultValue));
                parser.skipNewlines();
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        TypeRef returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.typeParser.parseType();
        }
        parser.skipNewlines();
        Block body = parser.stmtParser.parseBlock();

        FnDecl decl = new FnDecl(loc, name.getLexeme(), params, returnType, body);
        decl.setNameLocation(parser.locationOf(name));
        return decl;
    }
}
