package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.decl.Declaration;
import com.rusticlang.compiler.ast.decl.ImportDecl;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.lexer.Token;
import com.rusticlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.rusticlang.compiler.lexer.TokenType.*;

/**
 * Rustic 语法分析器（递归下降，LL(1)）
 *
 * <p>单一游标加一个 token 的前瞻，不回溯。遇到第一个不匹配即抛出
 * {@link ParseException}，不做错误恢复。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    private final String moduleName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    // if/while/for 头部不允许结构体字面量
    boolean noStructLiteral;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String moduleName) {
        this.lexer = lexer;
        this.fileName = lexer.getFileName();
        this.moduleName = moduleName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, moduleNameOf(lexer.getFileName()));
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, describe(type));
    }

    /**
     * 解析成员名：标识符
     */
    Token expectIdentifier(String message) {
        return expect(IDENTIFIER, message);
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, current, expected, location());
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return token.toLocation(fileName);
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 跳过换行
     */
    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个编译单元
     */
    public Module parse() {
        SourceLocation loc = location();
        List<ImportDecl> imports = new ArrayList<ImportDecl>();
        List<Declaration> declarations = new ArrayList<Declaration>();

        skipSeparators();
        while (!isAtEnd()) {
            if (check(KW_IMPORT)) {
                imports.add(declParser.parseImportDecl());
                expectDeclarationEnd();
            } else if (check(KW_STRUCT)) {
                declarations.add(declParser.parseStructDecl());
            } else if (check(KW_CONST)) {
                declarations.add(declParser.parseConstDecl());
                expectDeclarationEnd();
            } else if (check(KW_FN)) {
                declarations.add(declParser.parseFnDecl());
            } else {
                throw error("Expected a top-level declaration", "'import', 'struct', 'const' or 'fn'");
            }
            skipSeparators();
        }
        return new Module(loc, moduleName, imports, declarations);
    }

    private void expectDeclarationEnd() {
        if (!checkAny(NEWLINE, SEMICOLON, EOF)) {
            throw error("Expected end of declaration", "newline or ';'");
        }
    }

    static String describe(TokenType type) {
        switch (type) {
            case IDENTIFIER: return "identifier";
            case NEWLINE: return "newline";
            case EOF: return "end of input";
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            case LBRACE: return "'{'";
            case RBRACE: return "'}'";
            case LBRACKET: return "'['";
            case RBRACKET: return "']'";
            case COMMA: return "','";
            case COLON: return "':'";
            case ASSIGN: return "'='";
            case ARROW: return "'->'";
            case DOT: return "'.'";
            case KW_IN: return "'in'";
            default: return type.name();
        }
    }

    /** 由文件名推导模块名：dir/geometry.rsc → geometry */
    public static String moduleNameOf(String fileName) {
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return name;
    }
}
