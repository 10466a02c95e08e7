package com.rusticlang.compiler.lexer;

import static com.rusticlang.compiler.lexer.TokenCategory.*;

/**
 * Rustic 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL(LITERAL),
    FLOAT_LITERAL(LITERAL),
    STRING_LITERAL(LITERAL),

    // === 标识符 ===
    IDENTIFIER(TokenCategory.IDENTIFIER),

    // === 关键词 - 声明 ===
    KW_IMPORT(KEYWORD), KW_STRUCT(KEYWORD), KW_FN(KEYWORD), KW_CONST(KEYWORD),
    KW_LET(KEYWORD), KW_VAR(KEYWORD),

    // === 关键词 - 控制流 ===
    KW_IF(KEYWORD), KW_ELSE(KEYWORD), KW_WHILE(KEYWORD), KW_FOR(KEYWORD),
    KW_IN(KEYWORD), KW_RETURN(KEYWORD),

    // === 关键词 - 布尔字面量 ===
    KW_TRUE(LITERAL), KW_FALSE(LITERAL),

    // === 关键词 - 内置类型 ===
    KW_INT(KEYWORD), KW_FLOAT(KEYWORD), KW_BOOL(KEYWORD), KW_STRING(KEYWORD),
    KW_VOID(KEYWORD), KW_LIST(KEYWORD),

    // === 操作符 - 算术 ===
    PLUS(OPERATOR),         // +
    MINUS(OPERATOR),        // -
    MUL(OPERATOR),          // *
    DIV(OPERATOR),          // /
    MOD(OPERATOR),          // %

    // === 操作符 - 比较 ===
    EQ(OPERATOR),           // ==
    NE(OPERATOR),           // !=
    LT(OPERATOR),           // <
    GT(OPERATOR),           // >
    LE(OPERATOR),           // <=
    GE(OPERATOR),           // >=

    // === 操作符 - 逻辑 ===
    AND(OPERATOR),          // &&
    OR(OPERATOR),           // ||
    NOT(OPERATOR),          // !

    // === 操作符 - 其他 ===
    ASSIGN(OPERATOR),       // =
    ARROW(OPERATOR),        // ->
    DOT(OPERATOR),          // .

    // === 分隔符 ===
    LPAREN(PUNCTUATION),    // (
    RPAREN(PUNCTUATION),    // )
    LBRACE(PUNCTUATION),    // {
    RBRACE(PUNCTUATION),    // }
    LBRACKET(PUNCTUATION),  // [
    RBRACKET(PUNCTUATION),  // ]
    COMMA(PUNCTUATION),     // ,
    COLON(PUNCTUATION),     // :
    SEMICOLON(PUNCTUATION), // ;

    // === 特殊 ===
    NEWLINE(TokenCategory.NEWLINE),
    EOF(TokenCategory.EOF);

    private final TokenCategory category;

    TokenType(TokenCategory category) {
        this.category = category;
    }

    public TokenCategory getCategory() {
        return category;
    }

    /**
     * 是否为关键词（含 true/false）
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为内置类型关键词
     */
    public boolean isBuiltinType() {
        switch (this) {
            case KW_INT:
            case KW_FLOAT:
            case KW_BOOL:
            case KW_STRING:
            case KW_VOID:
            case KW_LIST:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
