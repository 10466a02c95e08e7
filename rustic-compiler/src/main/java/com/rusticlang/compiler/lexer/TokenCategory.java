package com.rusticlang.compiler.lexer;

/**
 * 词法单元大类
 */
public enum TokenCategory {
    IDENTIFIER,
    KEYWORD,
    LITERAL,
    OPERATOR,
    PUNCTUATION,
    NEWLINE,
    EOF
}
