package com.rusticlang.compiler.lexer;

import com.rusticlang.compiler.ast.SourceLocation;

/**
 * 词法单元
 *
 * <p>literal 为字面量的值：INT → Long，FLOAT → Double，STRING → 转义处理后的 String，
 * 其余 token 为 null。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public TokenCategory getCategory() {
        return type.getCategory();
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** UTF-8 字节偏移 */
    public int getOffset() {
        return offset;
    }

    /**
     * 源码位置；EOF 与换行的长度按 1 计，以便诊断能标出插入点
     */
    public SourceLocation toLocation(String fileName) {
        return new SourceLocation(fileName, line, column, offset, Math.max(lexeme.length(), 1));
    }

    /**
     * 诊断中显示的文本，如 'fn'、newline、end of input
     */
    public String describe() {
        switch (type) {
            case EOF: return "end of input";
            case NEWLINE: return "newline";
            default: return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(' ').append(describe());
        if (literal != null && !(literal instanceof String)) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
