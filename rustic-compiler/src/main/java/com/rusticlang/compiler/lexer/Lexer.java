package com.rusticlang.compiler.lexer;

import com.rusticlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rustic 词法分析器
 *
 * <p>单遍扫描，按需产出 Token（{@link #nextToken()}），以 EOF 结束。
 * 遇到非法输入立即抛出 {@link LexException}，不做恢复。</p>
 */
public class Lexer {

    /** i64::MIN 的绝对值，超出 i64 范围，只能紧跟在负号之后出现 */
    public static final String I64_MIN_MAGNITUDE = "9223372036854775808";

    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // UTF-8 字节偏移
    private int byteOffset = 0;
    private int startByte = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private boolean finished;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("import", TokenType.KW_IMPORT);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("fn", TokenType.KW_FN);
        map.put("const", TokenType.KW_CONST);
        map.put("let", TokenType.KW_LET);
        map.put("var", TokenType.KW_VAR);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        // 内置类型
        map.put("int", TokenType.KW_INT);
        map.put("float", TokenType.KW_FLOAT);
        map.put("bool", TokenType.KW_BOOL);
        map.put("string", TokenType.KW_STRING);
        map.put("void", TokenType.KW_VOID);
        map.put("list", TokenType.KW_LIST);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后持续返回 EOF。
     */
    public Token nextToken() {
        while (true) {
            skipWhitespaceAndComments();
            markStart();
            if (isAtEnd()) {
                finished = true;
                return new Token(TokenType.EOF, "", null, line, column, byteOffset);
            }
            Token token = scanToken();
            if (token != null) {
                return token;
            }
        }
    }

    /**
     * 执行词法分析，返回完整 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    /** 是否已产出 EOF */
    public boolean isFinished() {
        return finished;
    }

    private void markStart() {
        start = current;
        startByte = byteOffset;
        startLine = line;
        startColumn = column;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // 单行注释
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c == '/' && peekNext() == '*') {
                markStart();
                advance();
                advance();
                blockComment();
            } else {
                break;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': return token(TokenType.LPAREN);
            case ')': return token(TokenType.RPAREN);
            case '{': return token(TokenType.LBRACE);
            case '}': return token(TokenType.RBRACE);
            case '[': return token(TokenType.LBRACKET);
            case ']': return token(TokenType.RBRACKET);
            case ',': return token(TokenType.COMMA);
            case ';': return token(TokenType.SEMICOLON);
            case ':': return token(TokenType.COLON);
            case '.': return token(TokenType.DOT);
            case '+': return token(TokenType.PLUS);
            case '*': return token(TokenType.MUL);
            case '/': return token(TokenType.DIV);
            case '%': return token(TokenType.MOD);

            // 可能是多字符的 Token
            case '-':
                return token(match('>') ? TokenType.ARROW : TokenType.MINUS);

            case '=':
                return token(match('=') ? TokenType.EQ : TokenType.ASSIGN);

            case '!':
                return token(match('=') ? TokenType.NE : TokenType.NOT);

            case '<':
                return token(match('=') ? TokenType.LE : TokenType.LT);

            case '>':
                return token(match('=') ? TokenType.GE : TokenType.GT);

            case '&':
                if (match('&')) return token(TokenType.AND);
                throw error(LexException.Kind.INVALID_CHARACTER, "Unexpected character '&'. Did you mean '&&'?");

            case '|':
                if (match('|')) return token(TokenType.OR);
                throw error(LexException.Kind.INVALID_CHARACTER, "Unexpected character '|'. Did you mean '||'?");

            case '\n': {
                Token t = token(TokenType.NEWLINE);
                newLine();
                return t;
            }

            // 字符串
            case '"':
                return string();

            default:
                if (isDigit(c)) {
                    return number();
                } else if (isAlpha(c)) {
                    return identifier();
                }
                throw error(LexException.Kind.INVALID_CHARACTER, "Unexpected character: " + c);
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        byteOffset += utf8Length(c);
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    /** UTF-16 代码单元对应的 UTF-8 字节数（代理对各计 2 字节，合计 4） */
    private static int utf8Length(char c) {
        if (c < 0x80) return 1;
        if (c < 0x800) return 2;
        if (Character.isSurrogate(c)) return 2;
        return 3;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private Token token(TokenType type) {
        return token(type, null);
    }

    private Token token(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, startByte);
    }

    private SourceLocation startLocation() {
        return new SourceLocation(fileName, startLine, startColumn, startByte, Math.max(current - start, 1));
    }

    private LexException error(LexException.Kind kind, String message) {
        return new LexException(kind, message, startLocation());
    }

    // === 复杂 Token 扫描 ===

    private Token string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                newLine();
                value.append(c);
            } else if (c == '\\') {
                if (isAtEnd()) break;
                value.append(escapeChar());
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            throw error(LexException.Kind.UNTERMINATED_STRING, "Unterminated string");
        }

        advance(); // 闭合的 "
        return token(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case '\\': return '\\';
            case '"': return '"';
            default:
                throw new LexException(LexException.Kind.INVALID_CHARACTER,
                        "Invalid escape sequence: \\" + c,
                        new SourceLocation(fileName, line, column - 2, byteOffset - 1 - utf8Length(c), 2));
        }
    }

    private Token number() {
        while (isDigit(peek())) advance();

        boolean isFloat = false;

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // 消费 .
            while (isDigit(peek())) advance();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            advance();
            if (sign == '+' || sign == '-') advance();
            if (!isDigit(peek())) {
                throw error(LexException.Kind.MALFORMED_NUMBER,
                        "Malformed exponent in number: " + source.substring(start, current));
            }
            while (isDigit(peek())) advance();
            isFloat = true;
        }

        // 数字后紧跟字母：12ab
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            throw error(LexException.Kind.MALFORMED_NUMBER,
                    "Malformed number: " + source.substring(start, current));
        }

        String text = source.substring(start, current);
        if (isFloat) {
            try {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    throw error(LexException.Kind.MALFORMED_NUMBER, "Float literal out of range: " + text);
                }
                return token(TokenType.FLOAT_LITERAL, value);
            } catch (NumberFormatException e) {
                throw error(LexException.Kind.MALFORMED_NUMBER, "Invalid float literal: " + text);
            }
        }
        if (I64_MIN_MAGNITUDE.equals(text)) {
            // 只在一元负号之后合法，由语法分析器检查
            return token(TokenType.INT_LITERAL, Long.MIN_VALUE);
        }
        try {
            return token(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error(LexException.Kind.MALFORMED_NUMBER, "Integer literal out of range: " + text);
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        if (type == TokenType.KW_TRUE) return token(type, Boolean.TRUE);
        if (type == TokenType.KW_FALSE) return token(type, Boolean.FALSE);
        return token(type);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (advance() == '\n') newLine();
            }
        }
        if (depth > 0) {
            throw error(LexException.Kind.UNTERMINATED_COMMENT, "Unterminated block comment");
        }
    }
}
