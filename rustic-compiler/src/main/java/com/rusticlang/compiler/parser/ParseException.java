package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.lexer.Token;

/**
 * 解析异常：期望的内容、实际遇到的 token 与位置
 */
public class ParseException extends CompileException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token, SourceLocation location) {
        this(message, token, null, location);
    }

    public ParseException(String message, Token token, String expected, SourceLocation location) {
        super(ErrorKind.PARSE, message, location);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 实际遇到的 token 文本 */
    public String getFound() {
        if (token == null) return null;
        return token.describe();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getDetail());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(token.describe()).append(")");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
