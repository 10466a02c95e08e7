package com.rusticlang.compiler.lexer;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;

/**
 * 词法错误
 */
public class LexException extends CompileException {

    /**
     * 词法错误类型
     */
    public enum Kind {
        UNTERMINATED_STRING,
        UNTERMINATED_COMMENT,
        INVALID_CHARACTER,
        MALFORMED_NUMBER
    }

    private final Kind lexKind;

    public LexException(Kind lexKind, String message, SourceLocation location) {
        super(ErrorKind.LEX, message, location);
        this.lexKind = lexKind;
    }

    public Kind getLexKind() {
        return lexKind;
    }
}
