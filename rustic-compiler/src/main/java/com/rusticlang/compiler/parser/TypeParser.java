package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.ast.type.ListTypeRef;
import com.rusticlang.compiler.ast.type.NamedTypeRef;
import com.rusticlang.compiler.ast.type.TypeRef;

import static com.rusticlang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析类型：int | float | bool | string | void | list[T] | StructName
     */
    TypeRef parseType() {
        SourceLocation loc = parser.location();
        if (parser.check(KW_LIST)) {
            parser.advance();
            parser.expect(LBRACKET, "Expected '[' after 'list'");
            TypeRef element = parseType();
            parser.expect(RBRACKET, "Expected ']' to close list type");
            return new ListTypeRef(loc, element);
        }
        if (parser.current.getType().isBuiltinType() || parser.check(IDENTIFIER)) {
            return new NamedTypeRef(loc, parser.advance().getLexeme());
        }
        throw parser.error("Expected type", "type name");
    }
}
