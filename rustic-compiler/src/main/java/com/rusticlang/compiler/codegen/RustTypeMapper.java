package com.rusticlang.compiler.codegen;

import com.rusticlang.compiler.analysis.types.ListType;
import com.rusticlang.compiler.analysis.types.PrimitiveType;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.StructType;
import com.rusticlang.compiler.analysis.types.TypeVariable;
import com.rusticlang.compiler.analysis.types.TypeVisitor;
import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.analysis.types.UnresolvedType;
import com.rusticlang.compiler.ownership.ParamMode;

/**
 * Rustic 类型到 Rust 类型的映射
 */
public final class RustTypeMapper implements TypeVisitor<String> {

    public static final RustTypeMapper INSTANCE = new RustTypeMapper();

    private RustTypeMapper() {}

    /** 拥有所有权的 Rust 类型 */
    public String map(RusticType type) {
        return type.accept(this);
    }

    /**
     * 按参数传递方式映射参数类型：共享的 string / list 使用 &amp;str / &amp;[T]
     */
    public String mapParam(RusticType type, ParamMode mode) {
        switch (mode) {
            case SHARED:
                if (Types.isString(type)) return "&str";
                if (type instanceof ListType) return "&[" + map(((ListType) type).getElementType()) + "]";
                return "&" + map(type);
            case EXCLUSIVE:
                return "&mut " + map(type);
            default:
                return map(type);
        }
    }

    @Override
    public String visitPrimitive(PrimitiveType type) {
        switch (type.getTypeName()) {
            case "int": return "i64";
            case "float": return "f64";
            case "bool": return "bool";
            case "string": return "String";
            default: return "()";
        }
    }

    @Override
    public String visitStruct(StructType type) {
        return RustNames.ident(type.getName());
    }

    @Override
    public String visitList(ListType type) {
        return "Vec<" + map(type.getElementType()) + ">";
    }

    @Override
    public String visitTypeVariable(TypeVariable type) {
        throw new IllegalStateException("Type variable " + type.getName() + " survived type inference");
    }

    @Override
    public String visitUnresolved(UnresolvedType type) {
        throw new IllegalStateException("Unresolved type reached code generation");
    }
}
