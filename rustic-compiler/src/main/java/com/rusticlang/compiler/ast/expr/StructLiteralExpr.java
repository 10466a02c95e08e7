package com.rusticlang.compiler.ast.expr;

import com.rusticlang.compiler.ast.AstVisitor;
import com.rusticlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体字面量：Point { x: 1.0, y: 2.0 }
 */
public class StructLiteralExpr extends Expression {
    private final String structName;
    private final List<FieldInit> fields;

    public StructLiteralExpr(SourceLocation location, String structName, List<FieldInit> fields) {
        super(location);
        this.structName = structName;
        this.fields = fields;
    }

    public String getStructName() {
        return structName;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteralExpr(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit {
        private final SourceLocation location;
        private final String name;
        private final Expression value;

        public FieldInit(SourceLocation location, String name, Expression value) {
            this.location = location;
            this.name = name;
            this.value = value;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
