package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 匿名对象字面量 { name: expr, ... }
 */
public class TObjectDecl extends TypedExpr {
    private final List<ObjectField> fields;

    public TObjectDecl(SourceLocation location, TypeRef type, List<ObjectField> fields) {
        super(location, type);
        this.fields = fields;
    }

    public TObjectDecl(List<ObjectField> fields) {
        this(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, fields);
    }

    public List<ObjectField> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitObjectDecl(this, context);
    }

    public static final class ObjectField {
        private final String name;
        private final TypedExpr value;

        public ObjectField(String name, TypedExpr value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public TypedExpr getValue() {
            return value;
        }
    }
}
