package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.ast.TVariable;

import java.util.List;

/**
 * 类声明：一个编译单元的根。静态方法和实例方法都降级为模块函数。
 */
public class TClassDecl extends TypedExpr {
    private final String name;
    private final List<String> fieldNames;
    private final List<TMethod> methods;
    private final boolean exception;

    public TClassDecl(SourceLocation location, String name, List<String> fieldNames,
                      List<TMethod> methods, boolean exception) {
        super(location, new TypeRef(name));
        this.name = name;
        this.fieldNames = fieldNames;
        this.methods = methods;
        this.exception = exception;
    }

    public String getName() {
        return name;
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    public List<TMethod> getMethods() {
        return methods;
    }

    /** 是否为异常类型（继承自异常基类） */
    public boolean isException() {
        return exception;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }

    /**
     * 方法声明。实例方法会额外接收名为 struct 的实例参数。
     */
    public static final class TMethod {
        private final String name;
        private final boolean isStatic;
        private final boolean isPublic;
        private final List<TVariable> args;
        private final TypedExpr body;

        public TMethod(String name, boolean isStatic, boolean isPublic, List<TVariable> args, TypedExpr body) {
            this.name = name;
            this.isStatic = isStatic;
            this.isPublic = isPublic;
            this.args = args;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public boolean isStatic() {
            return isStatic;
        }

        public boolean isPublic() {
            return isPublic;
        }

        public List<TVariable> getArgs() {
            return args;
        }

        public TypedExpr getBody() {
            return body;
        }
    }
}
