package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

import java.util.Arrays;
import java.util.List;

/**
 * 函数/方法调用。方法调用的 callee 是 TField。
 */
public class TCall extends TypedExpr {
    private final TypedExpr callee;
    private final List<TypedExpr> args;

    public TCall(SourceLocation location, TypeRef type, TypedExpr callee, List<TypedExpr> args) {
        super(location, type);
        this.callee = callee;
        this.args = args;
    }

    public static TCall method(TypedExpr receiver, String name, TypedExpr... args) {
        return new TCall(SourceLocation.UNKNOWN, TypeRef.DYNAMIC,
                new TField(receiver, name), Arrays.asList(args));
    }

    public TypedExpr getCallee() {
        return callee;
    }

    public List<TypedExpr> getArgs() {
        return args;
    }

    /** 若为 receiver.name(...) 形式的方法调用，返回方法名，否则 null */
    public String getMethodName() {
        return callee instanceof TField ? ((TField) callee).getName() : null;
    }

    /** 若为方法调用，返回接收者，否则 null */
    public TypedExpr getReceiver() {
        return callee instanceof TField ? ((TField) callee).getTarget() : null;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
