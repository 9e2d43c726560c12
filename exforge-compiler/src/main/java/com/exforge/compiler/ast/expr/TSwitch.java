package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * switch 表达式。枚举 switch 的 subject 是 TEnumIndex，case 值是整数常量。
 */
public class TSwitch extends TypedExpr {
    private final TypedExpr subject;
    private final List<SwitchCase> cases;
    private final TypedExpr defaultBody;

    public TSwitch(SourceLocation location, TypeRef type, TypedExpr subject, List<SwitchCase> cases, TypedExpr defaultBody) {
        super(location, type);
        this.subject = subject;
        this.cases = cases;
        this.defaultBody = defaultBody;
    }

    public TypedExpr getSubject() {
        return subject;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    public TypedExpr getDefaultBody() {
        return defaultBody;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitSwitch(this, context);
    }

    public static final class SwitchCase {
        private final List<TypedExpr> values;
        private final TypedExpr body;

        public SwitchCase(List<TypedExpr> values, TypedExpr body) {
            this.values = values;
            this.body = body;
        }

        public List<TypedExpr> getValues() {
            return values;
        }

        public TypedExpr getBody() {
            return body;
        }
    }
}
