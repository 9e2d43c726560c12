package com.exforge.ir.ast.decl;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.pattern.ElixirPattern;

import java.util.List;

/**
 * 具名函数定义：def / defp / defmacro / defmacrop
 */
public class EDef extends ElixirNode {
    private final DefKind kind;
    private final String name;
    private final List<ElixirPattern> params;
    private final ElixirNode guard;
    private final ElixirNode body;

    public EDef(SourceLocation location, DefKind kind, String name, List<ElixirPattern> params,
                ElixirNode guard, ElixirNode body) {
        super(location);
        this.kind = kind;
        this.name = name;
        this.params = params;
        this.guard = guard;
        this.body = body;
    }

    public DefKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<ElixirPattern> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    /** when 子句，可为 null */
    public ElixirNode getGuard() {
        return guard;
    }

    public ElixirNode getBody() {
        return body;
    }

    public boolean isPrivate() {
        return kind == DefKind.DEFP || kind == DefKind.DEFMACROP;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitDef(this, context);
    }

    public enum DefKind {
        DEF("def"),
        DEFP("defp"),
        DEFMACRO("defmacro"),
        DEFMACROP("defmacrop");

        private final String keyword;

        DefKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
