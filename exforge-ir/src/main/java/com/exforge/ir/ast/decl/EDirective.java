package com.exforge.ir.ast.decl;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 词法指令：import / require / alias / use
 */
public class EDirective extends ElixirNode {
    private final DirectiveKind kind;
    private final String module;

    public EDirective(SourceLocation location, DirectiveKind kind, String module) {
        super(location);
        this.kind = kind;
        this.module = module;
    }

    public DirectiveKind getKind() {
        return kind;
    }

    public String getModule() {
        return module;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitDirective(this, context);
    }

    public enum DirectiveKind {
        IMPORT("import"),
        REQUIRE("require"),
        ALIAS("alias"),
        USE("use");

        private final String keyword;

        DirectiveKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
