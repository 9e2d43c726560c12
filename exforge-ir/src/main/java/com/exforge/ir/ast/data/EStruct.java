package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 结构体 %Mod{a: 1}，或更新形式 %Mod{base | a: 1}
 */
public class EStruct extends ElixirNode {
    private final String module;
    private final ElixirNode base;
    private final List<EKeywordPair> fields;

    public EStruct(SourceLocation location, String module, ElixirNode base, List<EKeywordPair> fields) {
        super(location);
        this.module = module;
        this.base = base;
        this.fields = fields;
    }

    public String getModule() {
        return module;
    }

    public ElixirNode getBase() {
        return base;
    }

    public List<EKeywordPair> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitStruct(this, context);
    }
}
