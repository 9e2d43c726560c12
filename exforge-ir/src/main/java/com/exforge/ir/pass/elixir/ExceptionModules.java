package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.data.EList;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.EAtom;
import com.exforge.ir.ast.expr.ECall;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 异常模块：带 {@link Metadata#EXCEPTION_MODULE} 标记的模块体开头插入 {@code defexception [...]}。
 * 字段取自 {@link Metadata#EXCEPTION_FIELDS}，缺省为 {@code [:message]}；已有 defexception 时不变。
 */
public class ExceptionModules implements ElixirPass {

    public static final String NAME = "exception-modules";

    private static final List<String> DEFAULT_FIELDS = Collections.singletonList("message");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return ElixirTransformer.rewrite(root, node -> {
            if (!(node instanceof EModule) || !node.hasFlag(Metadata.EXCEPTION_MODULE)) return node;
            return withDefexception((EModule) node);
        });
    }

    private static ElixirNode withDefexception(EModule module) {
        for (ElixirNode item : module.getBody()) {
            if (item instanceof ECall && "defexception".equals(((ECall) item).getName())) return module;
        }
        List<String> fields = module.meta(Metadata.EXCEPTION_FIELDS);
        if (fields == null || fields.isEmpty()) fields = DEFAULT_FIELDS;

        SourceLocation loc = module.getLocation();
        List<ElixirNode> atoms = new ArrayList<>(fields.size());
        for (String field : fields) atoms.add(new EAtom(loc, field));
        ElixirNode defexception = new ECall(loc, "defexception",
                Collections.<ElixirNode>singletonList(new EList(loc, atoms)));

        List<ElixirNode> body = new ArrayList<>(module.getBody().size() + 1);
        body.add(defexception);
        body.addAll(module.getBody());
        return new EModule(loc, module.getName(), body).withMetadataFrom(module);
    }
}
