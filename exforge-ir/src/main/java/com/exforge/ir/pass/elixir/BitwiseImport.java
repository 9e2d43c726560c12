package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirChildren;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.decl.EDirective;
import com.exforge.ir.ast.decl.EDirective.DirectiveKind;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.EBinary;
import com.exforge.ir.ast.expr.EUnary;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 使用了位运算的模块开头插入一次 {@code import Bitwise}。不在模块内的树不变。
 */
public class BitwiseImport implements ElixirPass {

    public static final String NAME = "bitwise-import";

    static final String BITWISE = "Bitwise";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return ElixirTransformer.rewrite(root, node -> {
            if (!(node instanceof EModule)) return node;
            EModule module = (EModule) node;
            if (importsBitwise(module) || !usesBitwise(module)) return node;
            List<ElixirNode> body = new ArrayList<>(module.getBody().size() + 1);
            body.add(new EDirective(module.getLocation(), DirectiveKind.IMPORT, BITWISE));
            body.addAll(module.getBody());
            return new EModule(module.getLocation(), module.getName(), body).withMetadataFrom(module);
        });
    }

    static boolean usesBitwise(ElixirNode root) {
        return ElixirChildren.any(root, n ->
                n instanceof EBinary && ((EBinary) n).getOperator().isBitwise()
                        || n instanceof EUnary && ((EUnary) n).getOperator() == UnaryOp.BNOT);
    }

    private static boolean importsBitwise(EModule module) {
        for (ElixirNode item : module.getBody()) {
            if (item instanceof EDirective && ((EDirective) item).getKind() == DirectiveKind.IMPORT
                    && BITWISE.equals(((EDirective) item).getModule())) {
                return true;
            }
        }
        return false;
    }
}
