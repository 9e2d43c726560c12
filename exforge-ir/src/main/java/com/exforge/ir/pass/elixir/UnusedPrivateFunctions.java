package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirChildren;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.data.EKeywordList;
import com.exforge.ir.ast.data.EKeywordPair;
import com.exforge.ir.ast.data.ETuple;
import com.exforge.ir.ast.decl.EAttribute;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 未使用私有函数标注。
 * <p>
 * 模块内从未被调用（也没有被 {@code &name/arity} 捕获）的 defp 记入
 * {@link Metadata#UNUSED_PRIVATE_FUNCTIONS}，并在第一个函数定义之前插入
 * {@code @compile {:nowarn_unused_function, [name: arity]}}。函数对自身的递归调用不算使用。
 */
public class UnusedPrivateFunctions implements ElixirPass {

    public static final String NAME = "unused-private-functions";

    private static final String NOWARN = "nowarn_unused_function";

    private static final Pattern CAPTURE = Pattern.compile("&(?:__MODULE__\\.)?([a-z_][A-Za-z0-9_]*[!?]?)/(\\d+)");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return ElixirTransformer.rewrite(root,
                node -> node instanceof EModule ? annotate((EModule) node) : node);
    }

    private static ElixirNode annotate(EModule module) {
        if (hasNowarnAttribute(module)) return module;
        Set<String> unused = new LinkedHashSet<>();
        for (ElixirNode item : module.getBody()) {
            if (item instanceof EDef && ((EDef) item).isPrivate()) unused.add(key((EDef) item));
        }
        if (unused.isEmpty()) return module;
        unused.removeAll(calledIn(module));
        if (unused.isEmpty()) return module;

        List<EKeywordPair> pairs = new ArrayList<>();
        for (String function : unused) {
            int slash = function.lastIndexOf('/');
            pairs.add(new EKeywordPair(function.substring(0, slash),
                    ELiteral.ofInt(Long.parseLong(function.substring(slash + 1)))));
        }
        EAttribute attribute = new EAttribute(module.getLocation(), "compile",
                new ETuple(module.getLocation(), Arrays.asList(
                        new EAtom(module.getLocation(), NOWARN),
                        new EKeywordList(module.getLocation(), pairs))));

        List<ElixirNode> body = new ArrayList<>(module.getBody());
        body.add(firstDefIndex(body), attribute);
        return new EModule(module.getLocation(), module.getName(), body)
                .withMetadata(module.metadataWith(Metadata.UNUSED_PRIVATE_FUNCTIONS, new ArrayList<>(unused)));
    }

    private static String key(EDef def) {
        return def.getName() + "/" + def.getArity();
    }

    private static int firstDefIndex(List<ElixirNode> body) {
        for (int i = 0; i < body.size(); i++) {
            if (body.get(i) instanceof EDef) return i;
        }
        return body.size();
    }

    private static boolean hasNowarnAttribute(EModule module) {
        for (ElixirNode item : module.getBody()) {
            if (!(item instanceof EAttribute) || !"compile".equals(((EAttribute) item).getName())) continue;
            ElixirNode value = ((EAttribute) item).getValue();
            if (value instanceof ETuple && !((ETuple) value).getElements().isEmpty()) {
                ElixirNode tag = ((ETuple) value).getElements().get(0);
                if (tag instanceof EAtom && NOWARN.equals(((EAtom) tag).getName())) return true;
            }
        }
        return false;
    }

    /** 模块内被调用的 name/arity，不含函数对自身的调用 */
    static Set<String> calledIn(EModule module) {
        Set<String> called = new HashSet<>();
        for (ElixirNode item : module.getBody()) {
            String self = item instanceof EDef ? key((EDef) item) : null;
            collectCalls(item, module.getName(), self, called);
        }
        return called;
    }

    private static void collectCalls(ElixirNode node, String moduleName, String self, Set<String> called) {
        if (node == null) return;
        if (node instanceof EBinary && ((EBinary) node).getOperator() == BinaryOp.PIPE) {
            EBinary pipe = (EBinary) node;
            collectCalls(pipe.getLeft(), moduleName, self, called);
            ElixirNode right = pipe.getRight();
            // 管道右侧少写了第一个参数
            String name = localName(right, moduleName);
            if (name != null) {
                List<ElixirNode> args = argsOf(right);
                record(name + "/" + (args.size() + 1), self, called);
                for (ElixirNode arg : args) collectCalls(arg, moduleName, self, called);
                return;
            }
            collectCalls(right, moduleName, self, called);
            return;
        }
        String name = localName(node, moduleName);
        if (name != null) {
            record(name + "/" + argsOf(node).size(), self, called);
        }
        if (node instanceof ERaw) {
            Matcher m = CAPTURE.matcher(((ERaw) node).getCode());
            while (m.find()) record(m.group(1) + "/" + m.group(2), self, called);
            return;
        }
        ElixirChildren.forEachChild(node, child -> collectCalls(child, moduleName, self, called));
    }

    private static void record(String function, String self, Set<String> called) {
        if (!function.equals(self)) called.add(function);
    }

    /** 本地调用或对本模块的限定调用时返回函数名 */
    private static String localName(ElixirNode node, String moduleName) {
        if (node instanceof ECall) return ((ECall) node).getName();
        if (node instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) node;
            if (call.isOn(moduleName) || call.isOn("__MODULE__")
                    || call.getModule() instanceof EVar && ((EVar) call.getModule()).getName().equals("__MODULE__")) {
                return call.getFunction();
            }
        }
        return null;
    }

    private static List<ElixirNode> argsOf(ElixirNode call) {
        return call instanceof ECall ? ((ECall) call).getArgs() : ((ERemoteCall) call).getArgs();
    }
}
