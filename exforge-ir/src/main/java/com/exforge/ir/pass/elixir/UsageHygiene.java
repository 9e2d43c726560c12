package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirChildren;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.expr.EAssign;
import com.exforge.ir.ast.expr.EMatch;
import com.exforge.ir.ast.expr.EVar;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PPin;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.ast.pattern.PatternTransformer;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 变量使用卫生。
 * <p>
 * 以函数定义为单位分析（不含定义时以整棵树为单位）：
 * <ul>
 *   <li>绑定后从未被读取的名字加下划线前缀；</li>
 *   <li>带下划线前缀但被读取的名字去掉前缀，去掉后为空、不是合法变量名或与已有名字冲突时保留。</li>
 * </ul>
 * 改名在该作用域内的每个出现处一致生效。首次绑定时匹配右侧对自身绑定名的读取不算使用；
 * 名字此前已绑定时，这类读取指向更早的绑定，计为使用。
 * 重复执行结果不变。
 */
public class UsageHygiene implements ElixirPass {

    public static final String NAME = "usage-hygiene";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        if (!ElixirChildren.any(root, n -> n instanceof EDef)) {
            return apply(root);
        }
        return ElixirTransformer.rewrite(root, node -> node instanceof EDef ? apply(node) : node);
    }

    /** 对一个作用域计算并应用改名 */
    static ElixirNode apply(ElixirNode scope) {
        Map<String, String> renames = renamesFor(scope);
        if (renames.isEmpty()) return scope;
        return new Renamer(renames).transform(scope);
    }

    static Map<String, String> renamesFor(ElixirNode scope) {
        Set<String> bound = boundIn(scope);
        Set<String> used = new HashSet<>();
        collectUses(scope, Collections.<String>emptySet(), new HashSet<String>(), used);

        Set<String> taken = new HashSet<>(bound);
        taken.addAll(used);
        Map<String, String> renames = new LinkedHashMap<>();
        for (String name : bound) {
            String target = null;
            if (!name.startsWith("_") && !used.contains(name)) {
                target = "_" + name;
            } else if (name.startsWith("_") && used.contains(name)) {
                String stripped = name.substring(1);
                if (isPlainName(stripped)) target = stripped;
            }
            if (target == null || taken.contains(target)) continue;
            taken.add(target);
            renames.put(name, target);
        }
        return renames;
    }

    private static boolean isPlainName(String name) {
        return !name.isEmpty() && Character.isLowerCase(name.charAt(0));
    }

    private static Set<String> boundIn(ElixirNode scope) {
        Set<String> names = new LinkedHashSet<>();
        ElixirChildren.walk(scope, node -> {
            if (node instanceof EAssign && ((EAssign) node).getTarget() instanceof EVar) {
                names.add(((EVar) ((EAssign) node).getTarget()).getName());
            }
            ElixirChildren.forEachPattern(node, p -> names.addAll(VarUsage.boundNames(p)));
        });
        return names;
    }

    /**
     * 按求值顺序收集被读取的名字。seen 是此前已经绑定过的名字；excluded 是当前匹配右侧正在首次绑定的名字，
     * 这些自引用不计入。重新绑定时右侧的同名读取指向更早的绑定，计为使用。
     */
    private static void collectUses(ElixirNode node, Set<String> excluded, Set<String> seen, Set<String> used) {
        if (node == null) return;
        if (node instanceof EVar) {
            String name = ((EVar) node).getName();
            if (!excluded.contains(name)) used.add(name);
            return;
        }
        if (node instanceof EMatch) {
            EMatch match = (EMatch) node;
            Set<String> targets = VarUsage.boundNames(match.getPattern());
            VarUsage.forEachPatternName(match.getPattern(), bound -> { }, used::add);
            collectUses(match.getValue(), selfReferences(excluded, targets, seen), seen, used);
            seen.addAll(targets);
            return;
        }
        if (node instanceof EAssign && ((EAssign) node).getTarget() instanceof EVar) {
            EAssign assign = (EAssign) node;
            String target = ((EVar) assign.getTarget()).getName();
            // 复合赋值本身读取目标
            if (assign.getOperator() != null && !excluded.contains(target)) used.add(target);
            collectUses(assign.getValue(), selfReferences(excluded, Collections.singleton(target), seen), seen, used);
            seen.add(target);
            return;
        }
        ElixirChildren.forEachPattern(node, p -> VarUsage.forEachPatternName(p, seen::add, used::add));
        ElixirChildren.forEachChild(node, child -> collectUses(child, excluded, seen, used));
    }

    private static Set<String> selfReferences(Set<String> excluded, Set<String> targets, Set<String> seen) {
        Set<String> self = new HashSet<>(excluded);
        for (String target : targets) {
            if (seen.contains(target)) {
                self.remove(target);
            } else {
                self.add(target);
            }
        }
        return self;
    }

    /** 在表达式和模式中统一改名 */
    private static final class Renamer extends ElixirTransformer {
        private final Map<String, String> renames;

        Renamer(Map<String, String> renames) {
            this.renames = renames;
        }

        @Override
        protected ElixirNode rewriteNode(ElixirNode node) {
            if (node instanceof EVar) {
                String target = renames.get(((EVar) node).getName());
                if (target != null) return ((EVar) node).renamed(target);
            }
            return node;
        }

        @Override
        protected ElixirPattern transformPattern(ElixirPattern pattern) {
            return PatternTransformer.rewrite(pattern, p -> {
                if (p instanceof PVar) {
                    String target = renames.get(((PVar) p).getName());
                    if (target != null) return ((PVar) p).renamed(target);
                }
                if (p instanceof PPin) {
                    String target = renames.get(((PPin) p).getName());
                    if (target != null) return ((PPin) p).renamed(target);
                }
                return p;
            });
        }
    }
}
