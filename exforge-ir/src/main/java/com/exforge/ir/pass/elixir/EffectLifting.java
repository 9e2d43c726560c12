package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 从字面量中提升副作用。
 * <p>
 * list/tuple/map/struct/keyword 字面量的某个槽位是赋值或多语句块时，把它的语句提到字面量之前，
 * 槽位只保留最终值。结果是带 {@link Metadata#LIFTED} 标记的块（前置语句 + 新字面量）：
 * <ul>
 *   <li>在立即求值的父表达式（调用参数、运算数、匹配右侧、外层字面量等）中继续向上冒泡；
 *       短路运算（and/&&/or/||）的右操作数除外，提升块在那里就地变成普通块；</li>
 *   <li>作为块语句时展开进所在块；</li>
 *   <li>到达函数体、分支体等位置时就地变成普通块。</li>
 * </ul>
 * 被提升槽位之前的有副作用的兄弟表达式，以及读取了被提升语句所绑定名字的兄弟表达式，
 * 先绑定到新的临时变量，保持原有求值顺序。带 {@link Metadata#KEEP_INLINE} 的槽位不提升。
 */
public class EffectLifting implements ElixirPass {

    public static final String NAME = "effect-lifting";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        ElixirNode lifted = new Lifter(context).transform(root);
        return ElixirTransformer.rewrite(lifted, EffectLifting::settle);
    }

    /** 残留的提升标记变回普通块 */
    private static ElixirNode settle(ElixirNode node) {
        if (!isLifted(node)) return node;
        EBlock block = (EBlock) node;
        return new EBlock(block.getLocation(), block.getStatements())
                .withMetadata(block.getMetadata().without(Metadata.LIFTED));
    }

    static boolean isLifted(ElixirNode node) {
        return node instanceof EBlock && node.hasFlag(Metadata.LIFTED);
    }

    private static boolean isShortCircuit(ElixirNode node) {
        if (!(node instanceof EBinary)) return false;
        BinaryOp op = ((EBinary) node).getOperator();
        return op == BinaryOp.AND || op == BinaryOp.BOOL_AND || op == BinaryOp.OR || op == BinaryOp.BOOL_OR;
    }

    private static final class Lifter extends ElixirTransformer {
        private final PassContext context;

        Lifter(PassContext context) {
            this.context = context;
        }

        @Override
        protected ElixirNode rewriteNode(ElixirNode node) {
            if (node instanceof EBlock) {
                return splice((EBlock) node);
            }
            boolean literal = node instanceof EList || node instanceof ETuple || node instanceof EMap
                    || node instanceof EStruct || node instanceof EKeywordList;
            boolean eager = literal || node instanceof ECall || node instanceof ERemoteCall
                    || node instanceof EApply || node instanceof EBinary || node instanceof EUnary
                    || node instanceof EParen || node instanceof EField || node instanceof EAccess
                    || node instanceof EMatch;
            if (!eager) return node;
            return liftSlots(settleConditionalOperand(node), literal);
        }

        /** 短路运算的右操作数按条件求值，其中的提升块就地落定，不越过运算符 */
        private ElixirNode settleConditionalOperand(ElixirNode node) {
            if (!isShortCircuit(node) || !isLifted(((EBinary) node).getRight())) return node;
            EBinary binary = (EBinary) node;
            return rebuilt(binary, new EBinary(binary.getLocation(), binary.getOperator(),
                    binary.getLeft(), settle(binary.getRight())));
        }

        /** 块语句中的提升块展开进当前块 */
        private ElixirNode splice(EBlock block) {
            boolean any = false;
            for (ElixirNode stmt : block.getStatements()) {
                if (isLifted(stmt)) {
                    any = true;
                    break;
                }
            }
            if (!any) return block;
            List<ElixirNode> flat = new ArrayList<>();
            for (ElixirNode stmt : block.getStatements()) {
                if (isLifted(stmt)) {
                    flat.addAll(((EBlock) stmt).getStatements());
                } else {
                    flat.add(stmt);
                }
            }
            return rebuilt(block, new EBlock(block.getLocation(), flat));
        }

        private boolean needsLift(ElixirNode slot, boolean literal) {
            if (slot == null || slot.hasFlag(Metadata.KEEP_INLINE)) return false;
            if (isLifted(slot)) return true;
            if (!literal) return false;
            return slot instanceof EMatch || slot instanceof EAssign
                    || (slot instanceof EBlock && !((EBlock) slot).isEmpty());
        }

        private ElixirNode liftSlots(ElixirNode node, boolean literal) {
            List<ElixirNode> slots = slotsOf(node);
            boolean any = false;
            for (ElixirNode slot : slots) {
                if (needsLift(slot, literal)) {
                    any = true;
                    break;
                }
            }
            if (!any) return node;

            List<ElixirNode> prefix = new ArrayList<>();
            List<ElixirNode> values = new ArrayList<>(slots.size());
            for (ElixirNode slot : slots) {
                if (!needsLift(slot, literal)) {
                    values.add(slot);
                    continue;
                }
                List<ElixirNode> stmts = new ArrayList<>();
                ElixirNode value = split(slot, stmts);
                Set<String> bound = boundBy(stmts);
                // 之前的兄弟先求值
                for (int i = 0; i < values.size(); i++) {
                    ElixirNode earlier = values.get(i);
                    if (earlier == null || VarUsage.isPure(earlier) && !readsAny(earlier, bound)) continue;
                    String temp = context.freshName("lifted");
                    prefix.add(Nodes.bind(temp, earlier));
                    values.set(i, new EVar(earlier.getLocation(), temp));
                }
                prefix.addAll(stmts);
                values.add(value);
            }

            ElixirNode rebuiltNode = rebuild(node, values);
            prefix.add(rebuiltNode);
            return new EBlock(node.getLocation(), prefix)
                    .withMetadata(Metadata.of(Metadata.LIFTED, Boolean.TRUE));
        }

        /**
         * 拆出槽位的前置语句，返回槽位的最终值
         */
        private ElixirNode split(ElixirNode slot, List<ElixirNode> stmts) {
            if (slot instanceof EBlock) {
                List<ElixirNode> inner = ((EBlock) slot).getStatements();
                if (inner.isEmpty()) return new ENil(slot.getLocation());
                stmts.addAll(inner.subList(0, inner.size() - 1));
                ElixirNode last = inner.get(inner.size() - 1);
                if (last instanceof EMatch || last instanceof EAssign || isLifted(last)) {
                    return split(last, stmts);
                }
                return last;
            }
            if (slot instanceof EMatch && ((EMatch) slot).getPattern() instanceof PVar) {
                PVar var = (PVar) ((EMatch) slot).getPattern();
                stmts.add(slot);
                return new EVar(slot.getLocation(), var.getName(), var.getSourceId());
            }
            if (slot instanceof EAssign && ((EAssign) slot).getTarget() instanceof EVar) {
                stmts.add(slot);
                return ((EAssign) slot).getTarget();
            }
            // 复杂模式或左值：整个表达式的值绑定到临时变量
            String temp = context.freshName("lifted");
            stmts.add(Nodes.bind(temp, slot));
            return new EVar(slot.getLocation(), temp);
        }

        private static Set<String> boundBy(List<ElixirNode> stmts) {
            Set<String> names = new LinkedHashSet<>();
            for (ElixirNode stmt : stmts) names.addAll(VarUsage.boundNamesIn(stmt));
            return names;
        }

        private static boolean readsAny(ElixirNode node, Set<String> names) {
            if (names.isEmpty()) return false;
            for (String read : VarUsage.readNames(node)) {
                if (names.contains(read)) return true;
            }
            return false;
        }
    }

    // ==================== 槽位 ====================

    /** 按求值顺序列出可提升的槽位，可能含 null（缺省的可选子节点） */
    static List<ElixirNode> slotsOf(ElixirNode node) {
        List<ElixirNode> slots = new ArrayList<>();
        if (node instanceof EList) {
            slots.addAll(((EList) node).getElements());
        } else if (node instanceof ETuple) {
            slots.addAll(((ETuple) node).getElements());
        } else if (node instanceof EMap) {
            EMap map = (EMap) node;
            slots.add(map.getBase());
            for (EMapEntry entry : map.getEntries()) {
                slots.add(entry.getKey());
                slots.add(entry.getValue());
            }
        } else if (node instanceof EStruct) {
            EStruct struct = (EStruct) node;
            slots.add(struct.getBase());
            for (EKeywordPair pair : struct.getFields()) slots.add(pair.getValue());
        } else if (node instanceof EKeywordList) {
            for (EKeywordPair pair : ((EKeywordList) node).getPairs()) slots.add(pair.getValue());
        } else if (node instanceof ECall) {
            slots.addAll(((ECall) node).getArgs());
        } else if (node instanceof ERemoteCall) {
            slots.addAll(((ERemoteCall) node).getArgs());
        } else if (node instanceof EApply) {
            slots.addAll(((EApply) node).getArgs());
        } else if (node instanceof EBinary) {
            slots.add(((EBinary) node).getLeft());
            slots.add(((EBinary) node).getRight());
        } else if (node instanceof EUnary) {
            slots.add(((EUnary) node).getOperand());
        } else if (node instanceof EParen) {
            slots.add(((EParen) node).getExpr());
        } else if (node instanceof EField) {
            slots.add(((EField) node).getTarget());
        } else if (node instanceof EAccess) {
            slots.add(((EAccess) node).getTarget());
            slots.add(((EAccess) node).getKey());
        } else if (node instanceof EMatch) {
            slots.add(((EMatch) node).getValue());
        }
        return slots;
    }

    /** 用新的槽位值重建节点，顺序与 {@link #slotsOf} 一致 */
    static ElixirNode rebuild(ElixirNode node, List<ElixirNode> values) {
        SourceLocation loc = node.getLocation();
        ElixirNode result;
        if (node instanceof EList) {
            result = new EList(loc, values);
        } else if (node instanceof ETuple) {
            result = new ETuple(loc, values);
        } else if (node instanceof EMap) {
            List<EMapEntry> entries = new ArrayList<>();
            for (int i = 1; i < values.size(); i += 2) {
                entries.add(new EMapEntry(values.get(i), values.get(i + 1)));
            }
            result = new EMap(loc, values.get(0), entries);
        } else if (node instanceof EStruct) {
            EStruct struct = (EStruct) node;
            List<EKeywordPair> fields = new ArrayList<>();
            for (int i = 0; i < struct.getFields().size(); i++) {
                fields.add(new EKeywordPair(struct.getFields().get(i).getKey(), values.get(i + 1)));
            }
            result = new EStruct(loc, struct.getModule(), values.get(0), fields);
        } else if (node instanceof EKeywordList) {
            EKeywordList kw = (EKeywordList) node;
            List<EKeywordPair> pairs = new ArrayList<>();
            for (int i = 0; i < kw.getPairs().size(); i++) {
                pairs.add(new EKeywordPair(kw.getPairs().get(i).getKey(), values.get(i)));
            }
            result = new EKeywordList(loc, pairs);
        } else if (node instanceof ECall) {
            result = new ECall(loc, ((ECall) node).getName(), values);
        } else if (node instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) node;
            result = new ERemoteCall(loc, call.getModule(), call.getFunction(), values);
        } else if (node instanceof EApply) {
            result = new EApply(loc, ((EApply) node).getFunction(), values);
        } else if (node instanceof EBinary) {
            result = new EBinary(loc, ((EBinary) node).getOperator(), values.get(0), values.get(1));
        } else if (node instanceof EUnary) {
            result = new EUnary(loc, ((EUnary) node).getOperator(), values.get(0));
        } else if (node instanceof EParen) {
            result = new EParen(loc, values.get(0));
        } else if (node instanceof EField) {
            result = new EField(loc, values.get(0), ((EField) node).getField());
        } else if (node instanceof EAccess) {
            result = new EAccess(loc, values.get(0), values.get(1));
        } else if (node instanceof EMatch) {
            result = new EMatch(loc, ((EMatch) node).getPattern(), values.get(0));
        } else {
            return node;
        }
        return result.withMetadataFrom(node);
    }
}
