package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TIf;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.expr.ENil;
import com.exforge.ir.ast.pattern.PLiteral;
import com.exforge.ir.lowering.PatternContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 内联的可空访问器：{@code { var t = a; t != null ? t.x : null }}。
 * <p>
 * 单个临时变量时改写为
 * <pre>
 * case a do
 *   nil -> nil
 *   t -> t.x
 * end
 * </pre>
 * 多个临时变量、结果是两个判空分支的二元运算时，只输出最后的子表达式，临时绑定被丢弃。
 * 这是已知的能力边界，会记录一条 FINE 日志。
 */
public class InlinedAccessorPattern implements TypedPattern<InlinedAccessorPattern.Fields> {

    private static final Logger LOG = Logger.getLogger(InlinedAccessorPattern.class.getName());

    public static final String NAME = "inlined-accessor";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<Fields> extract(TypedExpr expr) {
        if (!(expr instanceof TBlock)) return Optional.empty();
        List<TypedExpr> exprs = ((TBlock) expr).getExprs();
        if (exprs.size() == 2) return single(expr.getLocation(), exprs);
        if (exprs.size() >= 3) return multiTemp(expr.getLocation(), exprs);
        return Optional.empty();
    }

    private static Optional<Fields> single(SourceLocation location, List<TypedExpr> exprs) {
        TVar binding = tempBinding(exprs.get(0));
        if (binding == null || !(exprs.get(1) instanceof TIf)) return Optional.empty();
        TIf branch = (TIf) exprs.get(1);
        TypedShapes.NullTest test = TypedShapes.nullTest(branch.getCondition());
        if (test == null || test.variable.getId() != binding.getVariable().getId()) return Optional.empty();
        TypedExpr present = test.notNull ? branch.getThenExpr() : branch.getElseExpr();
        TypedExpr absent = test.notNull ? branch.getElseExpr() : branch.getThenExpr();
        if (present == null) return Optional.empty();
        return Optional.of(Fields.single(location, binding.getVariable(), binding.getInit(), present, absent));
    }

    private static Optional<Fields> multiTemp(SourceLocation location, List<TypedExpr> exprs) {
        Set<Integer> temps = new HashSet<>();
        for (int i = 0; i < exprs.size() - 1; i++) {
            TVar binding = tempBinding(exprs.get(i));
            if (binding == null) return Optional.empty();
            temps.add(binding.getVariable().getId());
        }
        TypedExpr last = TypedShapes.unparen(exprs.get(exprs.size() - 1));
        if (!(last instanceof TBinop) || ((TBinop) last).getOperator().isAssignment()) return Optional.empty();
        TBinop combined = (TBinop) last;
        Integer left = guardedTemp(combined.getLeft(), temps);
        Integer right = guardedTemp(combined.getRight(), temps);
        if (left == null || right == null || left.equals(right)) return Optional.empty();
        return Optional.of(Fields.multiTemp(location, exprs.size() - 1, exprs.get(exprs.size() - 1)));
    }

    private static TVar tempBinding(TypedExpr expr) {
        if (!(expr instanceof TVar) || ((TVar) expr).getInit() == null) return null;
        return (TVar) expr;
    }

    /** 判空分支测试的临时变量 id */
    private static Integer guardedTemp(TypedExpr expr, Set<Integer> temps) {
        TypedExpr e = TypedShapes.unparen(expr);
        if (!(e instanceof TIf)) return null;
        TypedShapes.NullTest test = TypedShapes.nullTest(((TIf) e).getCondition());
        if (test == null || !temps.contains(test.variable.getId())) return null;
        return test.variable.getId();
    }

    @Override
    public ElixirNode transform(Fields fields, PatternContext context) {
        if (fields.isMultiTemp()) {
            LOG.fine(() -> "inlined accessor with " + fields.getTempCount()
                    + " temporaries at " + fields.getLocation() + ", emitting last sub-expression only");
            return context.buildExpr(fields.getResult());
        }
        SourceLocation loc = fields.getLocation();
        ElixirNode absent = fields.getAbsentBranch() != null
                ? context.buildExpr(fields.getAbsentBranch())
                : new ENil(loc);
        ElixirNode present = context.buildExpr(fields.getPresentBranch());
        List<ECaseClause> clauses = new ArrayList<>(Arrays.asList(
                new ECaseClause(new PLiteral(loc, new ENil(loc)), absent),
                new ECaseClause(context.bindVar(loc, fields.getTemp()), present)));
        return new ECase(loc, context.buildExpr(fields.getInit()), clauses);
    }

    /**
     * 提取结果。单临时变量时 temp/init/presentBranch 有值；多临时变量时只有 result。
     */
    public static final class Fields {
        private final SourceLocation location;
        private final TVariable temp;
        private final TypedExpr init;
        private final TypedExpr presentBranch;
        private final TypedExpr absentBranch;
        private final int tempCount;
        private final TypedExpr result;

        private Fields(SourceLocation location, TVariable temp, TypedExpr init, TypedExpr presentBranch,
                       TypedExpr absentBranch, int tempCount, TypedExpr result) {
            this.location = location;
            this.temp = temp;
            this.init = init;
            this.presentBranch = presentBranch;
            this.absentBranch = absentBranch;
            this.tempCount = tempCount;
            this.result = result;
        }

        static Fields single(SourceLocation location, TVariable temp, TypedExpr init,
                             TypedExpr presentBranch, TypedExpr absentBranch) {
            return new Fields(location, temp, init, presentBranch, absentBranch, 1, null);
        }

        static Fields multiTemp(SourceLocation location, int tempCount, TypedExpr result) {
            return new Fields(location, null, null, null, null, tempCount, result);
        }

        public boolean isMultiTemp() {
            return result != null;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public TVariable getTemp() {
            return temp;
        }

        public TypedExpr getInit() {
            return init;
        }

        public TypedExpr getPresentBranch() {
            return presentBranch;
        }

        /** 可为 null，表示 nil */
        public TypedExpr getAbsentBranch() {
            return absentBranch;
        }

        public int getTempCount() {
            return tempCount;
        }

        public TypedExpr getResult() {
            return result;
        }
    }
}
