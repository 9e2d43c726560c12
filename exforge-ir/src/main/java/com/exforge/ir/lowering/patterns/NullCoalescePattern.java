package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.expr.ENil;
import com.exforge.ir.ast.pattern.PLiteral;
import com.exforge.ir.lowering.PatternContext;

import java.util.Arrays;
import java.util.Optional;

/**
 * 空值合并：{@code { var t = a; t ?? b }} 改写为
 * {@code case a do nil -> b; t -> t end}，a 只求值一次。
 */
public class NullCoalescePattern implements TypedPattern<NullCoalescePattern.Fields> {

    public static final String NAME = "null-coalesce";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<Fields> extract(TypedExpr expr) {
        if (!(expr instanceof TBlock) || ((TBlock) expr).size() != 2) return Optional.empty();
        TBlock block = (TBlock) expr;
        if (!(block.get(0) instanceof TVar)) return Optional.empty();
        TVar binding = (TVar) block.get(0);
        if (binding.getInit() == null) return Optional.empty();
        TypedExpr test = TypedShapes.unparen(block.get(1));
        if (!(test instanceof TBinop) || ((TBinop) test).getOperator() != TBinaryOp.NULL_COALESCE) {
            return Optional.empty();
        }
        TBinop coalesce = (TBinop) test;
        if (!TypedShapes.isLocal(coalesce.getLeft(), binding.getVariable())) return Optional.empty();
        return Optional.of(new Fields(expr.getLocation(), binding.getVariable(), binding.getInit(),
                coalesce.getRight()));
    }

    @Override
    public ElixirNode transform(Fields fields, PatternContext context) {
        SourceLocation loc = fields.getLocation();
        return new ECase(loc, context.buildExpr(fields.getValue()), Arrays.asList(
                new ECaseClause(new PLiteral(loc, new ENil(loc)), context.buildExpr(fields.getFallback())),
                new ECaseClause(context.bindVar(loc, fields.getTemp()), context.readVar(loc, fields.getTemp()))));
    }

    public static final class Fields {
        private final SourceLocation location;
        private final TVariable temp;
        private final TypedExpr value;
        private final TypedExpr fallback;

        Fields(SourceLocation location, TVariable temp, TypedExpr value, TypedExpr fallback) {
            this.location = location;
            this.temp = temp;
            this.value = value;
            this.fallback = fallback;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public TVariable getTemp() {
            return temp;
        }

        public TypedExpr getValue() {
            return value;
        }

        public TypedExpr getFallback() {
            return fallback;
        }
    }
}
