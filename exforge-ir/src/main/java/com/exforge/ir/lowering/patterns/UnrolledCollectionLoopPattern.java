package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TArrayAccess;
import com.exforge.compiler.ast.expr.TArrayDecl;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TCall;
import com.exforge.compiler.ast.expr.TConst;
import com.exforge.compiler.ast.expr.TField;
import com.exforge.compiler.ast.expr.TIf;
import com.exforge.compiler.ast.expr.TUnop;
import com.exforge.compiler.ast.expr.TUnop.TUnaryOp;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.ast.expr.TWhile;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.expr.EAlias;
import com.exforge.ir.ast.expr.EFn;
import com.exforge.ir.ast.expr.EFnClause;
import com.exforge.ir.ast.expr.EFor;
import com.exforge.ir.ast.expr.EForGenerator;
import com.exforge.ir.ast.expr.ERemoteCall;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedReferences;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 前端展开的 map / filter 下标循环：
 * <pre>
 * var res = [];
 * var i = 0;
 * var src = xs;          // 可省略
 * while (i &lt; src.length) {
 *   var v = src[i];
 *   i++;
 *   res.push(f(v));      // 或 if (cond) res.push(...)
 * }
 * res;
 * </pre>
 * 改写为 {@code Enum.map}、{@code Enum.filter}，同时过滤和映射时改写为 for 推导式。
 */
public class UnrolledCollectionLoopPattern implements TypedPattern<UnrolledCollectionLoopPattern.Fields> {

    public static final String NAME = "unrolled-collection-loop";

    public enum Kind {
        MAP,
        FILTER,
        FILTER_MAP
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<Fields> extract(TypedExpr expr) {
        if (!(expr instanceof TBlock)) return Optional.empty();
        List<TypedExpr> exprs = ((TBlock) expr).getExprs();
        if (exprs.size() != 4 && exprs.size() != 5) return Optional.empty();

        TVar result = declared(exprs.get(0));
        if (result == null || !isEmptyArray(result.getInit())) return Optional.empty();
        TVar counter = declared(exprs.get(1));
        if (counter == null || !isZero(counter.getInit())) return Optional.empty();
        TVar sourceBinding = null;
        if (exprs.size() == 5) {
            sourceBinding = declared(exprs.get(2));
            if (sourceBinding == null) return Optional.empty();
        }
        if (!TypedShapes.isLocal(exprs.get(exprs.size() - 1), result.getVariable())) return Optional.empty();
        if (!(exprs.get(exprs.size() - 2) instanceof TWhile)) return Optional.empty();
        TWhile loop = (TWhile) exprs.get(exprs.size() - 2);
        if (!loop.isNormalWhile()) return Optional.empty();

        TypedExpr bounded = boundedSource(loop.getCondition(), counter.getVariable());
        TVariable sourceVar = bounded != null ? TypedShapes.localOf(bounded) : null;
        if (sourceVar == null || sourceVar.getId() == result.getVariable().getId()
                || sourceVar.getId() == counter.getVariable().getId()) {
            return Optional.empty();
        }
        TypedExpr source = bounded;
        if (sourceBinding != null) {
            if (sourceVar.getId() != sourceBinding.getVariable().getId()) return Optional.empty();
            source = sourceBinding.getInit();
        }

        if (!(loop.getBody() instanceof TBlock) || ((TBlock) loop.getBody()).size() != 3) return Optional.empty();
        List<TypedExpr> body = ((TBlock) loop.getBody()).getExprs();
        TVar element = declared(body.get(0));
        if (element == null || !isIndexedRead(element.getInit(), sourceVar, counter.getVariable())) {
            return Optional.empty();
        }
        if (!isIncrement(body.get(1), counter.getVariable())) return Optional.empty();

        TypedExpr push = TypedShapes.unparen(body.get(2));
        Kind kind;
        TypedExpr condition = null;
        TypedExpr mapped;
        TypedExpr pushed = pushedValue(push, result.getVariable());
        if (pushed != null) {
            kind = Kind.MAP;
            mapped = pushed;
        } else {
            if (!(push instanceof TIf)) return Optional.empty();
            TIf guard = (TIf) push;
            if (guard.getElseExpr() != null && !TypedShapes.isNull(guard.getElseExpr())) return Optional.empty();
            pushed = pushedValue(TypedShapes.unparen(guard.getThenExpr()), result.getVariable());
            if (pushed == null) return Optional.empty();
            condition = guard.getCondition();
            if (TypedShapes.isLocal(pushed, element.getVariable())) {
                kind = Kind.FILTER;
                mapped = null;
            } else {
                kind = Kind.FILTER_MAP;
                mapped = pushed;
            }
        }

        // 回调体不能读结果列表、下标或被丢弃的源绑定
        for (TypedExpr part : Arrays.asList(condition, mapped)) {
            if (part == null) continue;
            if (TypedReferences.references(part, result.getVariable())
                    || TypedReferences.references(part, counter.getVariable())
                    || sourceBinding != null && TypedReferences.references(part, sourceVar)) {
                return Optional.empty();
            }
        }
        return Optional.of(new Fields(expr.getLocation(), kind, source, element.getVariable(), condition, mapped));
    }

    private static TVar declared(TypedExpr expr) {
        if (!(expr instanceof TVar) || ((TVar) expr).getInit() == null) return null;
        return (TVar) expr;
    }

    private static boolean isEmptyArray(TypedExpr expr) {
        TypedExpr e = TypedShapes.unparen(expr);
        return e instanceof TArrayDecl && ((TArrayDecl) e).getElements().isEmpty();
    }

    private static boolean isZero(TypedExpr expr) {
        TypedExpr e = TypedShapes.unparen(expr);
        if (!(e instanceof TConst) || ((TConst) e).getKind() != TConst.ConstKind.INT) return false;
        Object value = ((TConst) e).getValue();
        return value instanceof Number && ((Number) value).longValue() == 0L;
    }

    /** {@code i < src.length} 中的 src */
    private static TypedExpr boundedSource(TypedExpr condition, TVariable counter) {
        TypedExpr e = TypedShapes.unparen(condition);
        if (!(e instanceof TBinop) || ((TBinop) e).getOperator() != TBinaryOp.LT) return null;
        TBinop test = (TBinop) e;
        if (!TypedShapes.isLocal(test.getLeft(), counter)) return null;
        TypedExpr bound = TypedShapes.unparen(test.getRight());
        if (!(bound instanceof TField) || !"length".equals(((TField) bound).getName())) return null;
        return ((TField) bound).getTarget();
    }

    private static boolean isIndexedRead(TypedExpr expr, TVariable source, TVariable counter) {
        TypedExpr e = TypedShapes.unparen(expr);
        if (!(e instanceof TArrayAccess)) return false;
        TArrayAccess access = (TArrayAccess) e;
        return TypedShapes.isLocal(access.getTarget(), source) && TypedShapes.isLocal(access.getIndex(), counter);
    }

    private static boolean isIncrement(TypedExpr expr, TVariable counter) {
        TypedExpr e = TypedShapes.unparen(expr);
        if (!(e instanceof TUnop)) return false;
        TUnop step = (TUnop) e;
        return step.getOperator() == TUnaryOp.INCREMENT && TypedShapes.isLocal(step.getOperand(), counter);
    }

    /** {@code res.push(x)} 中的 x */
    private static TypedExpr pushedValue(TypedExpr expr, TVariable result) {
        TCall call = TypedShapes.methodCall(expr, "push", 1);
        if (call == null || !TypedShapes.isLocal(call.getReceiver(), result)) return null;
        return call.getArgs().get(0);
    }

    @Override
    public ElixirNode transform(Fields fields, PatternContext context) {
        SourceLocation loc = fields.getLocation();
        ElixirNode source = context.buildExpr(fields.getSource());
        switch (fields.getKind()) {
            case MAP:
                return enumCall(loc, "map", source, lambda(loc, fields, context.buildExpr(fields.getMapped()), context));
            case FILTER:
                return enumCall(loc, "filter", source,
                        lambda(loc, fields, context.buildExpr(fields.getCondition()), context));
            case FILTER_MAP:
                EForGenerator generator = new EForGenerator(context.bindVar(loc, fields.getElement()), source);
                return new EFor(loc, Collections.singletonList(generator),
                        Collections.singletonList(context.buildExpr(fields.getCondition())),
                        null, context.buildExpr(fields.getMapped()));
            default:
                throw new IllegalStateException("unknown loop kind: " + fields.getKind());
        }
    }

    private static EFn lambda(SourceLocation loc, Fields fields, ElixirNode body, PatternContext context) {
        EFnClause clause = new EFnClause(Collections.singletonList(context.bindVar(loc, fields.getElement())),
                null, body);
        return new EFn(loc, Collections.singletonList(clause));
    }

    private static ERemoteCall enumCall(SourceLocation loc, String function, ElixirNode source, ElixirNode fn) {
        return new ERemoteCall(loc, new EAlias(loc, "Enum"), function, Arrays.asList(source, fn));
    }

    public static final class Fields {
        private final SourceLocation location;
        private final Kind kind;
        private final TypedExpr source;
        private final TVariable element;
        private final TypedExpr condition;
        private final TypedExpr mapped;

        Fields(SourceLocation location, Kind kind, TypedExpr source, TVariable element,
               TypedExpr condition, TypedExpr mapped) {
            this.location = location;
            this.kind = kind;
            this.source = source;
            this.element = element;
            this.condition = condition;
            this.mapped = mapped;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public Kind getKind() {
            return kind;
        }

        public TypedExpr getSource() {
            return source;
        }

        public TVariable getElement() {
            return element;
        }

        /** MAP 时为 null */
        public TypedExpr getCondition() {
            return condition;
        }

        /** FILTER 时为 null */
        public TypedExpr getMapped() {
            return mapped;
        }
    }
}
