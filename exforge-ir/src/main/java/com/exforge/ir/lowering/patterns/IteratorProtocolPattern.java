package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TCall;
import com.exforge.compiler.ast.expr.TField;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.ast.expr.TWhile;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.expr.EAlias;
import com.exforge.ir.ast.expr.EFor;
import com.exforge.ir.ast.expr.EForGenerator;
import com.exforge.ir.ast.expr.ENil;
import com.exforge.ir.ast.expr.ERemoteCall;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PTuple;
import com.exforge.ir.ast.pattern.PWildcard;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedReferences;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 迭代器协议循环：
 * <pre>
 * var it = m.keyValueIterator();
 * while (it.hasNext()) {
 *   var e = it.next();
 *   var k = e.key;
 *   var v = e.value;
 *   ...
 * }
 * </pre>
 * 改写为 {@code for {k, v} <- m do ... end}。{@code keys()} 和 {@code iterator()} 分别对应键和值的遍历。
 */
public class IteratorProtocolPattern implements TypedPattern<IteratorProtocolPattern.Fields> {

    public static final String NAME = "iterator-protocol";

    public enum Kind {
        KEY_VALUE,
        KEYS,
        VALUES
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<Fields> extract(TypedExpr expr) {
        if (!(expr instanceof TBlock) || ((TBlock) expr).size() != 2) return Optional.empty();
        TBlock block = (TBlock) expr;
        if (!(block.get(0) instanceof TVar) || !(block.get(1) instanceof TWhile)) return Optional.empty();
        TVar iteratorBinding = (TVar) block.get(0);
        TVariable iterator = iteratorBinding.getVariable();
        TCall source = iteratorSource(iteratorBinding.getInit());
        if (source == null) return Optional.empty();
        Kind kind = kindOf(source.getMethodName());

        TWhile loop = (TWhile) block.get(1);
        if (!loop.isNormalWhile() || !isIteratorCall(loop.getCondition(), iterator, "hasNext")) {
            return Optional.empty();
        }
        if (!(loop.getBody() instanceof TBlock) || ((TBlock) loop.getBody()).size() == 0) return Optional.empty();
        List<TypedExpr> body = ((TBlock) loop.getBody()).getExprs();
        if (!(body.get(0) instanceof TVar)) return Optional.empty();
        TVar current = (TVar) body.get(0);
        if (!isIteratorCall(current.getInit(), iterator, "next")) return Optional.empty();

        TVariable key = null;
        TVariable value = null;
        int restStart = 1;
        if (kind == Kind.KEY_VALUE) {
            while (restStart < body.size()) {
                String field = projectedField(body.get(restStart), current.getVariable());
                if ("key".equals(field) && key == null) {
                    key = ((TVar) body.get(restStart)).getVariable();
                } else if ("value".equals(field) && value == null) {
                    value = ((TVar) body.get(restStart)).getVariable();
                } else {
                    break;
                }
                restStart++;
            }
        } else if (kind == Kind.KEYS) {
            key = current.getVariable();
        } else {
            value = current.getVariable();
        }

        List<TypedExpr> rest = body.subList(restStart, body.size());
        if (TypedReferences.referencesAny(rest, iterator)) return Optional.empty();
        if (kind == Kind.KEY_VALUE && TypedReferences.referencesAny(rest, current.getVariable())) {
            return Optional.empty();
        }
        return Optional.of(new Fields(expr.getLocation(), kind, source.getReceiver(), key, value,
                new ArrayList<>(rest)));
    }

    private static TCall iteratorSource(TypedExpr init) {
        for (String method : Arrays.asList("keyValueIterator", "keys", "iterator")) {
            TCall call = TypedShapes.methodCall(init, method, 0);
            if (call != null && call.getReceiver() != null) return call;
        }
        return null;
    }

    private static Kind kindOf(String method) {
        if ("keyValueIterator".equals(method)) return Kind.KEY_VALUE;
        if ("keys".equals(method)) return Kind.KEYS;
        return Kind.VALUES;
    }

    private static boolean isIteratorCall(TypedExpr expr, TVariable iterator, String method) {
        TCall call = TypedShapes.methodCall(expr, method, 0);
        return call != null && TypedShapes.isLocal(call.getReceiver(), iterator);
    }

    /** {@code var x = e.key} 形式时返回字段名 */
    private static String projectedField(TypedExpr expr, TVariable entry) {
        if (!(expr instanceof TVar)) return null;
        TypedExpr init = TypedShapes.unparen(((TVar) expr).getInit());
        if (!(init instanceof TField) || !TypedShapes.isLocal(((TField) init).getTarget(), entry)) return null;
        return ((TField) init).getName();
    }

    @Override
    public ElixirNode transform(Fields fields, PatternContext context) {
        SourceLocation loc = fields.getLocation();
        ElixirNode collection = context.buildExpr(fields.getCollection());
        ElixirPattern binder;
        ElixirNode source;
        switch (fields.getKind()) {
            case KEY_VALUE:
                binder = new PTuple(loc, Arrays.asList(bindOrSkip(loc, fields.getKey(), context),
                        bindOrSkip(loc, fields.getValue(), context)));
                source = collection;
                break;
            case KEYS:
                binder = context.bindVar(loc, fields.getKey());
                source = mapCall(loc, "keys", collection);
                break;
            default:
                binder = context.bindVar(loc, fields.getValue());
                source = fields.getCollection().getType().isMap() ? mapCall(loc, "values", collection) : collection;
                break;
        }
        List<ElixirNode> statements = new ArrayList<>();
        for (TypedExpr stmt : fields.getBody()) statements.add(context.buildExpr(stmt));
        ElixirNode body = statements.isEmpty() ? new ENil(loc) : Nodes.bodyOf(loc, statements);
        return new EFor(loc, Collections.singletonList(new EForGenerator(binder, source)),
                Collections.<ElixirNode>emptyList(), null, body);
    }

    private static ElixirPattern bindOrSkip(SourceLocation loc, TVariable variable, PatternContext context) {
        return variable != null ? context.bindVar(loc, variable) : new PWildcard(loc);
    }

    private static ERemoteCall mapCall(SourceLocation loc, String function, ElixirNode collection) {
        return new ERemoteCall(loc, new EAlias(loc, "Map"), function, Collections.singletonList(collection));
    }

    public static final class Fields {
        private final SourceLocation location;
        private final Kind kind;
        private final TypedExpr collection;
        private final TVariable key;
        private final TVariable value;
        private final List<TypedExpr> body;

        Fields(SourceLocation location, Kind kind, TypedExpr collection, TVariable key, TVariable value,
               List<TypedExpr> body) {
            this.location = location;
            this.kind = kind;
            this.collection = collection;
            this.key = key;
            this.value = value;
            this.body = body;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public Kind getKind() {
            return kind;
        }

        public TypedExpr getCollection() {
            return collection;
        }

        /** 未绑定时为 null */
        public TVariable getKey() {
            return key;
        }

        /** 未绑定时为 null */
        public TVariable getValue() {
            return value;
        }

        public List<TypedExpr> getBody() {
            return body;
        }
    }
}
