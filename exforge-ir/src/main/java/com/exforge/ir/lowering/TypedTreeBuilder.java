package com.exforge.ir.lowering;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.expr.*;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.compiler.naming.IdentifierNaming;
import com.exforge.ir.InternalCompilerError;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.ast.control.EWhileLoop;
import com.exforge.ir.ast.data.EList;
import com.exforge.ir.ast.data.EMap;
import com.exforge.ir.ast.data.EMapEntry;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.expr.ELiteral.LiteralKind;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PLiteral;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.ast.pattern.PWildcard;
import com.exforge.ir.lowering.patterns.PatternRegistry;
import com.exforge.ir.pass.FreshNameGenerator;
import com.exforge.ir.pass.elixir.MutableToImmutable;

import java.util.*;
import java.util.logging.Logger;

/**
 * 类型化树 → 中间 AST 构建。
 * <p>
 * 每个子树先交给 {@link PatternRegistry} 尝试惯用法模式，没有模式匹配时按节点类型逐一降级。
 * 输出保留命令式形状（{@link EAssign}、自增 {@link EUnary}、{@link EWhileLoop}、
 * {@code case elem(x, 0)}），由 pass 流水线继续改写。
 */
public class TypedTreeBuilder implements TypedVisitor<ElixirNode, Void> {

    private static final Logger LOG = Logger.getLogger(TypedTreeBuilder.class.getName());

    static final String STAGE = "typed-tree-builder";

    private final IdentifierNaming naming;
    private final FreshNameGenerator names;
    private final PatternRegistry patterns;
    private final PatternContext patternContext;

    public TypedTreeBuilder(IdentifierNaming naming, FreshNameGenerator names, PatternRegistry patterns) {
        this.naming = naming;
        this.names = names;
        this.patterns = patterns;
        this.patternContext = new PatternContext(this::build, naming);
    }

    public TypedTreeBuilder() {
        this(new ElixirNaming(), new FreshNameGenerator(), PatternRegistry.createDefault());
    }

    // ========== 公共入口 ==========

    /**
     * 构建一个子树。null 输入返回 null（可选子节点）。
     */
    public ElixirNode build(TypedExpr expr) {
        if (expr == null) return null;
        Optional<ElixirNode> lowered = patterns.tryApply(expr, patternContext);
        if (lowered.isPresent()) return lowered.get();
        return expr.accept(this, null);
    }

    // ========== 辅助方法 ==========

    private ElixirNode buildOrNil(TypedExpr expr, SourceLocation location) {
        ElixirNode built = build(expr);
        return built != null ? built : new ENil(location);
    }

    private List<ElixirNode> buildAll(List<? extends TypedExpr> exprs) {
        if (exprs == null || exprs.isEmpty()) return new ArrayList<>();
        List<ElixirNode> result = new ArrayList<>(exprs.size());
        for (TypedExpr e : exprs) result.add(build(e));
        return result;
    }

    private static List<TypedExpr> statementsOf(TypedExpr body) {
        if (body == null) return Collections.emptyList();
        if (body instanceof TBlock) return ((TBlock) body).getExprs();
        return Collections.singletonList(body);
    }

    private static TypedExpr unparen(TypedExpr expr) {
        TypedExpr current = expr;
        while (current instanceof TParenthesis) current = ((TParenthesis) current).getExpr();
        return current;
    }

    private static boolean isString(TypedExpr expr) {
        return TypeRef.STRING.equals(expr.getType());
    }

    private static boolean isThis(TypedExpr expr) {
        TypedExpr e = unparen(expr);
        return e instanceof TConst && ((TConst) e).getKind() == TConst.ConstKind.THIS;
    }

    private static ECall elem(SourceLocation loc, ElixirNode tuple, long index) {
        return new ECall(loc, "elem", Arrays.asList(tuple, new ELiteral(loc, LiteralKind.INTEGER, index)));
    }

    private static ERemoteCall remote(SourceLocation loc, String module, String function, ElixirNode... args) {
        return new ERemoteCall(loc, new EAlias(loc, module), function, new ArrayList<>(Arrays.asList(args)));
    }

    private static List<ElixirNode> prepend(ElixirNode first, List<ElixirNode> rest) {
        List<ElixirNode> result = new ArrayList<>(rest.size() + 1);
        result.add(first);
        result.addAll(rest);
        return result;
    }

    // ========== 声明 ==========

    @Override
    public ElixirNode visitClassDecl(TClassDecl node, Void ctx) {
        SourceLocation loc = node.getLocation();
        List<String> fields = node.getFieldNames() != null ? node.getFieldNames() : Collections.<String>emptyList();
        List<ElixirNode> body = new ArrayList<>();
        if (!node.isException() && !fields.isEmpty()) {
            List<ElixirNode> atoms = new ArrayList<>();
            for (String field : fields) atoms.add(new EAtom(loc, naming.toElixirName(field)));
            body.add(new ECall(loc, "defstruct", Collections.<ElixirNode>singletonList(new EList(loc, atoms))));
        }
        for (TClassDecl.TMethod method : node.getMethods()) {
            body.add(lowerMethod(method, loc));
        }
        EModule module = new EModule(loc, naming.toModuleName(node.getName()), body);
        if (!node.isException()) return module;

        Metadata metadata = module.metadataWith(Metadata.EXCEPTION_MODULE, true);
        if (!fields.isEmpty()) {
            List<String> exceptionFields = new ArrayList<>();
            for (String field : fields) exceptionFields.add(naming.toElixirName(field));
            metadata = metadata.with(Metadata.EXCEPTION_FIELDS, exceptionFields);
        }
        return module.withMetadata(metadata);
    }

    private EDef lowerMethod(TClassDecl.TMethod method, SourceLocation loc) {
        List<ElixirPattern> params = new ArrayList<>();
        if (!method.isStatic()) params.add(new PVar(loc, MutableToImmutable.INSTANCE_PARAM));
        for (TVariable arg : method.getArgs()) params.add(patternContext.bindVar(loc, arg));
        EDef.DefKind kind = method.isPublic() ? EDef.DefKind.DEF : EDef.DefKind.DEFP;
        return new EDef(loc, kind, naming.toElixirName(method.getName()), params, null,
                buildOrNil(method.getBody(), loc));
    }

    @Override
    public ElixirNode visitVar(TVar node, Void ctx) {
        SourceLocation loc = node.getLocation();
        return new EMatch(loc, patternContext.bindVar(loc, node.getVariable()), buildOrNil(node.getInit(), loc));
    }

    @Override
    public ElixirNode visitFunction(TFunction node, Void ctx) {
        SourceLocation loc = node.getLocation();
        List<ElixirPattern> params = new ArrayList<>();
        for (TVariable arg : node.getArgs()) params.add(patternContext.bindVar(loc, arg));
        EFnClause clause = new EFnClause(params, null, buildOrNil(node.getBody(), loc));
        return new EFn(loc, Collections.singletonList(clause));
    }

    // ========== 控制流 ==========

    @Override
    public ElixirNode visitBlock(TBlock node, Void ctx) {
        return new EBlock(node.getLocation(), buildAll(node.getExprs()));
    }

    @Override
    public ElixirNode visitIf(TIf node, Void ctx) {
        return new EIf(node.getLocation(), build(node.getCondition()), build(node.getThenExpr()),
                build(node.getElseExpr()));
    }

    @Override
    public ElixirNode visitWhile(TWhile node, Void ctx) {
        SourceLocation loc = node.getLocation();
        EWhileLoop loop = new EWhileLoop(loc, build(node.getCondition()), buildOrNil(node.getBody(), loc));
        if (node.isNormalWhile()) return loop;
        // do-while：先执行一次循环体
        return new EBlock(loc, Arrays.asList(buildOrNil(node.getBody(), loc), loop));
    }

    @Override
    public ElixirNode visitSwitch(TSwitch node, Void ctx) {
        TypedExpr subject = unparen(node.getSubject());
        if (subject instanceof TEnumIndex) {
            return enumSwitch(node, (TEnumIndex) subject);
        }
        return valueSwitch(node);
    }

    /**
     * 枚举 switch：{@code case elem(x, 0)}，每个构造器下标一个整数子句。
     */
    private ElixirNode enumSwitch(TSwitch node, TEnumIndex subject) {
        SourceLocation loc = node.getLocation();
        ElixirNode tag = elem(loc, build(subject.getTarget()), 0);
        Map<Long, Integer> arities = new LinkedHashMap<>();
        List<ECaseClause> clauses = new ArrayList<>();
        for (TSwitch.SwitchCase c : node.getCases()) {
            for (TypedExpr value : c.getValues()) {
                long index = enumIndexOf(value);
                ElixirNode body = enumCaseBody(c.getBody(), index, arities, loc);
                clauses.add(new ECaseClause(new PLiteral(loc, new ELiteral(loc, LiteralKind.INTEGER, index)), body));
            }
        }
        if (node.getDefaultBody() != null) {
            clauses.add(new ECaseClause(new PWildcard(loc), buildOrNil(node.getDefaultBody(), loc)));
        }
        ECase result = new ECase(loc, tag, clauses);
        if (arities.isEmpty()) return result;
        return result.withMetadata(result.metadataWith(Metadata.ENUM_ARITIES, arities));
    }

    private static long enumIndexOf(TypedExpr value) {
        TypedExpr e = unparen(value);
        if (e instanceof TConst && ((TConst) e).getKind() == TConst.ConstKind.INT) {
            return ((Number) ((TConst) e).getValue()).longValue();
        }
        throw new InternalCompilerError(STAGE, "enum switch case is not a constructor index", value);
    }

    /**
     * 枚举子句体。{@code var tmp = enumParameter; var user = tmp} 只保留对 tmp 的绑定，
     * 用户名通过 {@link Metadata#CLAUSE_LOCALS} 交给子句局部变量解析。
     */
    private ElixirNode enumCaseBody(TypedExpr body, long tag, Map<Long, Integer> arities, SourceLocation loc) {
        List<TypedExpr> exprs = statementsOf(body);
        List<ElixirNode> statements = new ArrayList<>();
        Map<Integer, String> clauseLocals = new LinkedHashMap<>();
        for (int i = 0; i < exprs.size(); i++) {
            TypedExpr e = exprs.get(i);
            TEnumParameter parameter = enumParameterInit(e);
            if (parameter == null) {
                statements.add(build(e));
                continue;
            }
            if (parameter.getArity() >= 0) {
                Integer known = arities.get(tag);
                int arity = parameter.getArity() + 1;
                arities.put(tag, known != null ? Math.max(known, arity) : arity);
            }
            TVariable temp = ((TVar) e).getVariable();
            statements.add(new EMatch(e.getLocation(), patternContext.bindVar(e.getLocation(), temp),
                    build(parameter)));
            if (i + 1 < exprs.size() && isAliasOf(exprs.get(i + 1), temp)) {
                TVariable user = ((TVar) exprs.get(i + 1)).getVariable();
                clauseLocals.put(temp.getId(), naming.toElixirName(user.getName()));
                clauseLocals.put(user.getId(), naming.toElixirName(user.getName()));
                i++;
            }
        }
        if (statements.isEmpty()) return new ENil(loc);
        if (clauseLocals.isEmpty()) {
            return statements.size() == 1 ? statements.get(0) : new EBlock(loc, statements);
        }
        EBlock block = new EBlock(loc, statements);
        return block.withMetadata(block.metadataWith(Metadata.CLAUSE_LOCALS, clauseLocals));
    }

    private static TEnumParameter enumParameterInit(TypedExpr expr) {
        if (!(expr instanceof TVar)) return null;
        TypedExpr init = unparen(((TVar) expr).getInit());
        return init instanceof TEnumParameter ? (TEnumParameter) init : null;
    }

    private static boolean isAliasOf(TypedExpr expr, TVariable temp) {
        if (!(expr instanceof TVar)) return false;
        TypedExpr init = unparen(((TVar) expr).getInit());
        return init instanceof TLocal && ((TLocal) init).refersTo(temp);
    }

    /**
     * 普通 switch：常量用字面量模式，非常量用新变量加相等守卫。
     */
    private ElixirNode valueSwitch(TSwitch node) {
        SourceLocation loc = node.getLocation();
        List<ECaseClause> clauses = new ArrayList<>();
        for (TSwitch.SwitchCase c : node.getCases()) {
            for (TypedExpr value : c.getValues()) {
                ElixirNode body = buildOrNil(c.getBody(), loc);
                TypedExpr v = unparen(value);
                if (v instanceof TConst && ((TConst) v).getKind() != TConst.ConstKind.THIS) {
                    clauses.add(new ECaseClause(new PLiteral(loc, build(v)), body));
                } else {
                    String fresh = names.fresh("value");
                    ElixirNode guard = new EBinary(loc, BinaryOp.EQ, new EVar(loc, fresh), build(value));
                    clauses.add(new ECaseClause(new PVar(loc, fresh), guard, body));
                }
            }
        }
        ElixirNode fallback = node.getDefaultBody() != null ? buildOrNil(node.getDefaultBody(), loc) : new ENil(loc);
        clauses.add(new ECaseClause(new PWildcard(loc), fallback));
        return new ECase(loc, build(node.getSubject()), clauses);
    }

    @Override
    public ElixirNode visitReturn(TReturn node, Void ctx) {
        return buildOrNil(node.getValue(), node.getLocation());
    }

    @Override
    public ElixirNode visitThrow(TThrow node, Void ctx) {
        return new ECall(node.getLocation(), "raise",
                Collections.singletonList(buildOrNil(node.getValue(), node.getLocation())));
    }

    // ========== 表达式 ==========

    @Override
    public ElixirNode visitConst(TConst node, Void ctx) {
        SourceLocation loc = node.getLocation();
        Object value = node.getValue();
        switch (node.getKind()) {
            case INT:
                return new ELiteral(loc, LiteralKind.INTEGER, ((Number) value).longValue());
            case FLOAT:
                return new ELiteral(loc, LiteralKind.FLOAT, ((Number) value).doubleValue());
            case STRING:
                return new ELiteral(loc, LiteralKind.STRING, String.valueOf(value));
            case BOOL:
                return new ELiteral(loc, LiteralKind.BOOLEAN, value);
            case NULL:
                return new ENil(loc);
            case THIS:
                return new EVar(loc, MutableToImmutable.INSTANCE_PARAM);
            default:
                throw new InternalCompilerError(STAGE, "unknown constant kind " + node.getKind(), node);
        }
    }

    @Override
    public ElixirNode visitLocal(TLocal node, Void ctx) {
        return patternContext.readVar(node.getLocation(), node.getVariable());
    }

    @Override
    public ElixirNode visitBinop(TBinop node, Void ctx) {
        SourceLocation loc = node.getLocation();
        TBinaryOp op = node.getOperator();
        switch (op) {
            case ASSIGN:
                return assign(node, null);
            case ASSIGN_OP:
                return assign(node, binaryOp(node.getAssignOperator(), node));
            case NULL_COALESCE:
                return nullCoalesce(node);
            case INTERVAL:
                ElixirNode last = new EBinary(loc, BinaryOp.SUB, build(node.getRight()),
                        new ELiteral(loc, LiteralKind.INTEGER, 1L));
                return new ERange(loc, build(node.getLeft()), last, new ELiteral(loc, LiteralKind.INTEGER, 1L));
            case ADD:
                if (isString(node) || isString(node.getLeft()) || isString(node.getRight())) {
                    return new EBinary(loc, BinaryOp.STRING_CONCAT, stringOperand(node.getLeft()),
                            stringOperand(node.getRight()));
                }
                return new EBinary(loc, BinaryOp.ADD, build(node.getLeft()), build(node.getRight()));
            default:
                return new EBinary(loc, binaryOp(op, node), build(node.getLeft()), build(node.getRight()));
        }
    }

    private ElixirNode stringOperand(TypedExpr operand) {
        ElixirNode built = build(operand);
        if (isString(operand)) return built;
        return new ECall(operand.getLocation(), "to_string", Collections.singletonList(built));
    }

    private static BinaryOp binaryOp(TBinaryOp op, TypedExpr node) {
        if (op == null) throw new InternalCompilerError(STAGE, "compound assignment without operator", node);
        switch (op) {
            case ADD: return BinaryOp.ADD;
            case SUB: return BinaryOp.SUB;
            case MUL: return BinaryOp.MUL;
            case DIV: return BinaryOp.DIV;
            case MOD: return BinaryOp.REM;
            case EQ: return BinaryOp.EQ;
            case NEQ: return BinaryOp.NEQ;
            case LT: return BinaryOp.LT;
            case LTE: return BinaryOp.LE;
            case GT: return BinaryOp.GT;
            case GTE: return BinaryOp.GE;
            case BOOL_AND: return BinaryOp.BOOL_AND;
            case BOOL_OR: return BinaryOp.BOOL_OR;
            case AND: return BinaryOp.BAND;
            case OR: return BinaryOp.BOR;
            case XOR: return BinaryOp.BXOR;
            case SHL: return BinaryOp.BSL;
            case SHR:
            case USHR:
                return BinaryOp.BSR;
            default:
                throw new InternalCompilerError(STAGE, "operator " + op + " has no binary form", node);
        }
    }

    /**
     * 赋值：局部变量直接绑定，字段和下标写入保留为 {@link EAssign}。
     */
    private ElixirNode assign(TBinop node, BinaryOp operator) {
        SourceLocation loc = node.getLocation();
        TypedExpr target = unparen(node.getLeft());
        ElixirNode value = build(node.getRight());
        if (target instanceof TLocal) {
            TVariable variable = ((TLocal) target).getVariable();
            if (operator == null) return new EMatch(loc, patternContext.bindVar(loc, variable), value);
            return new EAssign(loc, patternContext.readVar(loc, variable), operator, value);
        }
        if (target instanceof TField) {
            TField field = (TField) target;
            return new EAssign(loc, new EField(loc, build(field.getTarget()), naming.toElixirName(field.getName())),
                    operator, value);
        }
        if (target instanceof TArrayAccess) {
            return new EAssign(loc, indexTarget((TArrayAccess) target), operator, value);
        }
        throw new InternalCompilerError(STAGE, "unsupported assignment target", target);
    }

    /** 下标写入的左值，map 目标带 {@link Metadata#MAP_ACCESS} */
    private EAccess indexTarget(TArrayAccess access) {
        EAccess lvalue = new EAccess(access.getLocation(), build(access.getTarget()), build(access.getIndex()));
        if (access.getTarget().getType().isMap()) {
            lvalue.withMetadata(lvalue.metadataWith(Metadata.MAP_ACCESS, true));
        }
        return lvalue;
    }

    private ElixirNode nullCoalesce(TBinop node) {
        SourceLocation loc = node.getLocation();
        TypedExpr left = unparen(node.getLeft());
        if (left instanceof TLocal) {
            ElixirNode var = build(left);
            return new EIf(loc, new EBinary(loc, BinaryOp.NEQ, var, new ENil(loc)), build(left),
                    build(node.getRight()));
        }
        String temp = names.fresh("value");
        return new ECase(loc, build(node.getLeft()), Arrays.asList(
                new ECaseClause(new PLiteral(loc, new ENil(loc)), build(node.getRight())),
                new ECaseClause(new PVar(loc, temp), new EVar(loc, temp))));
    }

    @Override
    public ElixirNode visitUnop(TUnop node, Void ctx) {
        SourceLocation loc = node.getLocation();
        TypedExpr raw = unparen(node.getOperand());
        boolean mutating = node.getOperator() == TUnop.TUnaryOp.INCREMENT
                || node.getOperator() == TUnop.TUnaryOp.DECREMENT;
        ElixirNode operand = mutating && raw instanceof TArrayAccess
                ? indexTarget((TArrayAccess) raw)
                : build(node.getOperand());
        switch (node.getOperator()) {
            case INCREMENT:
                return new EUnary(loc, node.isPostfix() ? UnaryOp.POST_INCREMENT : UnaryOp.PRE_INCREMENT, operand);
            case DECREMENT:
                return new EUnary(loc, node.isPostfix() ? UnaryOp.POST_DECREMENT : UnaryOp.PRE_DECREMENT, operand);
            case NOT:
                return new EUnary(loc, UnaryOp.NOT, operand);
            case NEG:
                return new EUnary(loc, UnaryOp.NEG, operand);
            case NEG_BITS:
                return new EUnary(loc, UnaryOp.BNOT, operand);
            default:
                throw new InternalCompilerError(STAGE, "unknown unary operator " + node.getOperator(), node);
        }
    }

    @Override
    public ElixirNode visitField(TField node, Void ctx) {
        SourceLocation loc = node.getLocation();
        TypedExpr target = unparen(node.getTarget());
        if (target instanceof TTypeExpr) {
            return new ERemoteCall(loc, new EAlias(loc, naming.toModuleName(((TTypeExpr) target).getPath())),
                    naming.toElixirName(node.getName()), new ArrayList<>());
        }
        if ("length".equals(node.getName())) {
            if (target.getType().isArray()) {
                return new ECall(loc, "length", Collections.singletonList(build(target)));
            }
            if (isString(target)) return remote(loc, "String", "length", build(target));
        }
        return new EField(loc, build(node.getTarget()), naming.toElixirName(node.getName()));
    }

    @Override
    public ElixirNode visitCall(TCall node, Void ctx) {
        SourceLocation loc = node.getLocation();
        TypedExpr callee = unparen(node.getCallee());
        List<ElixirNode> args = buildAll(node.getArgs());
        if (callee instanceof TLocal) {
            return new EApply(loc, build(callee), args);
        }
        if (!(callee instanceof TField)) {
            return new EApply(loc, build(callee), args);
        }
        TField method = (TField) callee;
        TypedExpr receiver = unparen(method.getTarget());
        String name = naming.toElixirName(method.getName());
        if (receiver instanceof TTypeExpr) {
            return new ERemoteCall(loc, new EAlias(loc, naming.toModuleName(((TTypeExpr) receiver).getPath())),
                    name, args);
        }
        if (isThis(receiver)) {
            return new ECall(loc, name, prepend(new EVar(loc, MutableToImmutable.INSTANCE_PARAM), args));
        }
        ElixirNode library = libraryCall(loc, receiver, method.getName(), args);
        if (library != null) return library;
        if (method.getKind() == TField.FieldKind.ANON) {
            return new EApply(loc, new EField(loc, build(receiver), name), args);
        }
        return new ERemoteCall(loc, build(receiver), name, args);
    }

    /**
     * 数组和字符串上的常用方法映射到 Enum / String 模块；不认识的方法返回 null。
     */
    private ElixirNode libraryCall(SourceLocation loc, TypedExpr receiver, String method, List<ElixirNode> args) {
        if (receiver.getType().isArray()) {
            ElixirNode list = build(receiver);
            if (args.size() == 1) {
                switch (method) {
                    case "map": return remote(loc, "Enum", "map", list, args.get(0));
                    case "filter": return remote(loc, "Enum", "filter", list, args.get(0));
                    case "join": return remote(loc, "Enum", "join", list, args.get(0));
                    case "contains": return remote(loc, "Enum", "member?", list, args.get(0));
                    case "concat": return new EBinary(loc, BinaryOp.CONCAT, list, args.get(0));
                    default: return null;
                }
            }
            if (args.isEmpty() && "copy".equals(method)) return list;
            return null;
        }
        if (isString(receiver)) {
            ElixirNode string = build(receiver);
            if (args.isEmpty()) {
                if ("toUpperCase".equals(method)) return remote(loc, "String", "upcase", string);
                if ("toLowerCase".equals(method)) return remote(loc, "String", "downcase", string);
                return null;
            }
            if (args.size() == 1) {
                if ("split".equals(method)) return remote(loc, "String", "split", string, args.get(0));
                if ("charAt".equals(method)) return remote(loc, "String", "at", string, args.get(0));
            }
        }
        return null;
    }

    @Override
    public ElixirNode visitArrayAccess(TArrayAccess node, Void ctx) {
        SourceLocation loc = node.getLocation();
        ElixirNode target = build(node.getTarget());
        ElixirNode index = build(node.getIndex());
        if (node.getTarget().getType().isMap()) return new EAccess(loc, target, index);
        return remote(loc, "Enum", "at", target, index);
    }

    @Override
    public ElixirNode visitArrayDecl(TArrayDecl node, Void ctx) {
        return new EList(node.getLocation(), buildAll(node.getElements()));
    }

    @Override
    public ElixirNode visitObjectDecl(TObjectDecl node, Void ctx) {
        SourceLocation loc = node.getLocation();
        List<EMapEntry> entries = new ArrayList<>();
        for (TObjectDecl.ObjectField field : node.getFields()) {
            entries.add(new EMapEntry(new EAtom(loc, naming.toElixirName(field.getName())), build(field.getValue())));
        }
        return new EMap(loc, entries);
    }

    @Override
    public ElixirNode visitParenthesis(TParenthesis node, Void ctx) {
        return new EParen(node.getLocation(), build(node.getExpr()));
    }

    @Override
    public ElixirNode visitTypeExpr(TTypeExpr node, Void ctx) {
        return new EAlias(node.getLocation(), naming.toModuleName(node.getPath()));
    }

    @Override
    public ElixirNode visitEnumIndex(TEnumIndex node, Void ctx) {
        return elem(node.getLocation(), build(node.getTarget()), 0);
    }

    @Override
    public ElixirNode visitEnumParameter(TEnumParameter node, Void ctx) {
        return elem(node.getLocation(), build(node.getTarget()), node.getIndex() + 1L);
    }

    @Override
    public ElixirNode visitMeta(TMeta node, Void ctx) {
        ElixirNode inner = buildOrNil(node.getExpr(), node.getLocation());
        if (!TMeta.UNROLLED.equals(node.getName())) return inner;
        LOG.finer(() -> "unrolled loop block at " + node.getLocation());
        return inner.withMetadata(inner.metadataWith(Metadata.UNROLLED_LOOP, true));
    }
}
