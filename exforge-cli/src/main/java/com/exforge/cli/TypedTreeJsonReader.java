package com.exforge.cli;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.*;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TUnop.TUnaryOp;
import com.exforge.compiler.ast.type.TypeRef;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * JSON 序列化的类型化树读取器
 *
 * <p>每个节点是带 {@code "kind"} 的对象，变量写作 {@code {"id": 1, "name": "x"}}，
 * 可选的 {@code "type"}（类型名或 {@code {"name", "params"}}）和 {@code "line"}。
 * 未知的 kind、缺少必需字段时抛出 {@link IllegalArgumentException}。</p>
 */
public class TypedTreeJsonReader {

    private final String fileName;

    public TypedTreeJsonReader(String fileName) {
        this.fileName = fileName != null ? fileName : "<input>";
    }

    public TypedExpr read(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed JSON in " + fileName + ": " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("typed tree root must be a JSON object");
        }
        try {
            return node(root.getAsJsonObject());
        } catch (IllegalStateException | UnsupportedOperationException e) {
            // Gson 对类型不符的 getAsXxx 抛出这两类异常
            throw new IllegalArgumentException("unexpected JSON value type in " + fileName + ": " + e.getMessage(), e);
        }
    }

    // ========== 节点 ==========

    private TypedExpr node(JsonObject obj) {
        String kind = string(obj, "kind");
        SourceLocation loc = location(obj);
        TypeRef type = type(obj.get("type"));
        switch (kind) {
            case "const":
                return constant(obj, loc, type);
            case "local":
                return new TLocal(loc, variable(required(obj, "var").getAsJsonObject()));
            case "var":
                return new TVar(loc, variable(required(obj, "var").getAsJsonObject()), optionalNode(obj, "init"));
            case "block":
                return new TBlock(loc, type, nodes(obj, "exprs"));
            case "if":
                return new TIf(loc, type, child(obj, "cond"), child(obj, "then"), optionalNode(obj, "else"));
            case "binop":
                return new TBinop(loc, type, enumValue(TBinaryOp.class, string(obj, "op")),
                        obj.has("assignOp") ? enumValue(TBinaryOp.class, obj.get("assignOp").getAsString()) : null,
                        child(obj, "left"), child(obj, "right"));
            case "unop":
                return new TUnop(loc, type, enumValue(TUnaryOp.class, string(obj, "op")),
                        bool(obj, "postfix", false), child(obj, "operand"));
            case "field":
                TField.FieldKind fieldKind = obj.has("fieldKind")
                        ? enumValue(TField.FieldKind.class, obj.get("fieldKind").getAsString())
                        : TField.FieldKind.INSTANCE;
                return new TField(loc, type, child(obj, "target"), string(obj, "name"), fieldKind);
            case "call":
                return new TCall(loc, type, child(obj, "callee"), nodes(obj, "args"));
            case "arrayAccess":
                return new TArrayAccess(loc, type, child(obj, "target"), child(obj, "index"));
            case "arrayDecl":
                return new TArrayDecl(loc, type, nodes(obj, "elements"));
            case "objectDecl":
                return objectDecl(obj, loc, type);
            case "while":
                return new TWhile(loc, child(obj, "cond"), child(obj, "body"), bool(obj, "normalWhile", true));
            case "return":
                return new TReturn(loc, optionalNode(obj, "value"));
            case "paren":
                return new TParenthesis(loc, child(obj, "expr"));
            case "typeExpr":
                return new TTypeExpr(loc, string(obj, "path"));
            case "switch":
                return switchExpr(obj, loc, type);
            case "enumIndex":
                return new TEnumIndex(loc, child(obj, "target"));
            case "enumParameter":
                return new TEnumParameter(loc, type, child(obj, "target"), string(obj, "constructor"),
                        required(obj, "index").getAsInt(), obj.has("arity") ? obj.get("arity").getAsInt() : -1);
            case "function":
                return new TFunction(loc, type, variables(obj, "args"), child(obj, "body"));
            case "throw":
                return new TThrow(loc, child(obj, "value"));
            case "meta":
                return new TMeta(loc, string(obj, "name"), child(obj, "expr"));
            case "class":
                return classDecl(obj, loc);
            default:
                throw new IllegalArgumentException("unknown node kind '" + kind + "' at " + loc);
        }
    }

    private TypedExpr constant(JsonObject obj, SourceLocation loc, TypeRef type) {
        String constKind = string(obj, "const").toLowerCase(Locale.ROOT);
        switch (constKind) {
            case "int":
                return new TConst(loc, obj.has("type") ? type : TypeRef.INT, TConst.ConstKind.INT,
                        required(obj, "value").getAsLong());
            case "float":
                return new TConst(loc, obj.has("type") ? type : TypeRef.FLOAT, TConst.ConstKind.FLOAT,
                        required(obj, "value").getAsDouble());
            case "string":
                return new TConst(loc, TypeRef.STRING, TConst.ConstKind.STRING, required(obj, "value").getAsString());
            case "bool":
                return new TConst(loc, TypeRef.BOOL, TConst.ConstKind.BOOL, required(obj, "value").getAsBoolean());
            case "null":
                return new TConst(loc, type, TConst.ConstKind.NULL, null);
            case "this":
                return new TConst(loc, type, TConst.ConstKind.THIS, null);
            default:
                throw new IllegalArgumentException("unknown constant kind '" + constKind + "' at " + loc);
        }
    }

    private TypedExpr objectDecl(JsonObject obj, SourceLocation loc, TypeRef type) {
        List<TObjectDecl.ObjectField> fields = new ArrayList<>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject field = e.getAsJsonObject();
            fields.add(new TObjectDecl.ObjectField(string(field, "name"), child(field, "value")));
        }
        return new TObjectDecl(loc, type, fields);
    }

    private TypedExpr switchExpr(JsonObject obj, SourceLocation loc, TypeRef type) {
        List<TSwitch.SwitchCase> cases = new ArrayList<>();
        for (JsonElement e : array(obj, "cases")) {
            JsonObject c = e.getAsJsonObject();
            cases.add(new TSwitch.SwitchCase(nodes(c, "values"), optionalNode(c, "body")));
        }
        return new TSwitch(loc, type, child(obj, "subject"), cases, optionalNode(obj, "default"));
    }

    private TypedExpr classDecl(JsonObject obj, SourceLocation loc) {
        List<String> fields = new ArrayList<>();
        if (obj.has("fields")) {
            for (JsonElement e : obj.getAsJsonArray("fields")) fields.add(e.getAsString());
        }
        List<TClassDecl.TMethod> methods = new ArrayList<>();
        if (obj.has("methods")) {
            for (JsonElement e : obj.getAsJsonArray("methods")) {
                JsonObject m = e.getAsJsonObject();
                methods.add(new TClassDecl.TMethod(string(m, "name"), bool(m, "static", false),
                        bool(m, "public", true), variables(m, "args"), optionalNode(m, "body")));
            }
        }
        return new TClassDecl(loc, string(obj, "name"), fields, methods, bool(obj, "exception", false));
    }

    // ========== 字段 ==========

    private TVariable variable(JsonObject obj) {
        return new TVariable(required(obj, "id").getAsInt(), string(obj, "name"), type(obj.get("type")));
    }

    private List<TVariable> variables(JsonObject obj, String name) {
        if (!obj.has(name)) return Collections.emptyList();
        List<TVariable> result = new ArrayList<>();
        for (JsonElement e : obj.getAsJsonArray(name)) result.add(variable(e.getAsJsonObject()));
        return result;
    }

    private TypeRef type(JsonElement element) {
        if (element == null || element.isJsonNull()) return TypeRef.DYNAMIC;
        if (element.isJsonPrimitive()) return TypeRef.named(element.getAsString());
        JsonObject obj = element.getAsJsonObject();
        List<TypeRef> params = new ArrayList<>();
        if (obj.has("params")) {
            for (JsonElement p : obj.getAsJsonArray("params")) params.add(type(p));
        }
        String name = string(obj, "name");
        return params.isEmpty() ? TypeRef.named(name) : new TypeRef(name, params);
    }

    private SourceLocation location(JsonObject obj) {
        if (!obj.has("line")) return SourceLocation.UNKNOWN;
        int column = obj.has("column") ? obj.get("column").getAsInt() : 0;
        return new SourceLocation(fileName, obj.get("line").getAsInt(), column);
    }

    private TypedExpr child(JsonObject obj, String name) {
        JsonElement e = required(obj, name);
        if (!e.isJsonObject()) {
            throw new IllegalArgumentException("field '" + name + "' must be a node object");
        }
        return node(e.getAsJsonObject());
    }

    private TypedExpr optionalNode(JsonObject obj, String name) {
        JsonElement e = obj.get(name);
        if (e == null || e.isJsonNull()) return null;
        return child(obj, name);
    }

    private List<TypedExpr> nodes(JsonObject obj, String name) {
        List<TypedExpr> result = new ArrayList<>();
        for (JsonElement e : array(obj, name)) result.add(node(e.getAsJsonObject()));
        return result;
    }

    private static JsonArray array(JsonObject obj, String name) {
        JsonElement e = obj.get(name);
        if (e == null || e.isJsonNull()) return new JsonArray();
        if (!e.isJsonArray()) {
            throw new IllegalArgumentException("field '" + name + "' must be an array");
        }
        return e.getAsJsonArray();
    }

    private static JsonElement required(JsonObject obj, String name) {
        JsonElement e = obj.get(name);
        if (e == null || e.isJsonNull()) {
            throw new IllegalArgumentException("missing field '" + name + "' in " + obj);
        }
        return e;
    }

    private static String string(JsonObject obj, String name) {
        return required(obj, name).getAsString();
    }

    private static boolean bool(JsonObject obj, String name, boolean defaultValue) {
        JsonElement e = obj.get(name);
        return e != null && !e.isJsonNull() ? e.getAsBoolean() : defaultValue;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName() + " '" + name + "'", e);
        }
    }
}
