package com.exforge.ir.lowering;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.naming.IdentifierNaming;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.expr.EVar;
import com.exforge.ir.ast.pattern.PVar;

import java.util.function.Function;

/**
 * 模式变换器使用的协作回调：递归构建子表达式、目标标识符命名。
 */
public class PatternContext {

    private final Function<TypedExpr, ElixirNode> builder;
    private final IdentifierNaming naming;

    public PatternContext(Function<TypedExpr, ElixirNode> builder, IdentifierNaming naming) {
        this.builder = builder;
        this.naming = naming;
    }

    /** 构建类型化子表达式对应的中间节点 */
    public ElixirNode buildExpr(TypedExpr expr) {
        return builder.apply(expr);
    }

    public String toElixirName(String sourceName) {
        return naming.toElixirName(sourceName);
    }

    public String toModuleName(String sourcePath) {
        return naming.toModuleName(sourcePath);
    }

    /** 绑定位置的变量，保留源绑定 id */
    public PVar bindVar(SourceLocation location, TVariable variable) {
        return new PVar(location, toElixirName(variable.getName()), variable.getId());
    }

    /** 引用位置的变量，保留源绑定 id */
    public EVar readVar(SourceLocation location, TVariable variable) {
        return new EVar(location, toElixirName(variable.getName()), variable.getId());
    }
}
