package com.exforge.ir.ast.pattern;

/**
 * 模式访问者，每个模式变体一个方法
 */
public interface PatternVisitor<R, C> {
    R visitVar(PVar pattern, C context);
    R visitLiteral(PLiteral pattern, C context);
    R visitTuple(PTuple pattern, C context);
    R visitList(PList pattern, C context);
    R visitCons(PCons pattern, C context);
    R visitMap(PMap pattern, C context);
    R visitStruct(PStruct pattern, C context);
    R visitPin(PPin pattern, C context);
    R visitWildcard(PWildcard pattern, C context);
    R visitBinary(PBinary pattern, C context);
}
