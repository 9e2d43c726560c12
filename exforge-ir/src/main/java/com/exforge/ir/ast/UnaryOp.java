package com.exforge.ir.ast;

/**
 * 一元运算符。自增/自减只在可变→不可变降级之前出现。
 */
public enum UnaryOp {
    NOT("not "),
    BANG("!"),
    NEG("-"),
    POS("+"),
    BNOT("Bitwise.bnot"),
    PRE_INCREMENT("++"),
    POST_INCREMENT("++"),
    PRE_DECREMENT("--"),
    POST_DECREMENT("--");

    private final String token;

    UnaryOp(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public boolean isIncrement() {
        return this == PRE_INCREMENT || this == POST_INCREMENT;
    }

    public boolean isDecrement() {
        return this == PRE_DECREMENT || this == POST_DECREMENT;
    }

    /** 自增或自减 */
    public boolean isMutating() {
        return isIncrement() || isDecrement();
    }
}
