package com.exforge.ir.ast;

/**
 * 二元运算符。
 * <p>
 * 中缀运算符按 Elixir 优先级排列（数值越大结合越紧）；取余、整除与位运算
 * 没有中缀形式，打印为限定函数调用。
 */
public enum BinaryOp {
    // 算术
    MUL("*", 70, Assoc.LEFT),
    DIV("/", 70, Assoc.LEFT),
    ADD("+", 60, Assoc.LEFT),
    SUB("-", 60, Assoc.LEFT),

    // 列表/字符串
    CONCAT("++", 55, Assoc.RIGHT),
    LIST_SUBTRACT("--", 55, Assoc.RIGHT),
    STRING_CONCAT("<>", 55, Assoc.RIGHT),

    IN("in", 50, Assoc.LEFT),
    PIPE("|>", 45, Assoc.LEFT),

    // 比较
    LT("<", 40, Assoc.LEFT),
    GT(">", 40, Assoc.LEFT),
    LE("<=", 40, Assoc.LEFT),
    GE(">=", 40, Assoc.LEFT),
    EQ("==", 35, Assoc.LEFT),
    NEQ("!=", 35, Assoc.LEFT),
    STRICT_EQ("===", 35, Assoc.LEFT),
    STRICT_NEQ("!==", 35, Assoc.LEFT),

    // 逻辑
    AND("and", 30, Assoc.LEFT),
    BOOL_AND("&&", 30, Assoc.LEFT),
    OR("or", 25, Assoc.LEFT),
    BOOL_OR("||", 25, Assoc.LEFT),

    // 函数形式
    REM("Kernel.rem"),
    INT_DIV("div"),
    BAND("Bitwise.band"),
    BOR("Bitwise.bor"),
    BXOR("Bitwise.bxor"),
    BSL("Bitwise.bsl"),
    BSR("Bitwise.bsr");

    private final String token;
    private final int precedence;
    private final Assoc assoc;
    private final boolean function;

    BinaryOp(String token, int precedence, Assoc assoc) {
        this.token = token;
        this.precedence = precedence;
        this.assoc = assoc;
        this.function = false;
    }

    BinaryOp(String functionName) {
        this.token = functionName;
        this.precedence = Integer.MAX_VALUE;
        this.assoc = Assoc.LEFT;
        this.function = true;
    }

    /** 中缀运算符记号，或函数形式的限定函数名 */
    public String getToken() {
        return token;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return assoc == Assoc.RIGHT;
    }

    /** 是否打印为函数调用而不是中缀 */
    public boolean isFunction() {
        return function;
    }

    public boolean isBitwise() {
        switch (this) {
            case BAND: case BOR: case BXOR: case BSL: case BSR:
                return true;
            default:
                return false;
        }
    }

    public boolean isComparison() {
        return precedence == 40 || precedence == 35;
    }

    private enum Assoc { LEFT, RIGHT }
}
