package org.concolic.expressions;

import java.util.Optional;

public enum CompareOp {

    /**
     * 比较运算符枚举。S_ 前缀表示按有符号数比较，其余关系运算按无符号数比较。
     */
    EQ(0, "=="),
    NEQ(1, "!="),
    GT(2, ">"),
    LE(3, "<="),
    LT(4, "<"),
    GE(5, ">="),
    S_GT(6, ">s"),
    S_LE(7, "<=s"),
    S_LT(8, "<s"),
    S_GE(9, ">=s");

    private final int code;
    private final String symbol;

    CompareOp(int code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isSigned() {
        return this == S_GT || this == S_LE || this == S_LT || this == S_GE;
    }

    /**
     * 返回此比较的否定。
     * 例如：LT 的否定是 GE，S_GT 的否定是 S_LE。
     */
    public CompareOp negate() {
        return switch (this) {
            case EQ -> NEQ;
            case NEQ -> EQ;
            case GT -> LE;
            case LE -> GT;
            case LT -> GE;
            case GE -> LT;
            case S_GT -> S_LE;
            case S_LE -> S_GT;
            case S_LT -> S_GE;
            case S_GE -> S_LT;
        };
    }

    /**
     * 返回交换两个操作数后的等价比较。
     * 例如：(a < b) -> (b > a)。
     */
    public CompareOp flip() {
        return switch (this) {
            case EQ -> EQ;
            case NEQ -> NEQ;
            case GT -> LT;
            case LT -> GT;
            case LE -> GE;
            case GE -> LE;
            case S_GT -> S_LT;
            case S_LT -> S_GT;
            case S_LE -> S_GE;
            case S_GE -> S_LE;
        };
    }

    public static Optional<CompareOp> lookup(int code) {
        for (CompareOp op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
