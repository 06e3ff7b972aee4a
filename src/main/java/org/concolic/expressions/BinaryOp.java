package org.concolic.expressions;

import java.util.Optional;

public enum BinaryOp {

    ADD(0, "+"),
    SUBTRACT(1, "-"),
    MULTIPLY(2, "*"),
    DIV(3, "/"),
    S_DIV(4, "/s"),
    MOD(5, "%"),
    S_MOD(6, "%s"),
    SHIFT_L(7, "<<"),
    SHIFT_R(8, ">>"),
    S_SHIFT_R(9, ">>s"),
    BITWISE_AND(10, "&"),
    BITWISE_OR(11, "|"),
    BITWISE_XOR(12, "^"),
    CONCAT(13, "concat"),
    EXTRACT(14, "extract"),
    CONCRETE(15, "concrete");

    private final int code;
    private final String symbol;

    BinaryOp(int code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<BinaryOp> lookup(int code) {
        for (BinaryOp op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
