package org.concolic.expressions;

import java.util.Optional;

public enum UnaryOp {

    NEGATE(0, "-"),
    LOGICAL_NOT(1, "!"),
    BITWISE_NOT(2, "~"),
    UNSIGNED_CAST(3, "(unsigned)"),
    SIGNED_CAST(4, "(signed)");

    private final int code;
    private final String symbol;

    UnaryOp(int code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<UnaryOp> lookup(int code) {
        for (UnaryOp op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
