package org.concolic.expressions;

import java.util.Optional;

/**
 * 指针运算符。PI 表示指针与整数运算，PP 表示两个指针相减。
 * 指针运算在构造时被改写为 {@link BinaryOp} 节点，不单独序列化。
 */
public enum PointerOp {

    ADD_PI(0),
    S_ADD_PI(1),
    SUBTRACT_PI(2),
    S_SUBTRACT_PI(3),
    SUBTRACT_PP(4);

    private final int code;

    PointerOp(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * 改写后所使用的二元运算符。
     */
    public BinaryOp toBinaryOp() {
        return switch (this) {
            case ADD_PI, S_ADD_PI -> BinaryOp.ADD;
            case SUBTRACT_PI, S_SUBTRACT_PI, SUBTRACT_PP -> BinaryOp.SUBTRACT;
        };
    }

    public static Optional<PointerOp> lookup(int code) {
        for (PointerOp op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
