package org.concolic.core;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Optional;

/**
 * C 语言数值类型，以及各类型在 LP64 平台上的字节宽度和取值范围。
 * 编码值与插桩运行时传入的类型标签一致。
 * @author Ayalyt
 */
@Getter
public enum CType {

    BOOLEAN(-1, 1, false),
    U_CHAR(0, 1, false),
    CHAR(1, 1, true),
    U_SHORT(2, 2, false),
    SHORT(3, 2, true),
    U_INT(4, 4, false),
    INT(5, 4, true),
    U_LONG(6, 8, false),
    LONG(7, 8, true),
    U_LONG_LONG(8, 8, false),
    LONG_LONG(9, 8, true),
    STRUCT(10, 0, false); // 结构体没有标量宽度

    private final int code;
    private final int byteSize;
    private final boolean signed;
    private final BigInteger minValue;
    private final BigInteger maxValue;

    CType(int code, int byteSize, boolean signed) {
        this.code = code;
        this.byteSize = byteSize;
        this.signed = signed;
        if (byteSize == 0) {
            this.minValue = BigInteger.ZERO;
            this.maxValue = BigInteger.ZERO;
        } else if (code == -1) {
            this.minValue = BigInteger.ZERO;
            this.maxValue = BigInteger.ONE;
        } else if (signed) {
            this.minValue = BigInteger.ONE.shiftLeft(8 * byteSize - 1).negate();
            this.maxValue = BigInteger.ONE.shiftLeft(8 * byteSize - 1).subtract(BigInteger.ONE);
        } else {
            this.minValue = BigInteger.ZERO;
            this.maxValue = BigInteger.ONE.shiftLeft(8 * byteSize).subtract(BigInteger.ONE);
        }
    }

    /**
     * 是否为可以参与位向量运算的标量类型。
     */
    public boolean isScalar() {
        return byteSize > 0;
    }

    /**
     * 判断一个具体值在该类型下是否可表示。
     * 无符号类型的值按其位模式解释，因此 U_LONG 的 -1 表示最大值。
     */
    public boolean fits(long value) {
        if (!isScalar()) {
            return false;
        }
        BigInteger v = BigInteger.valueOf(value);
        if (!signed && byteSize == 8 && value < 0) {
            v = v.add(BigInteger.ONE.shiftLeft(64));
        }
        return v.compareTo(minValue) >= 0 && v.compareTo(maxValue) <= 0;
    }

    public static Optional<CType> fromCode(int code) {
        for (CType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
