package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.apache.commons.lang3.ArrayUtils;
import org.concolic.core.CType;
import org.concolic.core.Endianness;
import org.concolic.expressions.BinaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 按给定字节序对具体值和表达式做字节拼接与提取。
 * <p>
 * 小端下字节下标从最低有效字节开始计数；大端下下标 i 先换算为 size - i - n，
 * 再按同样的最低有效字节公式提取。
 * 例如对 4 字节值 0xABCDEF12 提取下标 2 处的 1 个字节：小端得到 0xCD，大端得到 0xEF。
 * @author Ayalyt
 */
@Getter
public final class ByteLayout {

    private static final Logger logger = LoggerFactory.getLogger(ByteLayout.class);

    private final Endianness endianness;

    public ByteLayout(Endianness endianness) {
        this.endianness = Objects.requireNonNull(endianness, "ByteLayout-构造函数: endianness 不能为 null");
    }

    /**
     * 拼接 e1 与 e2，e1 为高位部分。
     * 结果宽度为两者之和，值为 (e1 << 8*|e2|) + e2。
     * 小端下节点中的子节点顺序为 (e2, e1)，大端下为 (e1, e2)。
     */
    public BinaryExpr concatenate(SymbolicExpr e1, SymbolicExpr e2) {
        Objects.requireNonNull(e1, "concatenate: e1 不能为 null");
        Objects.requireNonNull(e2, "concatenate: e2 不能为 null");
        int shift = 8 * e2.getByteSize();
        long high = shift >= Long.SIZE ? 0L : e1.getValue() << shift;
        long value = high + e2.getValue();
        int size = e1.getByteSize() + e2.getByteSize();
        logger.debug("拼接 {} 与 {}，宽度 {}，值 {}", e1, e2, size, value);
        return switch (endianness) {
            case LITTLE -> SymbolicExpr.newBinary(size, value, BinaryOp.CONCAT, e2, e1);
            case BIG -> SymbolicExpr.newBinary(size, value, BinaryOp.CONCAT, e1, e2);
        };
    }

    /**
     * 从宽度为 size 的具体值中提取下标 i 开始的 n 个字节。
     * @throws IllegalArgumentException 如果 i 不是 n 的整数倍，或区间越界。
     */
    public ConstantExpr extractBytes(int size, long value, int i, int n) {
        int low = lowIndex(size, i, n);
        return SymbolicExpr.newConstant(n, extractLow(value, low, n));
    }

    /**
     * 从表达式 e 中提取下标 i 开始的 n 个字节，得到 EXTRACT 节点，
     * 其右子节点是换算后的最低有效字节下标。
     * @throws IllegalArgumentException 如果 i 不是 n 的整数倍，或区间越界。
     */
    public BinaryExpr extractBytes(SymbolicExpr e, int i, int n) {
        Objects.requireNonNull(e, "extractBytes: e 不能为 null");
        int low = lowIndex(e.getByteSize(), i, n);
        long value = extractLow(e.getValue(), low, n);
        ConstantExpr offset = SymbolicExpr.newConstant(CType.U_LONG, low);
        return SymbolicExpr.newBinary(n, value, BinaryOp.EXTRACT, e, offset);
    }

    /**
     * 按字节序把快照中 offset 开始的 n 个字节组装为具体值。
     */
    public long valueOf(byte[] bytes, int offset, int n) {
        if (n <= 0 || n > Long.BYTES || offset < 0 || offset + n > bytes.length) {
            logger.error("valueOf: 区间 [{}, {}) 超出快照长度 {} 或宽度非法", offset, offset + n, bytes.length);
            throw new IllegalArgumentException("Invalid byte range [" + offset + ", " + (offset + n)
                    + ") for snapshot of length " + bytes.length);
        }
        byte[] chunk = ArrayUtils.subarray(bytes, offset, offset + n);
        if (endianness == Endianness.LITTLE) {
            ArrayUtils.reverse(chunk);
        }
        long result = 0;
        for (byte b : chunk) {
            result = (result << 8) | (b & 0xFFL);
        }
        return result;
    }

    private int lowIndex(int size, int i, int n) {
        if (n <= 0 || i < 0 || i % n != 0) {
            logger.error("extractBytes: 下标 {} 未按宽度 {} 对齐", i, n);
            throw new IllegalArgumentException("Extraction offset " + i + " is not aligned to width " + n);
        }
        if (i + n > size) {
            logger.error("extractBytes: 区间 [{}, {}) 超出宽度 {}", i, i + n, size);
            throw new IllegalArgumentException("Extraction range [" + i + ", " + (i + n)
                    + ") exceeds size " + size);
        }
        return endianness == Endianness.BIG ? size - i - n : i;
    }

    static long extractLow(long value, int low, int n) {
        int shift = 8 * low;
        long shifted = shift >= Long.SIZE ? (value < 0 ? -1L : 0L) : value >> shift;
        long mask = n >= Long.BYTES ? -1L : (1L << (8 * n)) - 1;
        return shifted & mask;
    }
}
