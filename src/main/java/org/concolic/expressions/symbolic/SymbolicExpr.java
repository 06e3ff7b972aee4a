package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.core.MemoryReader;
import org.concolic.core.SymbolicObject;
import org.concolic.expressions.BinaryOp;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.PointerOp;
import org.concolic.expressions.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 符号表达式树的节点。每个节点同时记录真实执行中求得的具体值 (value)
 * 和该值所属类型的字节宽度 (byteSize)。
 * <p>
 * 节点在构造后不可变，子节点由父节点独占，整体构成一棵树。
 * 变体集合是封闭的：{@link ConstantExpr}、{@link BasicExpr}、{@link UnaryExpr}、
 * {@link BinaryExpr}、{@link CompareExpr}、{@link DerefExpr}。
 * 按变体分派的逻辑统一通过 {@link ExprVisitor} 实现。
 * @author Ayalyt
 */
@Getter
public abstract class SymbolicExpr {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicExpr.class);

    /**
     * 真实执行中该节点求得的具体值。
     */
    private final long value;

    /**
     * 节点类型所占的字节数，恒大于 0。
     */
    private final int byteSize;

    SymbolicExpr(int byteSize, long value) {
        if (byteSize <= 0) {
            logger.error("SymbolicExpr-构造函数: 字节宽度 {} 必须为正", byteSize);
            throw new IllegalArgumentException("Byte size must be positive: " + byteSize);
        }
        this.byteSize = byteSize;
        this.value = value;
    }

    public abstract NodeKind getKind();

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * 深拷贝。复合节点递归拷贝其子节点。
     */
    public abstract SymbolicExpr deepCopy();

    /**
     * 是否不依赖任何符号变量。为 true 时可跳过求解器。
     */
    public abstract boolean isConcrete();

    /**
     * 将该节点传递引用的所有变量编号加入 vars。
     */
    public void collectVariables(Set<Integer> vars) {
    }

    /**
     * 该节点是否传递地引用了 vars 中的任一变量。
     */
    public boolean dependsOn(Map<Integer, CType> vars) {
        return false;
    }

    /**
     * 以前缀表示法追加可读形式。
     */
    public abstract void appendTo(StringBuilder sb);

    @Override
    public final String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    // --- 工厂方法 ---

    public static ConstantExpr newConstant(CType type, long value) {
        return new ConstantExpr(sizeOf(type), value);
    }

    public static ConstantExpr newConstant(int byteSize, long value) {
        return new ConstantExpr(byteSize, value);
    }

    public static BasicExpr newBasic(CType type, long value, int variable) {
        return new BasicExpr(sizeOf(type), value, variable);
    }

    /**
     * 构造一元运算节点。value 是调用方已对子节点具体值计算出的结果，此处不重新计算。
     */
    public static UnaryExpr newUnary(CType type, long value, UnaryOp op, SymbolicExpr child) {
        return new UnaryExpr(op, child, sizeOf(type), value);
    }

    public static BinaryExpr newBinary(CType type, long value, BinaryOp op,
                                       SymbolicExpr left, SymbolicExpr right) {
        return new BinaryExpr(op, left, right, sizeOf(type), value);
    }

    /**
     * 右操作数为具体常量的便捷形式，常量按目标类型包装为 {@link ConstantExpr}。
     */
    public static BinaryExpr newBinary(CType type, long value, BinaryOp op,
                                       SymbolicExpr left, long right) {
        return new BinaryExpr(op, left, newConstant(type, right), sizeOf(type), value);
    }

    public static CompareExpr newCompare(CType type, long value, CompareOp op,
                                         SymbolicExpr left, SymbolicExpr right) {
        return new CompareExpr(op, left, right, sizeOf(type), value);
    }

    /**
     * 读取具体地址 address 处的对象。地址本身被记录为 U_LONG 常量节点。
     */
    public static DerefExpr newConstDeref(CType type, long value, SymbolicObject object,
                                          long address, MemoryReader memory) {
        return newDeref(type, value, object, newConstant(CType.U_LONG, address), memory);
    }

    /**
     * 读取地址表达式当前具体值处的对象。
     * 对象描述被深拷贝，并从内存中截取恰好 object.getSize() 字节的快照。
     */
    public static DerefExpr newDeref(CType type, long value, SymbolicObject object,
                                     SymbolicExpr address, MemoryReader memory) {
        Objects.requireNonNull(object, "newDeref: object 不能为 null");
        Objects.requireNonNull(address, "newDeref: address 不能为 null");
        Objects.requireNonNull(memory, "newDeref: memory 不能为 null");
        byte[] bytes = memory.read(address.getValue(), object.getSize());
        if (bytes == null || bytes.length != object.getSize()) {
            logger.error("newDeref: 从地址 {} 读取 {} 字节失败，实际得到 {}",
                    Long.toUnsignedString(address.getValue()), object.getSize(), bytes == null ? null : bytes.length);
            throw new IllegalArgumentException("Memory snapshot size mismatch for object " + object);
        }
        return new DerefExpr(address, SymbolicObject.copyOf(object), bytes, sizeOf(type), value);
    }

    /**
     * 将指针运算改写为二元运算节点。
     * 指针与整数运算时整数先按元素大小缩放，两个指针相减时差值再除以元素大小。
     * @param type 结果类型。
     * @param value 调用方计算出的具体结果。
     * @param op 指针运算符。
     * @param pointer 指针操作数。
     * @param operand 整数操作数 (PI) 或第二个指针 (PP)。
     * @param elementSize 指针所指元素的字节数。
     */
    public static BinaryExpr newPointer(CType type, long value, PointerOp op,
                                        SymbolicExpr pointer, SymbolicExpr operand, long elementSize) {
        Objects.requireNonNull(pointer, "newPointer: pointer 不能为 null");
        Objects.requireNonNull(operand, "newPointer: operand 不能为 null");
        if (elementSize <= 0) {
            logger.error("newPointer: 元素大小 {} 必须为正", elementSize);
            throw new IllegalArgumentException("Element size must be positive: " + elementSize);
        }
        if (op == PointerOp.SUBTRACT_PP) {
            BinaryExpr diff = newBinary(CType.LONG, pointer.getValue() - operand.getValue(),
                    BinaryOp.SUBTRACT, pointer, operand);
            return newBinary(type, value, BinaryOp.S_DIV, diff, elementSize);
        }

        boolean signed = op == PointerOp.S_ADD_PI || op == PointerOp.S_SUBTRACT_PI;
        SymbolicExpr offset = widenToPointer(operand, signed);
        if (elementSize != 1) {
            offset = newBinary(CType.U_LONG, offset.getValue() * elementSize,
                    BinaryOp.MULTIPLY, offset, elementSize);
        }
        return newBinary(type, value, op.toBinaryOp(), pointer, offset);
    }

    private static SymbolicExpr widenToPointer(SymbolicExpr operand, boolean signed) {
        int pointerSize = CType.U_LONG.getByteSize();
        if (operand.getByteSize() >= pointerSize) {
            return operand;
        }
        int bits = 8 * operand.getByteSize();
        long low = operand.getValue() & ((1L << bits) - 1);
        if (signed) {
            long extended = (low << (64 - bits)) >> (64 - bits);
            return newUnary(CType.LONG, extended, UnaryOp.SIGNED_CAST, operand);
        }
        return newUnary(CType.U_LONG, low, UnaryOp.UNSIGNED_CAST, operand);
    }

    // --- 按字节宽度构造，供反序列化与字节操作使用 ---

    public static BasicExpr newBasic(int byteSize, long value, int variable) {
        return new BasicExpr(byteSize, value, variable);
    }

    public static UnaryExpr newUnary(int byteSize, long value, UnaryOp op, SymbolicExpr child) {
        return new UnaryExpr(op, child, byteSize, value);
    }

    public static BinaryExpr newBinary(int byteSize, long value, BinaryOp op,
                                       SymbolicExpr left, SymbolicExpr right) {
        return new BinaryExpr(op, left, right, byteSize, value);
    }

    public static CompareExpr newCompare(int byteSize, long value, CompareOp op,
                                         SymbolicExpr left, SymbolicExpr right) {
        return new CompareExpr(op, left, right, byteSize, value);
    }

    static int sizeOf(CType type) {
        Objects.requireNonNull(type, "type 不能为 null");
        if (!type.isScalar()) {
            logger.error("类型 {} 没有标量宽度，无法构造表达式节点", type);
            throw new IllegalArgumentException("Type has no scalar width: " + type);
        }
        return type.getByteSize();
    }
}
