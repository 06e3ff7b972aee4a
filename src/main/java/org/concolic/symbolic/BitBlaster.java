package org.concolic.symbolic;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.concolic.core.ConcolicConfig;
import org.concolic.core.Endianness;
import org.concolic.core.SymbolicObject;
import org.concolic.expressions.BinaryOp;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.symbolic.BasicExpr;
import org.concolic.expressions.symbolic.BinaryExpr;
import org.concolic.expressions.symbolic.ByteLayout;
import org.concolic.expressions.symbolic.CompareExpr;
import org.concolic.expressions.symbolic.ConstantExpr;
import org.concolic.expressions.symbolic.DerefExpr;
import org.concolic.expressions.symbolic.ExprVisitor;
import org.concolic.expressions.symbolic.SymbolicExpr;
import org.concolic.expressions.symbolic.UnaryExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 将表达式树转换为 Z3 位向量项。
 * 每个节点的位宽为 8 * byteSize；有符号与无符号语义由运算符区分 (例如 LT 与 S_LT)。
 * @author Ayalyt
 */
@Getter
public class BitBlaster implements ExprVisitor<BitVecExpr> {

    private static final Logger logger = LoggerFactory.getLogger(BitBlaster.class);

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final ByteLayout layout;
    private final int maxConstantBytes;

    public BitBlaster(Context ctx, Z3VariableManager varManager, ConcolicConfig config) {
        this.ctx = Objects.requireNonNull(ctx, "BitBlaster-构造函数: ctx 不能为 null");
        this.varManager = Objects.requireNonNull(varManager, "BitBlaster-构造函数: varManager 不能为 null");
        Objects.requireNonNull(config, "BitBlaster-构造函数: config 不能为 null");
        this.layout = new ByteLayout(config.getEndianness());
        this.maxConstantBytes = config.getMaxConstantBytes();
    }

    /**
     * 转换为位向量项。
     * @throws UnsupportedOperationException 如果遇到宽度超过机器字长的常量。
     */
    public BitVecExpr lower(SymbolicExpr expr) {
        return expr.accept(this);
    }

    /**
     * 将表达式作为路径条件转换为布尔项：比较节点直接给出其关系，其余节点解释为 "非零"。
     */
    public BoolExpr toBool(SymbolicExpr expr) {
        if (expr instanceof CompareExpr) {
            return compare((CompareExpr) expr);
        }
        BitVecExpr bv = lower(expr);
        return ctx.mkNot(ctx.mkEq(bv, ctx.mkBV(0, bv.getSortSize())));
    }

    @Override
    public BitVecExpr visitConstant(ConstantExpr expr) {
        return constant(expr.getByteSize(), expr.getValue());
    }

    @Override
    public BitVecExpr visitBasic(BasicExpr expr) {
        BitVecExpr var = varManager.getZ3Var(expr.getVariable(), expr.getByteSize());
        return resize(var, 8 * expr.getByteSize(), false);
    }

    @Override
    public BitVecExpr visitUnary(UnaryExpr expr) {
        int bits = 8 * expr.getByteSize();
        BitVecExpr child = lower(expr.getChild());
        return switch (expr.getOp()) {
            case NEGATE -> ctx.mkBVNeg(resize(child, bits, true));
            case BITWISE_NOT -> ctx.mkBVNot(resize(child, bits, false));
            case LOGICAL_NOT -> boolToBV(ctx.mkEq(child, ctx.mkBV(0, child.getSortSize())), bits);
            case UNSIGNED_CAST -> resize(child, bits, false);
            case SIGNED_CAST -> resize(child, bits, true);
        };
    }

    @Override
    public BitVecExpr visitBinary(BinaryExpr expr) {
        int bits = 8 * expr.getByteSize();
        BinaryOp op = expr.getOp();
        if (op == BinaryOp.CONCRETE) {
            return constant(expr.getByteSize(), expr.getValue());
        }
        if (op == BinaryOp.EXTRACT) {
            return extract(expr);
        }
        if (op == BinaryOp.CONCAT) {
            BitVecExpr left = lower(expr.getLeft());
            BitVecExpr right = lower(expr.getRight());
            // 小端构建时子节点顺序为 (低位, 高位)
            return layout.getEndianness() == Endianness.LITTLE
                    ? ctx.mkConcat(right, left)
                    : ctx.mkConcat(left, right);
        }

        boolean signed = op == BinaryOp.S_DIV || op == BinaryOp.S_MOD || op == BinaryOp.S_SHIFT_R;
        BitVecExpr left = resize(lower(expr.getLeft()), bits, signed);
        BitVecExpr right = resize(lower(expr.getRight()), bits, signed);
        return switch (op) {
            case ADD -> ctx.mkBVAdd(left, right);
            case SUBTRACT -> ctx.mkBVSub(left, right);
            case MULTIPLY -> ctx.mkBVMul(left, right);
            case DIV -> ctx.mkBVUDiv(left, right);
            case S_DIV -> ctx.mkBVSDiv(left, right);
            case MOD -> ctx.mkBVURem(left, right);
            case S_MOD -> ctx.mkBVSRem(left, right);
            case SHIFT_L -> ctx.mkBVSHL(left, right);
            case SHIFT_R -> ctx.mkBVLSHR(left, right);
            case S_SHIFT_R -> ctx.mkBVASHR(left, right);
            case BITWISE_AND -> ctx.mkBVAND(left, right);
            case BITWISE_OR -> ctx.mkBVOR(left, right);
            case BITWISE_XOR -> ctx.mkBVXOR(left, right);
            case CONCAT, EXTRACT, CONCRETE -> throw new IllegalStateException("unreachable: " + op);
        };
    }

    @Override
    public BitVecExpr visitCompare(CompareExpr expr) {
        return boolToBV(compare(expr), 8 * expr.getByteSize());
    }

    /**
     * 对象内所有按读取宽度对齐的偏移构成 ite 链：地址项等于 start + offset 时取快照在该处的字节。
     * 具体地址所在的偏移作为链尾的默认值。
     */
    @Override
    public BitVecExpr visitDeref(DerefExpr expr) {
        int n = expr.getByteSize();
        SymbolicObject object = expr.getObject();
        if (object.getSize() < n) {
            logger.error("visitDeref: 读取宽度 {} 超过对象 {} 的大小", n, object);
            throw new IllegalArgumentException("Dereference width " + n + " exceeds object " + object);
        }
        BitVecExpr address = lower(expr.getAddress());
        int addressBits = address.getSortSize();

        long concreteOffset = expr.getAddress().getValue() - object.getStart();
        int defaultOffset = 0;
        if (object.contains(expr.getAddress().getValue()) && concreteOffset % n == 0
                && concreteOffset + n <= object.getSize()) {
            defaultOffset = (int) concreteOffset;
        }

        BitVecExpr result = snapshotBytes(expr, defaultOffset, n);
        for (int offset = 0; offset + n <= object.getSize(); offset += n) {
            if (offset == defaultOffset) {
                continue;
            }
            BoolExpr hit = ctx.mkEq(address, ctx.mkBV(Long.toUnsignedString(object.getStart() + offset), addressBits));
            result = (BitVecExpr) ctx.mkITE(hit, snapshotBytes(expr, offset, n), result);
        }
        return result;
    }

    private BoolExpr compare(CompareExpr expr) {
        BitVecExpr left = lower(expr.getLeft());
        BitVecExpr right = lower(expr.getRight());
        CompareOp op = expr.getOp();
        int bits = Math.max(left.getSortSize(), right.getSortSize());
        left = resize(left, bits, op.isSigned());
        right = resize(right, bits, op.isSigned());
        return switch (op) {
            case EQ -> ctx.mkEq(left, right);
            case NEQ -> ctx.mkNot(ctx.mkEq(left, right));
            case GT -> ctx.mkBVUGT(left, right);
            case LE -> ctx.mkBVULE(left, right);
            case LT -> ctx.mkBVULT(left, right);
            case GE -> ctx.mkBVUGE(left, right);
            case S_GT -> ctx.mkBVSGT(left, right);
            case S_LE -> ctx.mkBVSLE(left, right);
            case S_LT -> ctx.mkBVSLT(left, right);
            case S_GE -> ctx.mkBVSGE(left, right);
        };
    }

    private BitVecExpr extract(BinaryExpr expr) {
        BitVecExpr source = lower(expr.getLeft());
        long low = expr.getRight().getValue();
        int n = expr.getByteSize();
        int high = (int) (8 * (low + n)) - 1;
        if (low < 0 || high >= source.getSortSize()) {
            logger.error("extract: 区间 [{}, {}] 超出源宽度 {}", 8 * low, high, source.getSortSize());
            throw new IllegalArgumentException("Extraction out of range for " + expr);
        }
        return ctx.mkExtract(high, (int) (8 * low), source);
    }

    private BitVecExpr constant(int byteSize, long value) {
        if (byteSize > maxConstantBytes) {
            logger.error("常量宽度 {} 字节超过机器字长 {} 字节，无法转换", byteSize, maxConstantBytes);
            throw new UnsupportedOperationException("Constant of " + byteSize
                    + " bytes exceeds native width of " + maxConstantBytes + " bytes");
        }
        int bits = 8 * byteSize;
        long pattern = bits >= Long.SIZE ? value : value & ((1L << bits) - 1);
        return ctx.mkBV(Long.toUnsignedString(pattern), bits);
    }

    private BitVecExpr snapshotBytes(DerefExpr expr, int offset, int n) {
        if (n > maxConstantBytes) {
            logger.error("解引用宽度 {} 字节超过机器字长 {} 字节，无法转换", n, maxConstantBytes);
            throw new UnsupportedOperationException("Dereference of " + n
                    + " bytes exceeds native width of " + maxConstantBytes + " bytes");
        }
        long value = layout.valueOf(expr.getBytes(), offset, n);
        return ctx.mkBV(Long.toUnsignedString(value), 8 * n);
    }

    private BitVecExpr boolToBV(BoolExpr cond, int bits) {
        return (BitVecExpr) ctx.mkITE(cond, ctx.mkBV(1, bits), ctx.mkBV(0, bits));
    }

    /**
     * 调整到目标位宽：变宽时按 signed 做符号扩展或零扩展，变窄时截取低位。
     */
    private BitVecExpr resize(BitVecExpr bv, int bits, boolean signed) {
        int current = bv.getSortSize();
        if (current == bits) {
            return bv;
        }
        if (current > bits) {
            return ctx.mkExtract(bits - 1, 0, bv);
        }
        return signed ? ctx.mkSignExt(bits - current, bv) : ctx.mkZeroExt(bits - current, bv);
    }
}
