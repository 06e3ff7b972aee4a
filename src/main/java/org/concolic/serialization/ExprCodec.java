package org.concolic.serialization;

import lombok.Getter;
import org.concolic.core.ConcolicConfig;
import org.concolic.core.Endianness;
import org.concolic.core.SymbolicObject;
import org.concolic.expressions.BinaryOp;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.UnaryOp;
import org.concolic.expressions.linear.LinearExpression;
import org.concolic.expressions.symbolic.BasicExpr;
import org.concolic.expressions.symbolic.BinaryExpr;
import org.concolic.expressions.symbolic.CompareExpr;
import org.concolic.expressions.symbolic.ConstantExpr;
import org.concolic.expressions.symbolic.DerefExpr;
import org.concolic.expressions.symbolic.ExprVisitor;
import org.concolic.expressions.symbolic.NodeKind;
import org.concolic.expressions.symbolic.SymbolicExpr;
import org.concolic.expressions.symbolic.UnaryExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * 表达式树与线性表达式的二进制编解码。
 * <p>
 * 每个节点的格式为 [value:8][byteSize:8][tag:1][payload]，多字节字段按配置的字节序写入：
 * <ul>
 *   <li>BASIC: 变量编号 (4 字节)</li>
 *   <li>COMPARE / BINARY: 运算符 (1 字节)，左子树，右子树</li>
 *   <li>UNARY: 运算符 (1 字节)，子树</li>
 *   <li>DEREF: 对象描述 [start:8][size:8]，地址子树，size 字节的快照</li>
 *   <li>CONSTANT: 无</li>
 * </ul>
 * 线性表达式的格式为 [constant:8][count:8]，随后 count 个 [variable:4][coefficient:8]。
 * <p>
 * 解码从不向调用方抛出异常：任何层级的失败都使整个解码返回失败的 {@link DecodeResult}，
 * 已构造的部分子树随之不可达。
 * @author Ayalyt
 */
@Getter
public class ExprCodec {

    private static final Logger logger = LoggerFactory.getLogger(ExprCodec.class);

    private final Endianness endianness;
    private final int maxDepth;
    private final int maxObjectBytes;

    public ExprCodec(ConcolicConfig config) {
        Objects.requireNonNull(config, "ExprCodec-构造函数: config 不能为 null");
        this.endianness = config.getEndianness();
        this.maxDepth = config.getMaxDecodeDepth();
        this.maxObjectBytes = config.getMaxObjectBytes();
    }

    public WireWriter newWriter() {
        return new WireWriter(endianness.getByteOrder());
    }

    public WireReader newReader(InputStream in) {
        return new WireReader(in, endianness.getByteOrder());
    }

    // --- 表达式树 ---

    public byte[] encode(SymbolicExpr expr) {
        WireWriter writer = newWriter();
        encode(expr, writer);
        return writer.toByteArray();
    }

    public void encode(SymbolicExpr expr, WireWriter writer) {
        Objects.requireNonNull(expr, "encode: expr 不能为 null");
        expr.accept(new Encoder(writer));
    }

    public DecodeResult<SymbolicExpr> decode(byte[] bytes) {
        return decode(newReader(new ByteArrayInputStream(bytes)));
    }

    /**
     * 从 reader 的当前位置解码一棵树。同一个 reader 可以连续解码多棵树。
     */
    public DecodeResult<SymbolicExpr> decode(WireReader reader) {
        long start = reader.getPosition();
        try {
            SymbolicExpr expr = readExpr(reader, 0);
            logger.debug("在位置 {} 解码得到 {}", start, expr);
            return DecodeResult.ok(expr, reader.getPosition());
        } catch (DecodeException e) {
            logger.warn("从位置 {} 开始的表达式解码失败: {} {}", start, e.getStatus(), e.getMessage());
            return DecodeResult.failure(e);
        }
    }

    /**
     * 带帧头的编码：首字节标记写入方使用的字节序，读取方据此解码。
     */
    public byte[] encodeFramed(SymbolicExpr expr) {
        WireWriter writer = newWriter();
        writer.writeByte(endianness.getMarker());
        encode(expr, writer);
        return writer.toByteArray();
    }

    public DecodeResult<SymbolicExpr> decodeFramed(byte[] bytes) {
        return decodeFramed(new ByteArrayInputStream(bytes));
    }

    public DecodeResult<SymbolicExpr> decodeFramed(InputStream in) {
        WireReader header = newReader(in);
        int marker;
        try {
            marker = header.readUnsignedByte();
        } catch (DecodeException e) {
            logger.warn("读取帧头失败: {}", e.getMessage());
            return DecodeResult.failure(e);
        }
        Endianness streamOrder = Endianness.fromMarker(marker).orElse(null);
        if (streamOrder == null) {
            return DecodeResult.failure(new DecodeException(DecodeStatus.MALFORMED, 0,
                    "未知的字节序标记 0x" + Integer.toHexString(marker)));
        }
        if (streamOrder != endianness) {
            logger.info("流的字节序 {} 与本地配置 {} 不同，按流的字节序解码", streamOrder, endianness);
        }
        return decode(new WireReader(in, streamOrder.getByteOrder(), header.getPosition()));
    }

    // --- 线性表达式 ---

    public byte[] encode(LinearExpression expr) {
        WireWriter writer = newWriter();
        encode(expr, writer);
        return writer.toByteArray();
    }

    public void encode(LinearExpression expr, WireWriter writer) {
        writer.writeLong(expr.getConstant());
        writer.writeLong(expr.getCoefficients().size());
        expr.getCoefficients().forEach((var, coeff) -> {
            writer.writeInt(var);
            writer.writeLong(coeff);
        });
    }

    public DecodeResult<LinearExpression> decodeLinear(byte[] bytes) {
        return decodeLinear(newReader(new ByteArrayInputStream(bytes)));
    }

    public DecodeResult<LinearExpression> decodeLinear(WireReader reader) {
        try {
            long constant = reader.readLong();
            long count = reader.readLong();
            if (count < 0 || count > Integer.MAX_VALUE) {
                throw new DecodeException(DecodeStatus.MALFORMED, reader.getPosition(), "非法的项数 " + count);
            }
            Map<Integer, Long> coefficients = new HashMap<>();
            for (long i = 0; i < count; i++) {
                int var = reader.readInt();
                long coeff = reader.readLong();
                if (coefficients.put(var, coeff) != null) {
                    throw new DecodeException(DecodeStatus.MALFORMED, reader.getPosition(), "变量 x" + var + " 重复出现");
                }
            }
            return DecodeResult.ok(LinearExpression.of(constant, coefficients), reader.getPosition());
        } catch (DecodeException e) {
            logger.warn("线性表达式解码失败: {} {}", e.getStatus(), e.getMessage());
            return DecodeResult.failure(e);
        }
    }

    // --- 解码细节 ---

    private SymbolicExpr readExpr(WireReader reader, int depth) throws DecodeException {
        if (depth > maxDepth) {
            throw new DecodeException(DecodeStatus.MALFORMED, reader.getPosition(),
                    "表达式深度超过上限 " + maxDepth);
        }
        long value = reader.readLong();
        long rawSize = reader.readLong();
        if (rawSize <= 0 || rawSize > Integer.MAX_VALUE) {
            throw new DecodeException(DecodeStatus.MALFORMED, reader.getPosition() - Long.BYTES,
                    "非法的字节宽度 " + Long.toUnsignedString(rawSize));
        }
        int size = (int) rawSize;
        long tagPosition = reader.getPosition();
        int tag = reader.readUnsignedByte();
        NodeKind kind = NodeKind.fromTag(tag).orElseThrow(() -> new DecodeException(DecodeStatus.UNKNOWN_TAG,
                tagPosition, "未知的节点标签 " + tag));

        return switch (kind) {
            case BASIC -> SymbolicExpr.newBasic(size, value, reader.readInt());
            case COMPARE -> {
                CompareOp op = readOp(reader, "比较", CompareOp::lookup);
                SymbolicExpr left = readExpr(reader, depth + 1);
                SymbolicExpr right = readExpr(reader, depth + 1);
                yield SymbolicExpr.newCompare(size, value, op, left, right);
            }
            case BINARY -> {
                BinaryOp op = readOp(reader, "二元", BinaryOp::lookup);
                SymbolicExpr left = readExpr(reader, depth + 1);
                SymbolicExpr right = readExpr(reader, depth + 1);
                yield SymbolicExpr.newBinary(size, value, op, left, right);
            }
            case UNARY -> {
                UnaryOp op = readOp(reader, "一元", UnaryOp::lookup);
                yield SymbolicExpr.newUnary(size, value, op, readExpr(reader, depth + 1));
            }
            case DEREF -> {
                SymbolicObject object = readObject(reader);
                SymbolicExpr address = readExpr(reader, depth + 1);
                byte[] bytes = reader.readBytes(object.getSize());
                yield DerefExpr.of(address, object, bytes, size, value);
            }
            case CONSTANT -> SymbolicExpr.newConstant(size, value);
        };
    }

    private SymbolicObject readObject(WireReader reader) throws DecodeException {
        long start = reader.readLong();
        long size = reader.readLong();
        if (size < 0 || size > maxObjectBytes) {
            throw new DecodeException(DecodeStatus.MALFORMED, reader.getPosition() - Long.BYTES,
                    "非法的对象大小 " + Long.toUnsignedString(size) + "，上限为 " + maxObjectBytes);
        }
        return SymbolicObject.of(start, (int) size);
    }

    private <T> T readOp(WireReader reader, String category, IntFunction<Optional<T>> lookup) throws DecodeException {
        long at = reader.getPosition();
        int code = reader.readUnsignedByte();
        T op = lookup.apply(code).orElse(null);
        if (op == null) {
            throw new DecodeException(DecodeStatus.UNKNOWN_OPERATOR, at, "未知的" + category + "运算符编码 " + code);
        }
        return op;
    }

    /**
     * 写入公共前缀和标签，再按变体追加运算符与子树。
     */
    private static final class Encoder implements ExprVisitor<Void> {

        private final WireWriter writer;

        Encoder(WireWriter writer) {
            this.writer = writer;
        }

        private void header(SymbolicExpr expr) {
            writer.writeLong(expr.getValue());
            writer.writeLong(expr.getByteSize());
            writer.writeByte(expr.getKind().getTag());
        }

        @Override
        public Void visitConstant(ConstantExpr expr) {
            header(expr);
            return null;
        }

        @Override
        public Void visitBasic(BasicExpr expr) {
            header(expr);
            writer.writeInt(expr.getVariable());
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr expr) {
            header(expr);
            writer.writeByte(expr.getOp().getCode());
            expr.getChild().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpr expr) {
            header(expr);
            writer.writeByte(expr.getOp().getCode());
            expr.getLeft().accept(this);
            expr.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitCompare(CompareExpr expr) {
            header(expr);
            writer.writeByte(expr.getOp().getCode());
            expr.getLeft().accept(this);
            expr.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitDeref(DerefExpr expr) {
            header(expr);
            writer.writeLong(expr.getObject().getStart());
            writer.writeLong(expr.getObject().getSize());
            expr.getAddress().accept(this);
            writer.writeBytes(expr.getBytes());
            return null;
        }
    }
}
