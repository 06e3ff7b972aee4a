package org.concolic.serialization;

import org.concolic.core.CType;
import org.concolic.core.ConcolicConfig;
import org.concolic.core.Endianness;
import org.concolic.core.SymbolicObject;
import org.concolic.expressions.BinaryOp;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.UnaryOp;
import org.concolic.expressions.linear.LinearExpression;
import org.concolic.expressions.symbolic.BasicExpr;
import org.concolic.expressions.symbolic.ByteLayout;
import org.concolic.expressions.symbolic.DerefExpr;
import org.concolic.expressions.symbolic.SymbolicExpr;
import org.concolic.testing.FakeMemory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExprCodecTest {

    private static final long BASE = 0x2000;

    private final ExprCodec little = new ExprCodec(ConcolicConfig.defaults());
    private final ExprCodec big = new ExprCodec(ConcolicConfig.defaults().withEndianness(Endianness.BIG));

    /**
     * 一棵包含全部六种节点的树: (== (+ x1 (concat ...)) (*[8] (- x2)))
     */
    private static SymbolicExpr sampleTree(Endianness endianness) {
        BasicExpr x1 = SymbolicExpr.newBasic(CType.INT, 0x01020304, 1);
        BasicExpr x2 = SymbolicExpr.newBasic(CType.U_LONG, -BASE, 2);
        ByteLayout layout = new ByteLayout(endianness);
        SymbolicExpr bytes = layout.concatenate(layout.extractBytes(x1, 0, 2), SymbolicExpr.newConstant(2, 0x7F));
        SymbolicExpr sum = SymbolicExpr.newBinary(CType.INT, 77, BinaryOp.ADD, x1, bytes);
        SymbolicExpr address = SymbolicExpr.newUnary(CType.U_LONG, BASE, UnaryOp.NEGATE, x2);
        FakeMemory memory = new FakeMemory(BASE, (byte) 1, (byte) 2, (byte) 3, (byte) 4,
                (byte) 5, (byte) 6, (byte) 7, (byte) 8);
        DerefExpr deref = SymbolicExpr.newDeref(CType.INT, 0x04030201, SymbolicObject.of(BASE, 8), address, memory);
        return SymbolicExpr.newCompare(CType.INT, 0, CompareOp.EQ, sum, deref);
    }

    private ExprCodec codecFor(Endianness endianness) {
        return endianness == Endianness.LITTLE ? little : big;
    }

    @Nested
    @DisplayName("表达式树 (Expression trees)")
    class TreeTests {

        @ParameterizedTest
        @EnumSource(Endianness.class)
        @DisplayName("包含全部变体的树往返后结构相等")
        void testRoundTrip(Endianness endianness) {
            ExprCodec codec = codecFor(endianness);
            SymbolicExpr tree = sampleTree(endianness);
            byte[] encoded = codec.encode(tree);

            DecodeResult<SymbolicExpr> result = codec.decode(encoded);

            assertTrue(result.isOk(), () -> result.toString());
            assertEquals(tree, result.getValue());
            assertEquals(tree.toString(), result.getValue().toString());
            assertEquals(encoded.length, result.getPosition());
        }

        @Test
        @DisplayName("常量节点为 17 字节，字段按字节序写入")
        void testConstantLayout() {
            SymbolicExpr c = SymbolicExpr.newConstant(CType.INT, 1);
            byte[] le = little.encode(c);
            byte[] be = big.encode(c);

            assertEquals(17, le.length);
            assertAll(
                    () -> assertEquals(1, le[0]),
                    () -> assertEquals(4, le[8]),
                    () -> assertEquals(5, le[16]),
                    () -> assertEquals(1, be[7]),
                    () -> assertEquals(4, be[15]),
                    () -> assertEquals(5, be[16])
            );
        }

        @Test
        @DisplayName("同一个流中连续解码多棵树")
        void testConsecutiveTrees() {
            SymbolicExpr a = SymbolicExpr.newBasic(CType.CHAR, -1, 9);
            SymbolicExpr b = SymbolicExpr.newConstant(CType.LONG, Long.MIN_VALUE);
            WireWriter writer = little.newWriter();
            little.encode(a, writer);
            little.encode(b, writer);
            WireReader reader = little.newReader(new ByteArrayInputStream(writer.toByteArray()));

            assertEquals(a, little.decode(reader).orElseThrow());
            assertEquals(b, little.decode(reader).orElseThrow());
            DecodeResult<SymbolicExpr> end = little.decode(reader);
            assertEquals(DecodeStatus.TRUNCATED, end.getStatus());
            assertEquals(writer.size(), end.getPosition());
        }
    }

    @Nested
    @DisplayName("解码失败 (Decode failures)")
    class FailureTests {

        private byte[] binaryOfConstants() {
            return little.encode(SymbolicExpr.newBinary(CType.INT, 3, BinaryOp.ADD,
                    SymbolicExpr.newConstant(CType.INT, 1), SymbolicExpr.newConstant(CType.INT, 2)));
        }

        @Test
        @DisplayName("空输入报告截断")
        void testEmptyInput() {
            DecodeResult<SymbolicExpr> result = little.decode(new byte[0]);
            assertFalse(result.isOk());
            assertEquals(DecodeStatus.TRUNCATED, result.getStatus());
            assertEquals(0, result.getPosition());
            assertTrue(result.toOptional().isEmpty());
        }

        @Test
        @DisplayName("在二元运算符之后截断")
        void testTruncatedAfterOperator() {
            byte[] truncated = Arrays.copyOf(binaryOfConstants(), 18);
            DecodeResult<SymbolicExpr> result = little.decode(truncated);
            assertEquals(DecodeStatus.TRUNCATED, result.getStatus());
            assertEquals(18, result.getPosition());
            assertNull(result.getValue());
        }

        @Test
        @DisplayName("未知的节点标签")
        void testUnknownTag() {
            byte[] bytes = little.encode(SymbolicExpr.newConstant(CType.INT, 1));
            bytes[16] = 42;
            DecodeResult<SymbolicExpr> result = little.decode(bytes);
            assertEquals(DecodeStatus.UNKNOWN_TAG, result.getStatus());
            assertEquals(16, result.getPosition());
        }

        @Test
        @DisplayName("未知的运算符编码")
        void testUnknownOperator() {
            byte[] bytes = binaryOfConstants();
            bytes[17] = 99;
            DecodeResult<SymbolicExpr> result = little.decode(bytes);
            assertEquals(DecodeStatus.UNKNOWN_OPERATOR, result.getStatus());
            assertEquals(17, result.getPosition());
        }

        @Test
        @DisplayName("字节宽度为 0 属于格式错误")
        void testZeroByteSize() {
            byte[] bytes = little.encode(SymbolicExpr.newConstant(CType.INT, 1));
            bytes[8] = 0;
            DecodeResult<SymbolicExpr> result = little.decode(bytes);
            assertEquals(DecodeStatus.MALFORMED, result.getStatus());
            assertEquals(8, result.getPosition());
        }

        @Test
        @DisplayName("内存快照不完整")
        void testTruncatedSnapshot() {
            byte[] bytes = little.encode(sampleTree(Endianness.LITTLE));
            DecodeResult<SymbolicExpr> result = little.decode(Arrays.copyOf(bytes, bytes.length - 1));
            assertEquals(DecodeStatus.TRUNCATED, result.getStatus());
        }

        @Test
        @DisplayName("嵌套深度超过上限")
        void testDepthLimit() {
            SymbolicExpr expr = SymbolicExpr.newBasic(CType.INT, 0, 1);
            for (int i = 0; i < 5; i++) {
                expr = SymbolicExpr.newUnary(CType.INT, 0, UnaryOp.BITWISE_NOT, expr);
            }
            ExprCodec shallow = new ExprCodec(ConcolicConfig.defaults().withMaxDecodeDepth(2));

            assertEquals(DecodeStatus.MALFORMED, shallow.decode(shallow.encode(expr)).getStatus());
            assertTrue(little.decode(little.encode(expr)).isOk());
        }

        @Test
        @DisplayName("失败结果调用 orElseThrow 抛出异常")
        void testOrElseThrowOnFailure() {
            DecodeResult<SymbolicExpr> result = little.decode(new byte[3]);
            assertThrows(java.util.NoSuchElementException.class, result::orElseThrow);
        }
    }

    @Nested
    @DisplayName("带帧头的流 (Framed streams)")
    class FramedTests {

        @Test
        @DisplayName("读取方按帧头的字节序解码")
        void testCrossEndianFrame() {
            SymbolicExpr tree = sampleTree(Endianness.BIG);
            byte[] framed = big.encodeFramed(tree);

            assertEquals('B', framed[0]);
            assertEquals(tree, little.decodeFramed(framed).orElseThrow());
        }

        @Test
        @DisplayName("失败位置包含帧头字节")
        void testFramedFailurePosition() {
            byte[] framed = little.encodeFramed(SymbolicExpr.newConstant(CType.INT, 1));
            framed[17] = 42;
            DecodeResult<SymbolicExpr> result = big.decodeFramed(framed);

            assertEquals(DecodeStatus.UNKNOWN_TAG, result.getStatus());
            assertEquals(17, result.getPosition());
            byte[] intact = little.encodeFramed(SymbolicExpr.newConstant(CType.INT, 1));
            assertEquals(18, little.decodeFramed(intact).getPosition(),
                    "完整的帧解码后位置应为帧长度");
        }

        @Test
        @DisplayName("未知的字节序标记")
        void testUnknownMarker() {
            byte[] framed = little.encodeFramed(SymbolicExpr.newConstant(CType.INT, 1));
            framed[0] = 'X';
            assertEquals(DecodeStatus.MALFORMED, little.decodeFramed(framed).getStatus());
            assertEquals(DecodeStatus.TRUNCATED, little.decodeFramed(new byte[0]).getStatus());
        }
    }

    @Nested
    @DisplayName("线性表达式 (Linear expressions)")
    class LinearTests {

        @Test
        @DisplayName("往返")
        void testRoundTrip() {
            LinearExpression e = LinearExpression.of(-3, Map.of(1, 2L, 7, -5L));
            byte[] bytes = big.encode(e);
            assertEquals(16 + 2 * 12, bytes.length);
            assertEquals(e, big.decodeLinear(bytes).orElseThrow());
        }

        @Test
        @DisplayName("截断")
        void testTruncated() {
            byte[] bytes = little.encode(LinearExpression.of(1, Map.of(1, 2L)));
            DecodeResult<LinearExpression> result = little.decodeLinear(Arrays.copyOf(bytes, bytes.length - 4));
            assertEquals(DecodeStatus.TRUNCATED, result.getStatus());
        }

        @Test
        @DisplayName("重复的变量或负的项数属于格式错误")
        void testMalformed() {
            byte[] duplicate = little.newWriter()
                    .writeLong(0).writeLong(2)
                    .writeInt(1).writeLong(3)
                    .writeInt(1).writeLong(4)
                    .toByteArray();
            byte[] negativeCount = little.newWriter().writeLong(0).writeLong(-1).toByteArray();

            assertEquals(DecodeStatus.MALFORMED, little.decodeLinear(duplicate).getStatus());
            assertEquals(DecodeStatus.MALFORMED, little.decodeLinear(negativeCount).getStatus());
        }
    }
}
