package org.concolic.expressions.symbolic;

import org.concolic.core.CType;
import org.concolic.core.SymbolicObject;
import org.concolic.expressions.BinaryOp;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.PointerOp;
import org.concolic.expressions.UnaryOp;
import org.concolic.testing.FakeMemory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class SymbolicExprTest {

    private static final long BASE = 0x1000;

    private static BasicExpr x1, x2;
    private static FakeMemory memory;
    private static SymbolicObject object;

    @BeforeAll
    static void setUp() {
        x1 = SymbolicExpr.newBasic(CType.INT, 7, 1);
        x2 = SymbolicExpr.newBasic(CType.INT, 3, 2);
        memory = new FakeMemory(BASE, (byte) 0x01, (byte) 0x02, (byte) 0x03, (byte) 0x04);
        object = SymbolicObject.of(BASE, 4);
    }

    @Nested
    @DisplayName("工厂方法 (Factories)")
    class FactoryTests {

        @Test
        @DisplayName("按类型构造常量时查表得到宽度")
        void testConstantWidthFromType() {
            ConstantExpr c = SymbolicExpr.newConstant(CType.SHORT, -2);
            assertAll(
                    () -> assertEquals(2, c.getByteSize()),
                    () -> assertEquals(-2, c.getValue()),
                    () -> assertEquals(NodeKind.CONSTANT, c.getKind())
            );
        }

        @Test
        @DisplayName("非标量类型或非正宽度应被拒绝")
        void testInvalidWidthRejected() {
            assertThrows(IllegalArgumentException.class, () -> SymbolicExpr.newConstant(CType.STRUCT, 0));
            assertThrows(IllegalArgumentException.class, () -> SymbolicExpr.newConstant(0, 1));
        }

        @Test
        @DisplayName("一元节点保留调用方给出的具体值")
        void testUnaryKeepsCallerValue() {
            UnaryExpr neg = SymbolicExpr.newUnary(CType.INT, -7, UnaryOp.NEGATE, x1);
            assertEquals(-7, neg.getValue());
            assertSame(x1, neg.getChild());
        }

        @Test
        @DisplayName("右操作数为常量时按目标类型包装")
        void testBinaryWithRawConstant() {
            BinaryExpr mul = SymbolicExpr.newBinary(CType.INT, 56, BinaryOp.MULTIPLY, x1, 8L);
            assertAll(
                    () -> assertEquals(BinaryOp.MULTIPLY, mul.getOp(), "乘以 2 的幂不应被改写为移位"),
                    () -> assertEquals(SymbolicExpr.newConstant(CType.INT, 8), mul.getRight()),
                    () -> assertEquals(4, mul.getByteSize())
            );
        }

        @Test
        @DisplayName("比较节点取反会翻转运算符和具体值")
        void testCompareNegate() {
            CompareExpr lt = SymbolicExpr.newCompare(CType.INT, 0, CompareOp.S_LT, x1, x2);
            CompareExpr negated = lt.negate();
            assertEquals(CompareOp.S_GE, negated.getOp());
            assertEquals(1, negated.getValue());
            assertEquals(lt.getLeft(), negated.getLeft());
        }
    }

    @Nested
    @DisplayName("相等性 (Equality)")
    class EqualityTests {

        @Test
        @DisplayName("常量相等需要宽度和值都相同")
        void testConstantEquality() {
            assertEquals(SymbolicExpr.newConstant(4, 7), SymbolicExpr.newConstant(4, 7));
            assertNotEquals(SymbolicExpr.newConstant(4, 7), SymbolicExpr.newConstant(8, 7));
            assertNotEquals(SymbolicExpr.newConstant(4, 7), SymbolicExpr.newConstant(4, 8));
        }

        @Test
        @DisplayName("常量与非常量比较两个方向都为 false")
        void testConstantVersusNonConstant() {
            ConstantExpr c = SymbolicExpr.newConstant(4, 7);
            assertFalse(c.equals(x1));
            assertFalse(x1.equals(c));
            UnaryExpr castOfConst = SymbolicExpr.newUnary(CType.INT, 7, UnaryOp.SIGNED_CAST, c);
            assertFalse(c.equals(castOfConst));
            assertFalse(castOfConst.equals(c));
        }

        @Test
        @DisplayName("复合节点按结构比较")
        void testStructuralEquality() {
            BinaryExpr a = SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.ADD, x1, x2);
            BinaryExpr b = SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.ADD,
                    SymbolicExpr.newBasic(CType.INT, 7, 1), SymbolicExpr.newBasic(CType.INT, 3, 2));
            BinaryExpr swapped = SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.ADD, x2, x1);
            BinaryExpr otherOp = SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.BITWISE_OR, x1, x2);

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, swapped);
            assertNotEquals(a, otherOp);
            assertNotEquals(SymbolicExpr.newBasic(CType.INT, 7, 1), SymbolicExpr.newBasic(CType.INT, 7, 3));
        }

        @Test
        @DisplayName("解引用节点比较快照内容")
        void testDerefEquality() {
            DerefExpr a = SymbolicExpr.newConstDeref(CType.INT, 0x04030201, object, BASE, memory);
            DerefExpr b = SymbolicExpr.newConstDeref(CType.INT, 0x04030201, object, BASE,
                    new FakeMemory(BASE, (byte) 0x01, (byte) 0x02, (byte) 0x03, (byte) 0x04));
            DerefExpr c = SymbolicExpr.newConstDeref(CType.INT, 0x04030201, object, BASE,
                    new FakeMemory(BASE, (byte) 0x01, (byte) 0x02, (byte) 0x03, (byte) 0x05));
            assertEquals(a, b);
            assertNotEquals(a, c);
        }
    }

    @Nested
    @DisplayName("查询 (Queries)")
    class QueryTests {

        @Test
        @DisplayName("收集变量与依赖判断")
        void testCollectVariablesAndDependsOn() {
            CompareExpr cmp = SymbolicExpr.newCompare(CType.INT, 1, CompareOp.S_GT,
                    SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.ADD, x1, x2),
                    SymbolicExpr.newConstant(CType.INT, 5));
            Set<Integer> vars = new TreeSet<>();
            cmp.collectVariables(vars);

            assertEquals(Set.of(1, 2), vars);
            assertTrue(cmp.dependsOn(Map.of(2, CType.INT)));
            assertFalse(cmp.dependsOn(Map.of(9, CType.INT)));
            assertFalse(SymbolicExpr.newConstant(4, 1).dependsOn(Map.of(1, CType.INT)));
        }

        @Test
        @DisplayName("是否为具体值")
        void testIsConcrete() {
            ConstantExpr c = SymbolicExpr.newConstant(CType.INT, 1);
            assertTrue(c.isConcrete());
            assertFalse(x1.isConcrete());
            assertTrue(SymbolicExpr.newUnary(CType.INT, -1, UnaryOp.NEGATE, c).isConcrete());
            assertFalse(SymbolicExpr.newBinary(CType.INT, 8, BinaryOp.ADD, x1, c).isConcrete());
        }

        @Test
        @DisplayName("前缀表示法输出")
        void testToString() {
            BinaryExpr add = SymbolicExpr.newBinary(CType.INT, 12, BinaryOp.ADD, x1, 5L);
            assertEquals("(+ x1 5)", add.toString());
            assertEquals("(! (+ x1 5))", SymbolicExpr.newUnary(CType.INT, 0, UnaryOp.LOGICAL_NOT, add).toString());
            assertEquals("-3", SymbolicExpr.newConstant(CType.INT, -3).toString());
        }

        @Test
        @DisplayName("深拷贝与原节点相等但互不共享")
        void testDeepCopy() {
            BinaryExpr original = SymbolicExpr.newBinary(CType.INT, 10, BinaryOp.ADD, x1,
                    SymbolicExpr.newUnary(CType.INT, 3, UnaryOp.SIGNED_CAST, x2));
            BinaryExpr copy = original.deepCopy();

            assertEquals(original, copy);
            assertNotSame(original, copy);
            assertNotSame(original.getLeft(), copy.getLeft());
            assertNotSame(((UnaryExpr) original.getRight()).getChild(), ((UnaryExpr) copy.getRight()).getChild());
        }
    }

    @Nested
    @DisplayName("解引用 (Dereference)")
    class DerefTests {

        @Test
        @DisplayName("具体地址读取截取对象大小的快照")
        void testConstDerefSnapshot() {
            DerefExpr deref = SymbolicExpr.newConstDeref(CType.INT, 0x04030201, object, BASE, memory);

            assertAll(
                    () -> assertArrayEquals(new byte[]{1, 2, 3, 4}, deref.getBytes()),
                    () -> assertEquals(SymbolicExpr.newConstant(CType.U_LONG, BASE), deref.getAddress()),
                    () -> assertEquals(object, deref.getObject()),
                    () -> assertNotSame(object, deref.getObject(), "对象描述应被拷贝"),
                    () -> assertTrue(deref.isConcrete())
            );
        }

        @Test
        @DisplayName("地址表达式按其具体值读取")
        void testSymbolicAddressDeref() {
            BasicExpr pointer = SymbolicExpr.newBasic(CType.U_LONG, BASE, 5);
            DerefExpr deref = SymbolicExpr.newDeref(CType.U_CHAR, 1, SymbolicObject.of(BASE, 2), pointer, memory);

            assertArrayEquals(new byte[]{1, 2}, deref.getBytes());
            assertFalse(deref.isConcrete());
            Set<Integer> vars = new TreeSet<>();
            deref.collectVariables(vars);
            assertEquals(Set.of(5), vars);
        }

        @Test
        @DisplayName("快照被修改不影响节点")
        void testSnapshotIsolated() {
            DerefExpr deref = SymbolicExpr.newConstDeref(CType.INT, 0x04030201, object, BASE, memory);
            byte[] leaked = deref.getBytes();
            leaked[0] = 99;
            assertEquals(1, deref.byteAt(0));
        }

        @Test
        @DisplayName("读取长度不符应被拒绝")
        void testShortReadRejected() {
            assertThrows(IllegalArgumentException.class, () -> SymbolicExpr.newConstDeref(CType.INT, 0, object, BASE,
                    (address, length) -> new byte[length - 1]));
        }
    }

    @Nested
    @DisplayName("指针运算 (Pointer arithmetic)")
    class PointerTests {

        @Test
        @DisplayName("指针加整数时按元素大小缩放")
        void testAddScalesOperand() {
            BasicExpr pointer = SymbolicExpr.newBasic(CType.U_LONG, BASE, 1);
            BasicExpr index = SymbolicExpr.newBasic(CType.INT, 3, 2);
            BinaryExpr sum = SymbolicExpr.newPointer(CType.U_LONG, BASE + 12, PointerOp.ADD_PI, pointer, index, 4);

            assertEquals(BinaryOp.ADD, sum.getOp());
            BinaryExpr scaled = (BinaryExpr) sum.getRight();
            assertEquals(BinaryOp.MULTIPLY, scaled.getOp());
            assertEquals(12, scaled.getValue());
            UnaryExpr widened = (UnaryExpr) scaled.getLeft();
            assertEquals(UnaryOp.UNSIGNED_CAST, widened.getOp());
            assertEquals(8, widened.getByteSize());
        }

        @Test
        @DisplayName("有符号偏移做符号扩展，元素大小为 1 时不缩放")
        void testSignedOffsetWithoutScaling() {
            BasicExpr pointer = SymbolicExpr.newBasic(CType.U_LONG, BASE, 1);
            BasicExpr offset = SymbolicExpr.newBasic(CType.CHAR, -1, 2);
            BinaryExpr sum = SymbolicExpr.newPointer(CType.U_LONG, BASE - 1, PointerOp.S_ADD_PI, pointer, offset, 1);

            UnaryExpr widened = (UnaryExpr) sum.getRight();
            assertEquals(UnaryOp.SIGNED_CAST, widened.getOp());
            assertEquals(-1, widened.getValue());
        }

        @Test
        @DisplayName("指针相减后除以元素大小")
        void testPointerDifference() {
            BasicExpr p = SymbolicExpr.newBasic(CType.U_LONG, BASE + 16, 1);
            BasicExpr q = SymbolicExpr.newBasic(CType.U_LONG, BASE, 2);
            BinaryExpr diff = SymbolicExpr.newPointer(CType.LONG, 4, PointerOp.SUBTRACT_PP, p, q, 4);

            assertEquals(BinaryOp.S_DIV, diff.getOp());
            assertEquals(16, diff.getLeft().getValue());
            assertEquals(SymbolicExpr.newConstant(CType.LONG, 4), diff.getRight());
        }
    }
}
