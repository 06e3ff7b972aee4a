package org.concolic.expressions.symbolic;

import java.util.Objects;

/**
 * 字面常量。没有额外字段。
 */
public final class ConstantExpr extends SymbolicExpr {

    ConstantExpr(int byteSize, long value) {
        super(byteSize, value);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public ConstantExpr deepCopy() {
        return new ConstantExpr(getByteSize(), getValue());
    }

    @Override
    public boolean isConcrete() {
        return true;
    }

    @Override
    public void appendTo(StringBuilder sb) {
        sb.append(getValue());
    }

    /**
     * 只有字节宽度和值都相同的两个常量相等，与其他任何变体比较均为 false。
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstantExpr)) {
            return false;
        }
        ConstantExpr that = (ConstantExpr) o;
        return getByteSize() == that.getByteSize() && getValue() == that.getValue();
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.CONSTANT, getByteSize(), getValue());
    }
}
