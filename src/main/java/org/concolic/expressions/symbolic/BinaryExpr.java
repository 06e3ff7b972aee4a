package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.expressions.BinaryOp;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 二元运算节点。
 * 对于 CONCAT，子节点的物理顺序由字节序决定 (见 {@link ByteLayout#concatenate})；
 * 对于 EXTRACT，右子节点是起始字节下标常量 (从最低有效字节计)。
 */
@Getter
public final class BinaryExpr extends SymbolicExpr {

    private final BinaryOp op;
    private final SymbolicExpr left;
    private final SymbolicExpr right;

    BinaryExpr(BinaryOp op, SymbolicExpr left, SymbolicExpr right, int byteSize, long value) {
        super(byteSize, value);
        this.op = Objects.requireNonNull(op, "BinaryExpr-构造函数: op 不能为 null");
        this.left = Objects.requireNonNull(left, "BinaryExpr-构造函数: left 不能为 null");
        this.right = Objects.requireNonNull(right, "BinaryExpr-构造函数: right 不能为 null");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public BinaryExpr deepCopy() {
        return new BinaryExpr(op, left.deepCopy(), right.deepCopy(), getByteSize(), getValue());
    }

    @Override
    public boolean isConcrete() {
        return left.isConcrete() && right.isConcrete();
    }

    @Override
    public void collectVariables(Set<Integer> vars) {
        left.collectVariables(vars);
        right.collectVariables(vars);
    }

    @Override
    public boolean dependsOn(Map<Integer, CType> vars) {
        return left.dependsOn(vars) || right.dependsOn(vars);
    }

    @Override
    public void appendTo(StringBuilder sb) {
        sb.append('(').append(op.getSymbol()).append(' ');
        left.appendTo(sb);
        sb.append(' ');
        right.appendTo(sb);
        sb.append(')');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryExpr that = (BinaryExpr) o;
        return op == that.op
                && getByteSize() == that.getByteSize()
                && getValue() == that.getValue()
                && left.equals(that.left)
                && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.BINARY, op, left, right, getByteSize(), getValue());
    }
}
