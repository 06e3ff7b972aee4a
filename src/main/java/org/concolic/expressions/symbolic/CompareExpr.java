package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.expressions.CompareOp;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 比较节点。具体值通常为 0 或 1。
 */
@Getter
public final class CompareExpr extends SymbolicExpr {

    private final CompareOp op;
    private final SymbolicExpr left;
    private final SymbolicExpr right;

    CompareExpr(CompareOp op, SymbolicExpr left, SymbolicExpr right, int byteSize, long value) {
        super(byteSize, value);
        this.op = Objects.requireNonNull(op, "CompareExpr-构造函数: op 不能为 null");
        this.left = Objects.requireNonNull(left, "CompareExpr-构造函数: left 不能为 null");
        this.right = Objects.requireNonNull(right, "CompareExpr-构造函数: right 不能为 null");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public CompareExpr deepCopy() {
        return new CompareExpr(op, left.deepCopy(), right.deepCopy(), getByteSize(), getValue());
    }

    /**
     * 取反当前比较，具体值随之翻转。用于翻转分支。
     */
    public CompareExpr negate() {
        return new CompareExpr(op.negate(), left.deepCopy(), right.deepCopy(),
                getByteSize(), getValue() == 0 ? 1 : 0);
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
        CompareExpr that = (CompareExpr) o;
        return op == that.op
                && getByteSize() == that.getByteSize()
                && getValue() == that.getValue()
                && left.equals(that.left)
                && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.COMPARE, op, left, right, getByteSize(), getValue());
    }
}
