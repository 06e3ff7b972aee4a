package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.expressions.UnaryOp;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 一元运算节点，独占一个子节点。
 */
@Getter
public final class UnaryExpr extends SymbolicExpr {

    private final UnaryOp op;
    private final SymbolicExpr child;

    UnaryExpr(UnaryOp op, SymbolicExpr child, int byteSize, long value) {
        super(byteSize, value);
        this.op = Objects.requireNonNull(op, "UnaryExpr-构造函数: op 不能为 null");
        this.child = Objects.requireNonNull(child, "UnaryExpr-构造函数: child 不能为 null");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public UnaryExpr deepCopy() {
        return new UnaryExpr(op, child.deepCopy(), getByteSize(), getValue());
    }

    @Override
    public boolean isConcrete() {
        return child.isConcrete();
    }

    @Override
    public void collectVariables(Set<Integer> vars) {
        child.collectVariables(vars);
    }

    @Override
    public boolean dependsOn(Map<Integer, CType> vars) {
        return child.dependsOn(vars);
    }

    @Override
    public void appendTo(StringBuilder sb) {
        sb.append('(').append(op.getSymbol()).append(' ');
        child.appendTo(sb);
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
        UnaryExpr that = (UnaryExpr) o;
        return op == that.op
                && getByteSize() == that.getByteSize()
                && getValue() == that.getValue()
                && child.equals(that.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.UNARY, op, child, getByteSize(), getValue());
    }
}
