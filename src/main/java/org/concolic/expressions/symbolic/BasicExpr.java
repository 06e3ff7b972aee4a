package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 读取一个符号输入变量的叶子节点。
 */
@Getter
public final class BasicExpr extends SymbolicExpr {

    private final int variable;

    BasicExpr(int byteSize, long value, int variable) {
        super(byteSize, value);
        this.variable = variable;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BASIC;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBasic(this);
    }

    @Override
    public BasicExpr deepCopy() {
        return new BasicExpr(getByteSize(), getValue(), variable);
    }

    @Override
    public boolean isConcrete() {
        return false;
    }

    @Override
    public void collectVariables(Set<Integer> vars) {
        vars.add(variable);
    }

    @Override
    public boolean dependsOn(Map<Integer, CType> vars) {
        return vars.containsKey(variable);
    }

    @Override
    public void appendTo(StringBuilder sb) {
        sb.append('x').append(Integer.toUnsignedString(variable));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BasicExpr that = (BasicExpr) o;
        return variable == that.variable
                && getByteSize() == that.getByteSize()
                && getValue() == that.getValue();
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.BASIC, variable, getByteSize(), getValue());
    }
}
