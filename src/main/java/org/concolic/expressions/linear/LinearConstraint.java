package org.concolic.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.concolic.expressions.CompareOp;
import org.concolic.expressions.ToZ3BoolExpr;
import org.concolic.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 线性约束，规范化为 E ~ 0 的形式，按整数语义解释。
 * 有符号与无符号比较在整数域上没有区别。
 * 此类是不可变的：构造时拷贝表达式。
 */
@Getter
public final class LinearConstraint implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearConstraint.class);

    private final LinearExpression expression;
    private final CompareOp op;

    private LinearConstraint(LinearExpression expression, CompareOp op) {
        this.expression = Objects.requireNonNull(expression, "LinearConstraint-构造函数: expression 不能为 null").copy();
        this.op = Objects.requireNonNull(op, "LinearConstraint-构造函数: op 不能为 null");
        if (this.expression.isConcrete()) {
            logger.info("LinearConstraint-构造函数: 创建了一个不含变量的约束: {}", this);
        }
    }

    public static LinearConstraint of(LinearExpression expression, CompareOp op) {
        return new LinearConstraint(expression, op);
    }

    /**
     * 由 left ~ right 构造，规范化为 (left - right) ~ 0。
     */
    public static LinearConstraint of(LinearExpression left, CompareOp op, LinearExpression right) {
        return new LinearConstraint(left.copy().subtract(right), op);
    }

    public LinearConstraint negate() {
        return new LinearConstraint(expression, op.negate());
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<IntSort> lhs = expression.toZ3ArithExpr(ctx, varManager);
        ArithExpr<IntSort> zero = ctx.mkInt(0);
        return switch (op) {
            case EQ -> ctx.mkEq(lhs, zero);
            case NEQ -> ctx.mkNot(ctx.mkEq(lhs, zero));
            case GT, S_GT -> ctx.mkGt(lhs, zero);
            case LE, S_LE -> ctx.mkLe(lhs, zero);
            case LT, S_LT -> ctx.mkLt(lhs, zero);
            case GE, S_GE -> ctx.mkGe(lhs, zero);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraint that = (LinearConstraint) o;
        return op == that.op && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, op);
    }

    @Override
    public String toString() {
        return expression + " " + op.getSymbol() + " 0";
    }
}
