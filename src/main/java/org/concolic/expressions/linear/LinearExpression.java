package org.concolic.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import org.concolic.core.CType;
import org.concolic.expressions.ToZ3ArithExpr;
import org.concolic.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 仿射表达式 c + a1*x1 + a2*x2 + ...，变量以编号表示。
 * 与表达式树不同，此类在化简约束时原地修改，每个算术方法都返回 this 以便链式调用。
 * 任何运算之后，系数为零的变量都不会保留在映射中。
 */
public final class LinearExpression implements ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    private long constant;

    // 有序存储，保证输出和序列化顺序稳定
    private final SortedMap<Integer, Long> coefficients;

    private LinearExpression(long constant, Map<Integer, Long> coefficients) {
        this.constant = constant;
        this.coefficients = new TreeMap<>();
        coefficients.forEach((var, coeff) -> {
            Objects.requireNonNull(var, "Variable in coefficients map cannot be null");
            Objects.requireNonNull(coeff, "Coefficient cannot be null");
            if (coeff != 0) {
                this.coefficients.put(var, coeff);
            }
        });
    }

    /**
     * 常数 0。
     */
    public static LinearExpression zero() {
        return new LinearExpression(0, Collections.emptyMap());
    }

    /**
     * 只包含常数项的表达式。
     */
    public static LinearExpression of(long constant) {
        return new LinearExpression(constant, Collections.emptyMap());
    }

    /**
     * 单项 coefficient * variable。
     */
    public static LinearExpression of(long coefficient, int variable) {
        return new LinearExpression(0, Map.of(variable, coefficient));
    }

    /**
     * 由常数项和系数映射构造，零系数被过滤。
     */
    public static LinearExpression of(long constant, Map<Integer, Long> coefficients) {
        return new LinearExpression(constant, Objects.requireNonNull(coefficients, "Coefficients map cannot be null"));
    }

    /**
     * 拷贝构造。
     */
    public LinearExpression copy() {
        return new LinearExpression(constant, coefficients);
    }

    public long getConstant() {
        return constant;
    }

    /**
     * @return 系数映射的只读视图。
     */
    public SortedMap<Integer, Long> getCoefficients() {
        return Collections.unmodifiableSortedMap(coefficients);
    }

    public long getCoefficient(int variable) {
        return coefficients.getOrDefault(variable, 0L);
    }

    /**
     * 取反：常数项和所有系数变号。
     */
    public LinearExpression negate() {
        constant = -constant;
        coefficients.replaceAll((var, coeff) -> -coeff);
        return this;
    }

    public LinearExpression add(LinearExpression other) {
        other.coefficients.forEach((var, coeff) -> coefficients.merge(var, coeff, Long::sum));
        constant += other.constant;
        dropZeros();
        logger.debug("加上 {} 之后得到 {}", other, this);
        return this;
    }

    public LinearExpression subtract(LinearExpression other) {
        other.coefficients.forEach((var, coeff) -> coefficients.merge(var, -coeff, Long::sum));
        constant -= other.constant;
        dropZeros();
        logger.debug("减去 {} 之后得到 {}", other, this);
        return this;
    }

    /**
     * 加上标量，只影响常数项。
     */
    public LinearExpression add(long c) {
        constant += c;
        return this;
    }

    public LinearExpression subtract(long c) {
        constant -= c;
        return this;
    }

    /**
     * 乘以标量。乘以 0 会清空所有项。
     */
    public LinearExpression multiply(long c) {
        if (c == 0) {
            coefficients.clear();
            constant = 0;
            return this;
        }
        constant *= c;
        coefficients.replaceAll((var, coeff) -> coeff * c);
        dropZeros(); // 溢出回绕可能产生零
        return this;
    }

    public boolean isConcrete() {
        return coefficients.isEmpty();
    }

    /**
     * 项数：常数项加上非零系数的个数。
     */
    public int size() {
        return 1 + coefficients.size();
    }

    public void collectVariables(Set<Integer> vars) {
        vars.addAll(coefficients.keySet());
    }

    public boolean dependsOn(Map<Integer, CType> vars) {
        for (Integer var : coefficients.keySet()) {
            if (vars.containsKey(var)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 根据变量赋值计算具体值。
     * @throws IllegalArgumentException 如果某个变量没有赋值。
     */
    public long evaluate(Map<Integer, Long> assignment) {
        long result = constant;
        for (Map.Entry<Integer, Long> entry : coefficients.entrySet()) {
            Long value = assignment.get(entry.getKey());
            if (value == null) {
                logger.error("evaluate: 变量 x{} 没有赋值", entry.getKey());
                throw new IllegalArgumentException("No value for variable x" + entry.getKey());
            }
            result += entry.getValue() * value;
        }
        return result;
    }

    private void dropZeros() {
        Iterator<Map.Entry<Integer, Long>> it = coefficients.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() == 0) {
                it.remove();
            }
        }
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<IntSort> result = ctx.mkInt(constant);
        for (Map.Entry<Integer, Long> entry : coefficients.entrySet()) {
            ArithExpr<IntSort> var = varManager.getZ3IntVar(entry.getKey());
            result = ctx.mkAdd(result, ctx.mkMul(ctx.mkInt(entry.getValue()), var));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;
        for (Map.Entry<Integer, Long> entry : coefficients.entrySet()) {
            long coeff = entry.getValue();
            if (!firstTerm) {
                sb.append(coeff < 0 ? " - " : " + ");
                coeff = Math.abs(coeff);
            }
            sb.append(coeff).append("*x").append(entry.getKey());
            firstTerm = false;
        }
        if (firstTerm) {
            return Long.toString(constant);
        }
        if (constant != 0) {
            sb.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return constant == that.constant && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constant, coefficients);
    }
}
