package org.concolic.symbolic;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.core.ConcolicConfig;
import org.concolic.expressions.linear.LinearConstraint;
import org.concolic.expressions.symbolic.SymbolicExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 基于 Z3 的可满足性判定与求解。
 * 持有一个 Context，使用完毕后必须 close。
 * @author Ayalyt
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public enum OracleResult {
        SAT,
        UNSAT,
        UNKNOWN
    }

    private final Context context;
    private final Z3VariableManager varManager;
    private final BitBlaster bitBlaster;
    private final Map<Integer, CType> variableTypes;
    private final int timeoutMs;

    /**
     * @param variableTypes 符号变量编号到其 C 类型的映射。
     * @param config 引擎配置，决定字节序、常量宽度上限和超时。
     */
    public Z3Oracle(Map<Integer, CType> variableTypes, ConcolicConfig config) {
        this.context = new Context();
        this.variableTypes = Collections.unmodifiableMap(new HashMap<>(variableTypes));
        this.varManager = new Z3VariableManager(context, this.variableTypes);
        this.bitBlaster = new BitBlaster(context, varManager, config);
        this.timeoutMs = config.getSolverTimeoutMs();
        logger.info("Z3Oracle 初始化完成，{} 个变量，超时 {} ms", variableTypes.size(), timeoutMs);
    }

    /**
     * 判断路径条件 (所有约束的合取) 是否可满足。
     */
    public OracleResult check(List<? extends SymbolicExpr> constraints) {
        Solver solver = newSolver();
        for (SymbolicExpr constraint : constraints) {
            solver.add(bitBlaster.toBool(constraint));
        }
        return toResult(solver.check(), constraints);
    }

    /**
     * 求解路径条件。
     * @return 约束中出现的每个变量的取值；不可满足或未知时为空。
     */
    public Optional<Map<Integer, Long>> solve(List<? extends SymbolicExpr> constraints) {
        Solver solver = newSolver();
        Set<Integer> vars = new TreeSet<>();
        for (SymbolicExpr constraint : constraints) {
            constraint.collectVariables(vars);
            solver.add(bitBlaster.toBool(constraint));
        }
        if (toResult(solver.check(), constraints) != OracleResult.SAT) {
            return Optional.empty();
        }
        Model model = solver.getModel();
        Map<Integer, Long> solution = new TreeMap<>();
        for (Integer var : vars) {
            // CONCRETE 节点下的变量不会被转换，此时按机器字长补建，模型补全为任意值
            BitVecExpr z3Var = varManager.getZ3Var(var, Long.BYTES);
            BitVecNum evaluated = (BitVecNum) model.eval(z3Var, true);
            solution.put(var, toValue(var, evaluated));
        }
        logger.debug("求解结果: {}", solution);
        return Optional.of(solution);
    }

    /**
     * 增量求解：只求解与最后一个约束 (通常是被翻转的分支) 传递相关的约束，
     * 其余变量沿用旧解。
     * @param oldSolution 上一次执行所用的输入。
     * @param constraints 路径条件，最后一个元素为新加入的约束。
     * @return 合并后的新输入；相关约束不可满足时为空。
     */
    public Optional<Map<Integer, Long>> solveIncremental(Map<Integer, Long> oldSolution,
                                                         List<? extends SymbolicExpr> constraints) {
        if (constraints.isEmpty()) {
            return Optional.of(new TreeMap<>(oldSolution));
        }
        Set<Integer> dependent = new TreeSet<>();
        constraints.get(constraints.size() - 1).collectVariables(dependent);

        Set<SymbolicExpr> slice = new LinkedHashSet<>();
        slice.add(constraints.get(constraints.size() - 1));
        boolean changed = true;
        while (changed) {
            changed = false;
            Map<Integer, CType> dependentTypes = typesOf(dependent);
            for (SymbolicExpr constraint : constraints) {
                if (!slice.contains(constraint) && constraint.dependsOn(dependentTypes)) {
                    slice.add(constraint);
                    constraint.collectVariables(dependent);
                    changed = true;
                }
            }
        }
        logger.debug("增量求解: {} 个约束中有 {} 个相关，涉及变量 {}", constraints.size(), slice.size(), dependent);

        Optional<Map<Integer, Long>> partial = solve(new ArrayList<>(slice));
        if (partial.isEmpty()) {
            return Optional.empty();
        }
        Map<Integer, Long> merged = new TreeMap<>(oldSolution);
        merged.putAll(partial.get());
        return Optional.of(merged);
    }

    /**
     * 判断线性约束的合取在整数域上是否可满足。
     */
    public OracleResult checkLinear(List<LinearConstraint> constraints) {
        Solver solver = newSolver();
        for (LinearConstraint constraint : constraints) {
            solver.add(constraint.toZ3BoolExpr(context, varManager));
        }
        return toResult(solver.check(), constraints);
    }

    /**
     * 在整数域上求解线性约束。
     */
    public Optional<Map<Integer, Long>> solveLinear(List<LinearConstraint> constraints) {
        Solver solver = newSolver();
        Set<Integer> vars = new TreeSet<>();
        for (LinearConstraint constraint : constraints) {
            constraint.getExpression().collectVariables(vars);
            solver.add(constraint.toZ3BoolExpr(context, varManager));
        }
        if (toResult(solver.check(), constraints) != OracleResult.SAT) {
            return Optional.empty();
        }
        Model model = solver.getModel();
        Map<Integer, Long> solution = new TreeMap<>();
        for (Integer var : vars) {
            IntExpr z3Var = varManager.getZ3IntVar(var);
            IntNum num = (IntNum) model.eval(z3Var, true);
            solution.put(var, num.getBigInteger().longValue());
        }
        return Optional.of(solution);
    }

    private Solver newSolver() {
        Solver solver = context.mkSolver();
        Params params = context.mkParams();
        params.add("timeout", timeoutMs);
        solver.setParameters(params);
        return solver;
    }

    private OracleResult toResult(Status status, List<?> constraints) {
        if (status == Status.SATISFIABLE) {
            return OracleResult.SAT;
        }
        if (status == Status.UNSATISFIABLE) {
            return OracleResult.UNSAT;
        }
        logger.warn("Z3 对 {} 个约束返回 UNKNOWN", constraints.size());
        return OracleResult.UNKNOWN;
    }

    private Map<Integer, CType> typesOf(Set<Integer> vars) {
        Map<Integer, CType> types = new HashMap<>();
        for (Integer var : vars) {
            types.put(var, varManager.typeOf(var).orElse(CType.LONG_LONG));
        }
        return types;
    }

    /**
     * 模型中的位模式按变量类型解释：有符号类型做符号扩展。
     */
    private long toValue(int var, BitVecNum num) {
        long raw = num.getBigInteger().longValue();
        int bits = num.getSortSize();
        CType type = variableTypes.get(var);
        if (type != null && type.isSigned() && bits < Long.SIZE) {
            return (raw << (Long.SIZE - bits)) >> (Long.SIZE - bits);
        }
        return raw;
    }

    @Override
    public void close() {
        context.close();
        logger.info("Z3Oracle 已关闭");
    }
}
