package org.concolic.symbolic;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.concolic.core.CType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 负责管理符号变量编号到 Z3 常量的映射。
 * 位向量变量的宽度取自登记的 C 类型；未登记的变量按首次使用时的节点宽度创建。
 * 同一个编号在同一 Context 中只对应一个 Z3 常量。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final Map<Integer, CType> variableTypes;

    // 单线程使用，不需要并发容器
    private final Map<Integer, BitVecExpr> bitVecVars;
    private final Map<Integer, IntExpr> intVars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param variableTypes 变量编号到其 C 类型的映射。
     */
    public Z3VariableManager(Context ctx, Map<Integer, CType> variableTypes) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.variableTypes = Collections.unmodifiableMap(new HashMap<>(variableTypes));
        this.bitVecVars = new HashMap<>();
        this.intVars = new HashMap<>();

        // 预先创建所有已登记变量的位向量常量
        for (Map.Entry<Integer, CType> entry : this.variableTypes.entrySet()) {
            if (entry.getValue().isScalar()) {
                getZ3Var(entry.getKey(), entry.getValue().getByteSize());
            }
        }
        logger.debug("Z3VariableManager 初始化完成，管理 {} 个变量。", this.variableTypes.size());
    }

    public static String nameOf(int variable) {
        return "x" + Integer.toUnsignedString(variable);
    }

    public Optional<CType> typeOf(int variable) {
        return Optional.ofNullable(variableTypes.get(variable));
    }

    /**
     * 获取变量对应的位向量常量。已登记类型的变量忽略 byteSize 参数。
     * @param variable 变量编号。
     * @param byteSize 未登记时使用的字节宽度。
     */
    public BitVecExpr getZ3Var(int variable, int byteSize) {
        return bitVecVars.computeIfAbsent(variable, v -> {
            CType type = variableTypes.get(v);
            int width = type != null && type.isScalar() ? type.getByteSize() : byteSize;
            logger.debug("创建 Z3 位向量变量: {} ({} 位)", nameOf(v), 8 * width);
            return ctx.mkBVConst(nameOf(v), 8 * width);
        });
    }

    /**
     * 获取变量对应的整数常量，供线性约束使用。
     */
    public IntExpr getZ3IntVar(int variable) {
        return intVars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 整数变量: {}", nameOf(v));
            return ctx.mkIntConst(nameOf(v));
        });
    }

    public Map<Integer, BitVecExpr> getBitVecVars() {
        return Collections.unmodifiableMap(bitVecVars);
    }

    public Map<Integer, IntExpr> getIntVars() {
        return Collections.unmodifiableMap(intVars);
    }
}
