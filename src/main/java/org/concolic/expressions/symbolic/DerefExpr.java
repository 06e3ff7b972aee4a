package org.concolic.expressions.symbolic;

import lombok.Getter;
import org.concolic.core.CType;
import org.concolic.core.SymbolicObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 内存读取节点：地址表达式、被读取对象的描述，以及构造时截取的对象字节快照。
 * 快照长度始终等于对象大小。
 */
public final class DerefExpr extends SymbolicExpr {

    private static final Logger logger = LoggerFactory.getLogger(DerefExpr.class);

    @Getter
    private final SymbolicExpr address;
    @Getter
    private final SymbolicObject object;
    private final byte[] bytes;

    /**
     * 接管 bytes 的所有权，调用方不得再修改该数组。
     */
    DerefExpr(SymbolicExpr address, SymbolicObject object, byte[] bytes, int byteSize, long value) {
        super(byteSize, value);
        this.address = Objects.requireNonNull(address, "DerefExpr-构造函数: address 不能为 null");
        this.object = Objects.requireNonNull(object, "DerefExpr-构造函数: object 不能为 null");
        Objects.requireNonNull(bytes, "DerefExpr-构造函数: bytes 不能为 null");
        if (bytes.length != object.getSize()) {
            logger.error("DerefExpr-构造函数: 快照长度 {} 与对象大小 {} 不一致", bytes.length, object.getSize());
            throw new IllegalArgumentException("Snapshot length " + bytes.length
                    + " does not match object size " + object.getSize());
        }
        this.bytes = bytes;
    }

    /**
     * 由反序列化使用：快照已从流中独立读出。
     */
    public static DerefExpr of(SymbolicExpr address, SymbolicObject object, byte[] bytes, int byteSize, long value) {
        return new DerefExpr(address, object, bytes.clone(), byteSize, value);
    }

    /**
     * @return 快照的副本。
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 读取快照中 index 处的单个字节，不拷贝数组。
     */
    public byte byteAt(int index) {
        return bytes[index];
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DEREF;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDeref(this);
    }

    @Override
    public DerefExpr deepCopy() {
        return new DerefExpr(address.deepCopy(), SymbolicObject.copyOf(object), bytes.clone(),
                getByteSize(), getValue());
    }

    @Override
    public boolean isConcrete() {
        return address.isConcrete();
    }

    @Override
    public void collectVariables(Set<Integer> vars) {
        address.collectVariables(vars);
    }

    @Override
    public boolean dependsOn(Map<Integer, CType> vars) {
        return address.dependsOn(vars);
    }

    @Override
    public void appendTo(StringBuilder sb) {
        sb.append("(*").append(object).append(' ');
        address.appendTo(sb);
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
        DerefExpr that = (DerefExpr) o;
        return getByteSize() == that.getByteSize()
                && getValue() == that.getValue()
                && object.equals(that.object)
                && Arrays.equals(bytes, that.bytes)
                && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.DEREF, address, object, Arrays.hashCode(bytes), getByteSize(), getValue());
    }
}
