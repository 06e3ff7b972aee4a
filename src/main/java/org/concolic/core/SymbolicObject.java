package org.concolic.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 被解引用的内存对象的描述：起始地址与字节大小。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class SymbolicObject implements Comparable<SymbolicObject> {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicObject.class);

    private final long start;
    private final int size;

    private SymbolicObject(long start, int size) {
        if (size < 0) {
            logger.error("SymbolicObject-构造函数: 对象大小 {} 不能为负", size);
            throw new IllegalArgumentException("Object size must be non-negative: " + size);
        }
        this.start = start;
        this.size = size;
        logger.debug("创建了一个 SymbolicObject: {}", this);
    }

    public static SymbolicObject of(long start, int size) {
        return new SymbolicObject(start, size);
    }

    /**
     * 拷贝构造。解引用节点持有描述的独立副本。
     */
    public static SymbolicObject copyOf(SymbolicObject other) {
        Objects.requireNonNull(other, "SymbolicObject-copyOf: other 不能为 null");
        return new SymbolicObject(other.start, other.size);
    }

    /**
     * 地址是否落在对象内部。
     */
    public boolean contains(long address) {
        return address >= start && address - start < size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicObject that = (SymbolicObject) o;
        return start == that.start && size == that.size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, size);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(start) + "[" + size + "]";
    }

    @Override
    public int compareTo(SymbolicObject other) {
        int cmp = Long.compareUnsigned(this.start, other.start);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(this.size, other.size);
    }
}
