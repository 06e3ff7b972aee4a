package org.concolic.core;

/**
 * 插桩运行时提供的内存读取能力。
 * 解引用节点在构造时通过它获取被读取对象的具体字节快照。
 */
@FunctionalInterface
public interface MemoryReader {

    /**
     * 读取从 address 开始的 length 个字节。
     * @param address 目标程序中的地址。
     * @param length 字节数。
     * @return 新分配的字节数组，调用方拥有其所有权。
     */
    byte[] read(long address, int length);
}
