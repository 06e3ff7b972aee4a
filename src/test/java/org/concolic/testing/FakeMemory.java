package org.concolic.testing;

import org.concolic.core.MemoryReader;

import java.util.Arrays;

/**
 * 测试用的内存：一段从 base 开始的连续字节。
 */
public final class FakeMemory implements MemoryReader {

    private final long base;
    private final byte[] contents;

    public FakeMemory(long base, byte... contents) {
        this.base = base;
        this.contents = contents.clone();
    }

    @Override
    public byte[] read(long address, int length) {
        int from = (int) (address - base);
        if (from < 0 || from + length > contents.length) {
            throw new IndexOutOfBoundsException("Address " + address + " outside fake memory");
        }
        return Arrays.copyOfRange(contents, from, from + length);
    }
}
