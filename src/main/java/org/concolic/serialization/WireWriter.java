package org.concolic.serialization;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * 按固定字节序追加定长字段的缓冲区。字段之间没有填充。
 */
public final class WireWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteBuffer scratch;

    public WireWriter(ByteOrder order) {
        this.scratch = ByteBuffer.allocate(Long.BYTES).order(Objects.requireNonNull(order, "order"));
    }

    public WireWriter writeLong(long v) {
        scratch.clear();
        scratch.putLong(v);
        out.write(scratch.array(), 0, Long.BYTES);
        return this;
    }

    public WireWriter writeInt(int v) {
        scratch.clear();
        scratch.putInt(v);
        out.write(scratch.array(), 0, Integer.BYTES);
        return this;
    }

    public WireWriter writeByte(int v) {
        out.write(v);
        return this;
    }

    public WireWriter writeBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public int size() {
        return out.size();
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
