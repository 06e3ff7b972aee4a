package org.concolic.serialization;

import lombok.Getter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * 从流中按固定字节序读取定长字段，并记录已消耗的字节数用于诊断。
 * 读到的字节不足时抛出 TRUNCATED。
 */
public final class WireReader {

    private final InputStream in;
    @Getter
    private final ByteOrder order;
    @Getter
    private long position;

    public WireReader(InputStream in, ByteOrder order) {
        this(in, order, 0);
    }

    /**
     * @param startPosition 流在交给此 reader 之前已被消耗的字节数，诊断位置从这里继续计数。
     */
    public WireReader(InputStream in, ByteOrder order, long startPosition) {
        this.in = Objects.requireNonNull(in, "in");
        this.order = Objects.requireNonNull(order, "order");
        this.position = startPosition;
    }

    public long readLong() throws DecodeException {
        return ByteBuffer.wrap(readBytes(Long.BYTES)).order(order).getLong();
    }

    public int readInt() throws DecodeException {
        return ByteBuffer.wrap(readBytes(Integer.BYTES)).order(order).getInt();
    }

    public int readUnsignedByte() throws DecodeException {
        return readBytes(1)[0] & 0xFF;
    }

    public byte[] readBytes(int n) throws DecodeException {
        byte[] bytes;
        try {
            bytes = in.readNBytes(n);
        } catch (IOException e) {
            throw new DecodeException(DecodeStatus.IO_ERROR, position, "读取流失败", e);
        }
        if (bytes.length < n) {
            long at = position;
            position += bytes.length;
            throw new DecodeException(DecodeStatus.TRUNCATED, at,
                    "需要 " + n + " 字节，只读到 " + bytes.length + " 字节");
        }
        position += n;
        return bytes;
    }
}
