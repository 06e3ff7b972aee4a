package org.concolic.core;

import lombok.Getter;

import java.nio.ByteOrder;
import java.util.Optional;

/**
 * 目标程序的字节序。决定字节提取/拼接的约定以及序列化时多字节字段的写入顺序。
 */
@Getter
public enum Endianness {

    LITTLE('L', ByteOrder.LITTLE_ENDIAN),
    BIG('B', ByteOrder.BIG_ENDIAN);

    /**
     * 帧头中表示字节序的标记字节。
     */
    private final byte marker;
    private final ByteOrder byteOrder;

    Endianness(char marker, ByteOrder byteOrder) {
        this.marker = (byte) marker;
        this.byteOrder = byteOrder;
    }

    public static Optional<Endianness> fromMarker(int marker) {
        for (Endianness e : values()) {
            if (e.marker == marker) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }
}
