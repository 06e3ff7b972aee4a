package org.concolic.serialization;

import lombok.Getter;

/**
 * 递归解码过程中的失败。只在编解码器内部传播，
 * 对外统一转换为 {@link DecodeResult}。
 */
@Getter
public class DecodeException extends Exception {

    private final DecodeStatus status;
    private final long position;

    public DecodeException(DecodeStatus status, long position, String message) {
        super(message + " (位置 " + position + ")");
        this.status = status;
        this.position = position;
    }

    public DecodeException(DecodeStatus status, long position, String message, Throwable cause) {
        super(message + " (位置 " + position + ")", cause);
        this.status = status;
        this.position = position;
    }
}
