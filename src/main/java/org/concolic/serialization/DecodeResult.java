package org.concolic.serialization;

import lombok.Getter;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * 解码结果：成功时携带值，失败时携带类别、出错的流位置和诊断信息。
 * @param <T> 解码得到的值类型。
 */
@Getter
public final class DecodeResult<T> {

    private final DecodeStatus status;
    private final T value;
    private final long position;
    private final String message;

    private DecodeResult(DecodeStatus status, T value, long position, String message) {
        this.status = status;
        this.value = value;
        this.position = position;
        this.message = message;
    }

    public static <T> DecodeResult<T> ok(T value, long position) {
        return new DecodeResult<>(DecodeStatus.OK, Objects.requireNonNull(value, "value"), position, null);
    }

    public static <T> DecodeResult<T> failure(DecodeException e) {
        return new DecodeResult<>(e.getStatus(), null, e.getPosition(), e.getMessage());
    }

    public boolean isOk() {
        return status == DecodeStatus.OK;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * @throws NoSuchElementException 如果解码失败。
     */
    public T orElseThrow() {
        if (!isOk()) {
            throw new NoSuchElementException("Decode failed with " + status + ": " + message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "DecodeResult{OK, " + value + "}" : "DecodeResult{" + status + ", " + message + "}";
    }
}
