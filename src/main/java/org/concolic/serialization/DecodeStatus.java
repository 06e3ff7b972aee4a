package org.concolic.serialization;

/**
 * 反序列化的结果类别。
 */
public enum DecodeStatus {
    OK,
    /** 流提前结束，读到的字节少于所需。 */
    TRUNCATED,
    /** 无法识别的节点标签，属于协议错误。 */
    UNKNOWN_TAG,
    /** 无法识别的运算符编码。 */
    UNKNOWN_OPERATOR,
    /** 字段值非法，例如字节宽度为 0 或超过限制。 */
    MALFORMED,
    /** 底层流读取失败。 */
    IO_ERROR
}
