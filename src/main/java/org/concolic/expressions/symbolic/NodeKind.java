package org.concolic.expressions.symbolic;

import java.util.Optional;

/**
 * 表达式节点的变体，其 tag 即序列化格式中紧跟公共前缀的单字节标签。
 */
public enum NodeKind {

    BASIC(0),
    COMPARE(1),
    BINARY(2),
    UNARY(3),
    DEREF(4),
    CONSTANT(5);

    private final int tag;

    NodeKind(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    public static Optional<NodeKind> fromTag(int tag) {
        for (NodeKind kind : values()) {
            if (kind.tag == tag) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
