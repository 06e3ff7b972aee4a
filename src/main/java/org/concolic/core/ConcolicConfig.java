package org.concolic.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * 表达式引擎的配置。
 * 默认值可被类路径上的 concolic.properties 覆盖，同名的 JVM 系统属性优先级最高。
 * 此类是不可变的。
 */
@Getter
public final class ConcolicConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConcolicConfig.class);

    public static final String RESOURCE_NAME = "concolic.properties";

    public static final String KEY_ENDIANNESS = "concolic.endianness";
    public static final String KEY_MAX_CONSTANT_BYTES = "concolic.bitblast.maxConstantBytes";
    public static final String KEY_MAX_DEPTH = "concolic.codec.maxDepth";
    public static final String KEY_MAX_OBJECT_BYTES = "concolic.codec.maxObjectBytes";
    public static final String KEY_SOLVER_TIMEOUT = "concolic.solver.timeoutMs";

    private static final ConcolicConfig DEFAULTS =
            new ConcolicConfig(Endianness.LITTLE, Long.BYTES, 4096, 1 << 20, 10_000);

    private final Endianness endianness;
    // 原生机器字长 (字节)，更宽的常量无法直接转换为位向量
    private final int maxConstantBytes;
    private final int maxDecodeDepth;
    private final int maxObjectBytes;
    private final int solverTimeoutMs;

    private ConcolicConfig(Endianness endianness, int maxConstantBytes, int maxDecodeDepth,
                           int maxObjectBytes, int solverTimeoutMs) {
        this.endianness = Objects.requireNonNull(endianness, "Endianness cannot be null");
        if (maxConstantBytes <= 0 || maxDecodeDepth <= 0 || maxObjectBytes < 0 || solverTimeoutMs <= 0) {
            throw new IllegalArgumentException("ConcolicConfig: 非法的配置值 maxConstantBytes=" + maxConstantBytes
                    + ", maxDecodeDepth=" + maxDecodeDepth + ", maxObjectBytes=" + maxObjectBytes
                    + ", solverTimeoutMs=" + solverTimeoutMs);
        }
        this.maxConstantBytes = maxConstantBytes;
        this.maxDecodeDepth = maxDecodeDepth;
        this.maxObjectBytes = maxObjectBytes;
        this.solverTimeoutMs = solverTimeoutMs;
    }

    public static ConcolicConfig defaults() {
        return DEFAULTS;
    }

    /**
     * 从类路径资源和系统属性加载配置。资源不存在时使用默认值。
     */
    public static ConcolicConfig load() {
        Properties props = new Properties();
        try (InputStream in = ConcolicConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
                logger.debug("已加载配置资源 {}", RESOURCE_NAME);
            } else {
                logger.info("未找到配置资源 {}，使用默认配置", RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warn("读取配置资源 {} 失败，使用默认配置", RESOURCE_NAME, e);
        }
        return fromProperties(props);
    }

    /**
     * 从给定的属性集合构造配置。缺失的键使用默认值，系统属性覆盖同名键。
     */
    public static ConcolicConfig fromProperties(Properties props) {
        Endianness endianness = Endianness.valueOf(
                lookup(props, KEY_ENDIANNESS, DEFAULTS.endianness.name()).trim().toUpperCase(Locale.ROOT));
        ConcolicConfig config = new ConcolicConfig(
                endianness,
                parseInt(props, KEY_MAX_CONSTANT_BYTES, DEFAULTS.maxConstantBytes),
                parseInt(props, KEY_MAX_DEPTH, DEFAULTS.maxDecodeDepth),
                parseInt(props, KEY_MAX_OBJECT_BYTES, DEFAULTS.maxObjectBytes),
                parseInt(props, KEY_SOLVER_TIMEOUT, DEFAULTS.solverTimeoutMs));
        logger.info("表达式引擎配置: {}", config);
        return config;
    }

    public ConcolicConfig withEndianness(Endianness newEndianness) {
        return new ConcolicConfig(newEndianness, maxConstantBytes, maxDecodeDepth, maxObjectBytes, solverTimeoutMs);
    }

    public ConcolicConfig withMaxDecodeDepth(int newMaxDecodeDepth) {
        return new ConcolicConfig(endianness, maxConstantBytes, newMaxDecodeDepth, maxObjectBytes, solverTimeoutMs);
    }

    private static String lookup(Properties props, String key, String fallback) {
        return System.getProperty(key, props.getProperty(key, fallback));
    }

    private static int parseInt(Properties props, String key, int fallback) {
        String raw = lookup(props, key, Integer.toString(fallback));
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.error("配置项 {} 的值 '{}' 不是整数", key, raw);
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "ConcolicConfig{endianness=" + endianness
                + ", maxConstantBytes=" + maxConstantBytes
                + ", maxDecodeDepth=" + maxDecodeDepth
                + ", maxObjectBytes=" + maxObjectBytes
                + ", solverTimeoutMs=" + solverTimeoutMs + "}";
    }
}
