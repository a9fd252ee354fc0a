package com.work.bundler.core.support;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一地址 / hex / 数值的格式检查。
 */
public final class ValidationUtils {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /**
     * 0x 开头的偶数长度 hex，"0x" 表示空字节串。
     */
    private static final Pattern BYTES_PATTERN = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private static final Pattern HASH_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    public static BigInteger requireNonNegative(BigInteger value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验 20 字节地址格式，返回小写形式（地址比较一律不区分大小写）。
     */
    public static String requireAddress(String value, String paramName) {
        requireNonEmpty(value, paramName);
        if (!ADDRESS_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法地址: " + value);
        }
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * 校验字节串 hex 格式；null 或空串视为 "0x"。
     */
    public static String requireBytes(String value, String paramName) {
        if (value == null || value.isEmpty()) {
            return "0x";
        }
        if (!BYTES_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法的 hex 字节串");
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public static boolean isHash(String value) {
        return value != null && HASH_PATTERN.matcher(value).matches();
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
