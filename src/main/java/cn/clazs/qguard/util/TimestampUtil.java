package cn.clazs.qguard.util;

import java.time.Instant;

/**
 * 时间窗口计算工具类
 * 静态工具类，无需创建实例，线程安全
 */
public final class TimestampUtil {

    // 私有构造器防止实例化
    private TimestampUtil() {
        throw new AssertionError("工具类禁止实例化");
    }

    private static final long MILLISECONDS_IN_SECOND = 1000L;

    /**
     * 计算 nowMillis 所在窗口的起始时间：floor(now / window) * window
     *
     * @param nowMillis 当前时间戳（毫秒）
     * @param windowMillis 窗口长度（毫秒，必须 > 0）
     */
    public static long windowStart(long nowMillis, long windowMillis) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be > 0, got: " + windowMillis);
        }
        return nowMillis - Math.floorMod(nowMillis, windowMillis);
    }

    /**
     * 计算下一个窗口边界（当前窗口的结束时间）
     */
    public static long nextWindowBoundary(long nowMillis, long windowMillis) {
        return windowStart(nowMillis, windowMillis) + windowMillis;
    }

    /**
     * 秒转毫秒
     */
    public static long secondsToMillis(long seconds) {
        return Math.multiplyExact(seconds, MILLISECONDS_IN_SECOND);
    }

    /**
     * 毫秒时间戳转 Instant
     */
    public static Instant toInstant(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }
}
