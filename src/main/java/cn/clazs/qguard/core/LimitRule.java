package cn.clazs.qguard.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 执行器单次调用的限流参数（不可变）
 *
 * <ul>
 *   <li>窗口类算法：limit = 窗口内最大请求数，windowMillis = 窗口长度</li>
 *   <li>桶类算法：limit = 桶容量，ratePerMillis = 每毫秒补充/泄漏量，windowMillis 仅用于存储过期时间</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LimitRule {

    private final int limit;

    private final long windowMillis;

    private final double ratePerMillis;

    private LimitRule(int limit, long windowMillis, double ratePerMillis) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be > 0, got: " + windowMillis);
        }
        if (ratePerMillis < 0 || Double.isNaN(ratePerMillis) || Double.isInfinite(ratePerMillis)) {
            throw new IllegalArgumentException("ratePerMillis must be a finite value >= 0, got: " + ratePerMillis);
        }
        this.limit = limit;
        this.windowMillis = windowMillis;
        this.ratePerMillis = ratePerMillis;
    }

    /**
     * 窗口类规则
     *
     * @param maxRequests 窗口内最大请求数
     * @param windowMillis 窗口长度（毫秒）
     */
    public static LimitRule window(int maxRequests, long windowMillis) {
        return new LimitRule(maxRequests, windowMillis, 0D);
    }

    /**
     * 桶类规则
     *
     * @param capacity 桶容量
     * @param ratePerSecond 每秒补充（令牌桶）或泄漏（漏桶）的量
     * @param ttlMillis 存储过期时间（毫秒）
     */
    public static LimitRule bucket(int capacity, double ratePerSecond, long ttlMillis) {
        if (!(ratePerSecond > 0)) {
            throw new IllegalArgumentException("ratePerSecond must be > 0, got: " + ratePerSecond);
        }
        return new LimitRule(capacity, ttlMillis, ratePerSecond / 1000D);
    }

    /**
     * 替换阈值，其余参数不变（自适应限流按 scope 收紧阈值时使用）
     */
    public LimitRule withLimit(int newLimit) {
        return newLimit == limit ? this : new LimitRule(newLimit, windowMillis, ratePerMillis);
    }
}
