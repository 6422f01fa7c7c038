package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.executor.local.LocalLeakyBucketExecutor;
import cn.clazs.qguard.executor.redis.RedisLeakyBucketExecutor;
import lombok.Getter;

import java.time.Duration;

/**
 * 漏桶限流器
 *
 * <p>桶初始为空，水位以 leakRate（单位/秒）恒定下降；
 * 请求使水位上升 weight，水位将超过 capacity 时拒绝
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class LeakyBucketRateLimiter extends ExecutorBackedRateLimiter {

    private final double leakRate;

    private final int capacity;

    @Getter(lombok.AccessLevel.NONE)
    private final LimitRule rule;

    public LeakyBucketRateLimiter(String name, double leakRate, int capacity) {
        this(name, leakRate, capacity, RateLimiterConfig.defaults());
    }

    /**
     * @param leakRate 每秒泄漏量（> 0）
     * @param capacity 桶容量（> 0）
     */
    public LeakyBucketRateLimiter(String name, double leakRate, int capacity, RateLimiterConfig config) {
        super(name, config,
                new LocalLeakyBucketExecutor(config.getCacheExpireAfterAccessMinutes(), config.getCacheMaximumSize()),
                config.isDistributed()
                        ? new RedisLeakyBucketExecutor(config.getRedisTemplate(), config.getRedisKeyPrefix(), name)
                        : null);
        this.leakRate = leakRate;
        this.capacity = capacity;
        this.rule = bucketRule(capacity, leakRate);
    }

    /**
     * 按"每个窗口处理多少请求"创建：leakRate = requestsPerWindow / windowSeconds
     */
    public static LeakyBucketRateLimiter perWindow(String name, int requestsPerWindow, int windowSeconds, int capacity,
                                                   RateLimiterConfig config) {
        if (requestsPerWindow <= 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException("requestsPerWindow and windowSeconds must be > 0");
        }
        return new LeakyBucketRateLimiter(name, (double) requestsPerWindow / windowSeconds, capacity, config);
    }

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.LEAKY_BUCKET;
    }

    @Override
    protected LimitRule rule() {
        return rule;
    }

    @Override
    protected int getLimitValue() {
        return capacity;
    }

    /**
     * 估算要等多久桶里才能再容纳 weight 个单位
     *
     * @return 等待时间；已可容纳时为 {@link Duration#ZERO}；weight 超过容量（永远无法容纳）时返回 null
     */
    public Duration getTimeUntilAvailable(String scope, int weight) {
        validate(scope, weight);
        if (weight > capacity) {
            return null;
        }
        int free = getRemaining(scope);
        if (free >= weight) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) Math.ceil((weight - free) / rule.getRatePerMillis()));
    }

    @Override
    protected long suggestDelayMillis(String scope, int weight) {
        Duration wait = getTimeUntilAvailable(scope, weight);
        return wait == null ? MAX_BACKOFF_MILLIS : wait.toMillis();
    }
}
