package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.executor.local.LocalSlidingWindowExecutor;
import cn.clazs.qguard.executor.redis.RedisSlidingWindowExecutor;
import cn.clazs.qguard.util.TimestampUtil;
import lombok.Getter;

/**
 * 滑动窗口限流器
 *
 * <p>记录每个已放行单位的时间戳，任意长度为 window 的区间内放行数不超过 maxRequests
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class SlidingWindowRateLimiter extends ExecutorBackedRateLimiter {

    private final int maxRequests;

    private final int windowSeconds;

    @Getter(lombok.AccessLevel.NONE)
    private final LimitRule rule;

    public SlidingWindowRateLimiter(String name, int maxRequests, int windowSeconds) {
        this(name, maxRequests, windowSeconds, RateLimiterConfig.defaults());
    }

    public SlidingWindowRateLimiter(String name, int maxRequests, int windowSeconds, RateLimiterConfig config) {
        super(name, config,
                new LocalSlidingWindowExecutor(config.getCacheExpireAfterAccessMinutes(), config.getCacheMaximumSize()),
                config.isDistributed()
                        ? new RedisSlidingWindowExecutor(config.getRedisTemplate(), config.getRedisKeyPrefix(), name)
                        : null);
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
        this.rule = LimitRule.window(maxRequests, TimestampUtil.secondsToMillis(windowSeconds));
    }

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW;
    }

    @Override
    protected LimitRule rule() {
        return rule;
    }

    @Override
    protected int getLimitValue() {
        return maxRequests;
    }

    /**
     * 以指定阈值执行一次判定（不检查黑白名单），供自适应限流器收紧阈值时使用
     */
    boolean tryAcquire(String scope, int weight, int ceiling) {
        LimitRule limited = rule.withLimit(ceiling);
        long now = now();
        return execute(executor -> executor.tryAcquire(scope, weight, limited, now));
    }

    /**
     * 以指定阈值查询剩余额度
     */
    int getRemaining(String scope, int ceiling) {
        LimitRule limited = rule.withLimit(ceiling);
        long now = now();
        return execute(executor -> executor.getRemaining(scope, limited, now));
    }

    /**
     * 按平均间隔估算（window / maxRequests）
     */
    @Override
    protected long suggestDelayMillis(String scope, int weight) {
        return Math.max(1L, rule.getWindowMillis() / maxRequests);
    }
}
