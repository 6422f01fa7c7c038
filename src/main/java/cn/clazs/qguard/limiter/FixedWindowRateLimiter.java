package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.executor.local.LocalFixedWindowExecutor;
import cn.clazs.qguard.executor.redis.RedisFixedWindowExecutor;
import cn.clazs.qguard.util.TimestampUtil;
import lombok.Getter;

import java.time.Instant;

/**
 * 固定窗口限流器
 *
 * <p>时间按窗口长度对齐分段，每段内最多放行 maxRequests 个单位；
 * 两个相邻窗口的交界处最多可能放行 2 × maxRequests
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class FixedWindowRateLimiter extends ExecutorBackedRateLimiter {

    private final int maxRequests;

    private final int windowSeconds;

    @Getter(lombok.AccessLevel.NONE)
    private final LimitRule rule;

    public FixedWindowRateLimiter(String name, int maxRequests, int windowSeconds) {
        this(name, maxRequests, windowSeconds, RateLimiterConfig.defaults());
    }

    public FixedWindowRateLimiter(String name, int maxRequests, int windowSeconds, RateLimiterConfig config) {
        super(name, config,
                new LocalFixedWindowExecutor(config.getCacheExpireAfterAccessMinutes(), config.getCacheMaximumSize()),
                config.isDistributed()
                        ? new RedisFixedWindowExecutor(config.getRedisTemplate(), config.getRedisKeyPrefix(), name)
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
        return RateLimitAlgorithm.FIXED_WINDOW;
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
     * 当前窗口结束（计数清零）的时间
     */
    public Instant getResetTime(String scope) {
        validateScope(scope);
        return TimestampUtil.toInstant(TimestampUtil.nextWindowBoundary(now(), rule.getWindowMillis()));
    }

    @Override
    protected long suggestDelayMillis(String scope, int weight) {
        long now = now();
        return TimestampUtil.nextWindowBoundary(now, rule.getWindowMillis()) - now;
    }
}
