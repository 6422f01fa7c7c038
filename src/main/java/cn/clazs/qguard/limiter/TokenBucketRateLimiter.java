package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.executor.local.LocalTokenBucketExecutor;
import cn.clazs.qguard.executor.redis.RedisTokenBucketExecutor;
import lombok.Getter;

/**
 * 令牌桶限流器
 *
 * <p>桶初始装满 burstSize 个令牌，按 tokensPerSecond 连续补充；
 * 请求扣减 weight 个令牌，令牌不足时拒绝且不扣减
 *
 * <p>使用示例：
 * <pre>
 * // 每分钟 60 个请求，允许突发 10 个
 * TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("api", 60, 10);
 * if (limiter.acquire("user:123")) {
 *     // 业务代码
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class TokenBucketRateLimiter extends ExecutorBackedRateLimiter {

    private final double tokensPerSecond;

    private final int burstSize;

    @Getter(lombok.AccessLevel.NONE)
    private final LimitRule rule;

    /**
     * @param requestsPerMinute 每分钟补充的令牌数，突发容量默认为其 2 倍
     */
    public TokenBucketRateLimiter(String name, int requestsPerMinute) {
        this(name, requestsPerMinute, null);
    }

    /**
     * @param requestsPerMinute 每分钟补充的令牌数
     * @param burstSize 桶容量，null 表示 2 × requestsPerMinute
     */
    public TokenBucketRateLimiter(String name, int requestsPerMinute, Integer burstSize) {
        this(name, requestsPerMinute, burstSize, RateLimiterConfig.defaults());
    }

    public TokenBucketRateLimiter(String name, int requestsPerMinute, Integer burstSize, RateLimiterConfig config) {
        this(config, name, requirePositive(requestsPerMinute) / 60D,
                burstSize != null ? burstSize : 2 * requestsPerMinute);
    }

    private TokenBucketRateLimiter(RateLimiterConfig config, String name, double tokensPerSecond, int burstSize) {
        super(name, config,
                new LocalTokenBucketExecutor(config.getCacheExpireAfterAccessMinutes(), config.getCacheMaximumSize()),
                config.isDistributed()
                        ? new RedisTokenBucketExecutor(config.getRedisTemplate(), config.getRedisKeyPrefix(), name)
                        : null);
        this.tokensPerSecond = tokensPerSecond;
        this.burstSize = burstSize;
        this.rule = bucketRule(burstSize, tokensPerSecond);
    }

    /**
     * 按每秒速率创建（支持小数速率，如 5000 / 3600）
     *
     * @param tokensPerSecond 每秒补充的令牌数（> 0）
     * @param burstSize 桶容量（> 0）
     */
    public static TokenBucketRateLimiter ofRate(String name, double tokensPerSecond, int burstSize,
                                                RateLimiterConfig config) {
        if (!(tokensPerSecond > 0) || Double.isInfinite(tokensPerSecond)) {
            throw new IllegalArgumentException("tokensPerSecond must be > 0, got: " + tokensPerSecond);
        }
        return new TokenBucketRateLimiter(config, name, tokensPerSecond, burstSize);
    }

    private static int requirePositive(int requestsPerMinute) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0, got: " + requestsPerMinute);
        }
        return requestsPerMinute;
    }

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.TOKEN_BUCKET;
    }

    @Override
    protected LimitRule rule() {
        return rule;
    }

    @Override
    protected int getLimitValue() {
        return burstSize;
    }

    /**
     * 缺少的令牌数 / 补充速率
     */
    @Override
    protected long suggestDelayMillis(String scope, int weight) {
        int deficit = weight - getRemaining(scope);
        if (deficit <= 0) {
            return 1L;
        }
        return (long) Math.ceil(deficit / rule.getRatePerMillis());
    }
}
