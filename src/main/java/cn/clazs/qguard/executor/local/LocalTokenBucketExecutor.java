package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimitRule;

/**
 * 本地令牌桶执行器
 *
 * <p>每个 scope 一个桶，初始装满（rule.limit 个令牌），按 rule.ratePerMillis 连续补充，上限为桶容量
 *
 * @author clazs
 * @since 1.0.0
 */
public class LocalTokenBucketExecutor extends AbstractLocalExecutor<LocalTokenBucketExecutor.Bucket> {

    static final class Bucket {
        /** 当前令牌数，范围 [0, capacity] */
        double tokens;

        /** 上次补充时间戳 */
        long lastUpdate;

        Bucket(double tokens, long lastUpdate) {
            this.tokens = tokens;
            this.lastUpdate = lastUpdate;
        }
    }

    public LocalTokenBucketExecutor() {
        this(DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    public LocalTokenBucketExecutor(long expireAfterAccessMinutes, long maximumSize) {
        super(expireAfterAccessMinutes, maximumSize);
    }

    @Override
    public boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis) {
        return locked(() -> {
            Bucket bucket = stateCache.get(key, k -> new Bucket(rule.getLimit(), nowMillis));
            refill(bucket, rule, nowMillis);

            if (bucket.tokens >= permits) {
                bucket.tokens -= permits;
                return true;
            }
            return false;
        });
    }

    @Override
    public int getRemaining(String key, LimitRule rule, long nowMillis) {
        return locked(() -> {
            Bucket bucket = stateCache.getIfPresent(key);
            if (bucket == null) {
                return rule.getLimit();
            }
            return clampRemaining(currentTokens(bucket, rule, nowMillis), rule.getLimit());
        });
    }

    private static void refill(Bucket bucket, LimitRule rule, long nowMillis) {
        bucket.tokens = currentTokens(bucket, rule, nowMillis);
        bucket.lastUpdate = Math.max(bucket.lastUpdate, nowMillis);
    }

    private static double currentTokens(Bucket bucket, LimitRule rule, long nowMillis) {
        long elapsed = Math.max(0L, nowMillis - bucket.lastUpdate);
        return Math.min(rule.getLimit(), bucket.tokens + elapsed * rule.getRatePerMillis());
    }
}
