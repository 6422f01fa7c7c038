package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimitRule;

/**
 * 本地漏桶执行器
 *
 * <p>每个 scope 一个桶，初始为空；水位按 rule.ratePerMillis 恒定泄漏（不低于 0），
 * 只有 level + permits <= capacity 时才放行并抬高水位
 *
 * @author clazs
 * @since 1.0.0
 */
public class LocalLeakyBucketExecutor extends AbstractLocalExecutor<LocalLeakyBucketExecutor.Bucket> {

    static final class Bucket {
        /** 当前水位，范围 [0, capacity] */
        double level;

        /** 上次泄漏时间戳 */
        long lastLeak;

        Bucket(long lastLeak) {
            this.lastLeak = lastLeak;
        }
    }

    public LocalLeakyBucketExecutor() {
        this(DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    public LocalLeakyBucketExecutor(long expireAfterAccessMinutes, long maximumSize) {
        super(expireAfterAccessMinutes, maximumSize);
    }

    @Override
    public boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis) {
        return locked(() -> {
            Bucket bucket = stateCache.get(key, k -> new Bucket(nowMillis));
            bucket.level = currentLevel(bucket, rule, nowMillis);
            bucket.lastLeak = Math.max(bucket.lastLeak, nowMillis);

            if (bucket.level + permits <= rule.getLimit()) {
                bucket.level += permits;
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
            return clampRemaining(rule.getLimit() - currentLevel(bucket, rule, nowMillis), rule.getLimit());
        });
    }

    /**
     * 查询当前水位（不修改状态）
     *
     * @return 水位；scope 不存在时返回 0
     */
    public double getLevel(String key, LimitRule rule, long nowMillis) {
        return locked(() -> {
            Bucket bucket = stateCache.getIfPresent(key);
            return bucket == null ? 0D : currentLevel(bucket, rule, nowMillis);
        });
    }

    private static double currentLevel(Bucket bucket, LimitRule rule, long nowMillis) {
        long elapsed = Math.max(0L, nowMillis - bucket.lastLeak);
        return Math.max(0D, bucket.level - elapsed * rule.getRatePerMillis());
    }
}
