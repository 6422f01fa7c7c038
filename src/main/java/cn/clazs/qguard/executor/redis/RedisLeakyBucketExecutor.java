package cn.clazs.qguard.executor.redis;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 漏桶执行器
 *
 * <p>Hash 结构 {level, last}；读取、泄漏、检查、写入在同一个 Lua 脚本中完成，并设置 TTL
 *
 * @author clazs
 * @since 1.0.0
 */
public class RedisLeakyBucketExecutor extends AbstractRedisExecutor {

    private static final String SCRIPT_PATH = "redis/leaky_bucket.lua";

    public RedisLeakyBucketExecutor(StringRedisTemplate redisTemplate, String keyPrefix, String limiterName) {
        super(redisTemplate, keyPrefix, limiterName, RateLimitAlgorithm.LEAKY_BUCKET, SCRIPT_PATH);
    }

    @Override
    protected ScriptResult evaluate(String key, int permits, LimitRule rule, long nowMillis) {
        return execute(buildRedisKey(key),
                rule.getLimit(),           // ARGV[1]: 桶容量
                rule.getRatePerMillis(),   // ARGV[2]: 每毫秒泄漏量
                nowMillis,                 // ARGV[3]: 当前时间戳
                permits,                   // ARGV[4]: 本次权重
                bucketTtlMillis(rule));    // ARGV[5]: 过期时间
    }
}
