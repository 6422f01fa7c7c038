package cn.clazs.qguard.executor.redis;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 令牌桶执行器
 *
 * <p>Hash 结构 {tokens, last}，补充与扣减在 Lua 脚本中原子完成
 *
 * @author clazs
 * @since 1.0.0
 */
public class RedisTokenBucketExecutor extends AbstractRedisExecutor {

    private static final String SCRIPT_PATH = "redis/token_bucket.lua";

    public RedisTokenBucketExecutor(StringRedisTemplate redisTemplate, String keyPrefix, String limiterName) {
        super(redisTemplate, keyPrefix, limiterName, RateLimitAlgorithm.TOKEN_BUCKET, SCRIPT_PATH);
    }

    @Override
    protected ScriptResult evaluate(String key, int permits, LimitRule rule, long nowMillis) {
        return execute(buildRedisKey(key),
                rule.getLimit(),
                rule.getRatePerMillis(),
                nowMillis,
                permits,
                bucketTtlMillis(rule));
    }
}
