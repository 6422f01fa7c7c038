package cn.clazs.qguard.executor.redis;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis 滑动窗口执行器
 *
 * <p>使用 Redis ZSet 数据结构实现滑动窗口日志算法
 * <p>Score = 时间戳，Member = 唯一ID:序号（解决ZSet Member唯一性）
 * <p>使用 Lua 脚本保证原子性操作
 *
 * @author clazs
 * @since 1.0.0
 */
public class RedisSlidingWindowExecutor extends AbstractRedisExecutor {

    private static final String SCRIPT_PATH = "redis/sliding_window.lua";

    public RedisSlidingWindowExecutor(StringRedisTemplate redisTemplate, String keyPrefix, String limiterName) {
        super(redisTemplate, keyPrefix, limiterName, RateLimitAlgorithm.SLIDING_WINDOW, SCRIPT_PATH);
    }

    @Override
    protected ScriptResult evaluate(String key, int permits, LimitRule rule, long nowMillis) {
        // 过期时间至少为 window + 60秒，确保窗口外数据能被清理
        long ttlMillis = rule.getWindowMillis() + 60_000L;

        // 生成唯一标识（解决同一毫秒并发问题）
        String uniqueId = Long.toString(ThreadLocalRandom.current().nextLong());

        return execute(buildRedisKey(key),
                nowMillis,                 // ARGV[1]: 当前时间戳（Score）
                rule.getWindowMillis(),    // ARGV[2]: 窗口长度
                rule.getLimit(),           // ARGV[3]: 频率限制
                permits,                   // ARGV[4]: 本次权重
                ttlMillis,                 // ARGV[5]: 过期时间
                uniqueId);                 // ARGV[6]: 唯一标识
    }
}
