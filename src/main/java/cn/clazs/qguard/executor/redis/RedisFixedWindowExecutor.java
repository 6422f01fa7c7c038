package cn.clazs.qguard.executor.redis;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.util.TimestampUtil;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 固定窗口执行器
 *
 * <p>每个 scope 一个 Hash {@code {namespace}{scope}}，字段 start 记录窗口起始时间，count 记录已用额度；
 * 窗口切换时由脚本覆盖旧值，过期时间 = 窗口长度 + 1 秒。重置即删除该键，不影响其他 scope
 * <p>检查与累加在同一个 Lua 脚本中完成，超限时不会先加后减
 *
 * @author clazs
 * @since 1.0.0
 */
public class RedisFixedWindowExecutor extends AbstractRedisExecutor {

    private static final String SCRIPT_PATH = "redis/fixed_window.lua";

    public RedisFixedWindowExecutor(StringRedisTemplate redisTemplate, String keyPrefix, String limiterName) {
        super(redisTemplate, keyPrefix, limiterName, RateLimitAlgorithm.FIXED_WINDOW, SCRIPT_PATH);
    }

    @Override
    protected ScriptResult evaluate(String key, int permits, LimitRule rule, long nowMillis) {
        long windowStart = TimestampUtil.windowStart(nowMillis, rule.getWindowMillis());
        return execute(buildRedisKey(key),
                rule.getLimit(),                     // ARGV[1]: 窗口内最大请求数
                permits,                             // ARGV[2]: 本次权重
                rule.getWindowMillis() + 1000L,      // ARGV[3]: 过期时间
                windowStart);                        // ARGV[4]: 窗口起始时间
    }
}
