package cn.clazs.qguard.executor.redis;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.LimiterExecutor;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.exception.BackendUnavailableException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Redis 执行器基类
 *
 * <p>负责加载 Lua 脚本、拼接 Redis 键、解析脚本返回值，
 * 并把 Redis 访问异常统一转换为 {@link BackendUnavailableException}（由限流器回退到本地执行器）
 *
 * <p>键格式：{@code {prefix}{limiterName}:{algorithm}:{scope}}
 * <p>脚本约定：返回 {@code {是否放行(1/0), 剩余额度}}，权重为 0 时只查询不修改
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public abstract class AbstractRedisExecutor implements LimiterExecutor {

    /**
     * Redis 键默认前缀
     */
    public static final String DEFAULT_KEY_PREFIX = "qguard:";

    protected final StringRedisTemplate redisTemplate;

    /**
     * 脚本返回 "allowed:remaining"
     */
    private final DefaultRedisScript<String> script;

    /**
     * 键命名空间：{prefix}{limiterName}:{algorithm}:
     */
    @Getter
    private final String namespace;

    /**
     * 脚本单次执行结果
     */
    protected static final class ScriptResult {
        final boolean allowed;
        final double remaining;

        ScriptResult(boolean allowed, double remaining) {
            this.allowed = allowed;
            this.remaining = remaining;
        }
    }

    protected AbstractRedisExecutor(StringRedisTemplate redisTemplate, String keyPrefix, String limiterName,
                                    RateLimitAlgorithm algorithm, String scriptPath) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.namespace = (keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix)
                + limiterName + ":" + algorithm.getCode() + ":";

        // 加载 Lua 脚本
        this.script = new DefaultRedisScript<>();
        this.script.setScriptSource(new ResourceScriptSource(new ClassPathResource(scriptPath)));
        this.script.setResultType(String.class);
    }

    @Override
    public boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis) {
        return evaluate(key, permits, rule, nowMillis).allowed;
    }

    @Override
    public int getRemaining(String key, LimitRule rule, long nowMillis) {
        double remaining = evaluate(key, 0, rule, nowMillis).remaining;
        if (remaining <= 0) {
            return 0;
        }
        return (int) Math.min(rule.getLimit(), Math.floor(remaining));
    }

    /**
     * 执行本算法的脚本，permits 为 0 表示只查询
     */
    protected abstract ScriptResult evaluate(String key, int permits, LimitRule rule, long nowMillis);

    /**
     * 执行 Lua 脚本，参数统一转为字符串
     *
     * @throws BackendUnavailableException Redis 不可用或返回值无法解析
     */
    protected ScriptResult execute(String redisKey, Object... args) {
        String[] argv = new String[args.length];
        for (int i = 0; i < args.length; i++) {
            argv[i] = String.valueOf(args[i]);
        }

        String raw;
        try {
            raw = redisTemplate.execute(script, Collections.singletonList(redisKey), (Object[]) argv);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Redis 脚本执行失败：key=" + redisKey, e);
        }

        int separator = raw == null ? -1 : raw.indexOf(':');
        if (separator < 0) {
            throw new BackendUnavailableException("Redis 脚本返回值异常：key=" + redisKey + ", result=" + raw);
        }
        try {
            boolean allowed = Long.parseLong(raw.substring(0, separator)) == 1L;
            double remaining = Double.parseDouble(raw.substring(separator + 1));
            return new ScriptResult(allowed, remaining);
        } catch (NumberFormatException e) {
            throw new BackendUnavailableException("Redis 脚本返回值无法解析：key=" + redisKey + ", result=" + raw, e);
        }
    }

    @Override
    public void reset(String key) {
        String redisKey = buildRedisKey(key);
        try {
            redisTemplate.delete(redisKey);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Redis 删除失败：key=" + redisKey, e);
        }
    }

    @Override
    public void resetAll() {
        deletePattern(namespace + "*");
    }

    /**
     * 删除匹配 pattern 的全部键
     */
    protected void deletePattern(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.debug("删除 Redis 键：pattern={}, count={}", pattern, keys.size());
            }
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Redis 批量删除失败：pattern=" + pattern, e);
        }
    }

    /**
     * 构建 Redis 键
     *
     * @param key 原始键（scope 值）
     * @return Redis 键
     */
    protected String buildRedisKey(String key) {
        return namespace + key;
    }

    /**
     * 桶类算法的过期时间：至少 60 秒
     */
    protected static long bucketTtlMillis(LimitRule rule) {
        return Math.max(60_000L, rule.getWindowMillis());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + namespace + "]";
    }
}
