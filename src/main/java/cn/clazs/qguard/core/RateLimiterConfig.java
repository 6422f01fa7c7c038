package cn.clazs.qguard.core;

import cn.clazs.qguard.clock.Clock;
import cn.clazs.qguard.clock.SystemClock;
import cn.clazs.qguard.enums.RateLimitStorage;
import cn.clazs.qguard.violation.ViolationLedger;
import lombok.Getter;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Objects;

/**
 * 限流器运行时配置（与具体算法参数无关的部分）
 *
 * <p>决定限流器使用哪种存储、哪个时钟、违规台账容量以及本地缓存的淘汰策略
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class RateLimiterConfig {

    /**
     * 存储类型
     */
    private RateLimitStorage storage = RateLimitStorage.LOCAL;

    /**
     * Redis 模板（storage=REDIS 时使用，为 null 时退化为本地存储）
     */
    private StringRedisTemplate redisTemplate;

    /**
     * Redis 键前缀
     */
    private String redisKeyPrefix = "qguard:";

    /**
     * 时间源
     */
    private Clock clock = SystemClock.instance();

    /**
     * 违规记录环形队列容量
     */
    private int violationHistorySize = ViolationLedger.DEFAULT_CAPACITY;

    /**
     * 本地缓存过期时间（分钟），scope 在该时间内没有访问则清除其状态
     */
    private long cacheExpireAfterAccessMinutes = 1440L;

    /**
     * 本地缓存最大 scope 数
     */
    private long cacheMaximumSize = 10_000L;

    /**
     * @return 默认配置：本地存储 + 系统时钟
     */
    public static RateLimiterConfig defaults() {
        return builder().build();
    }

    /**
     * 构建器模式
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前配置为模板创建构建器
     */
    public Builder toBuilder() {
        return new Builder()
                .storage(storage)
                .redisTemplate(redisTemplate)
                .redisKeyPrefix(redisKeyPrefix)
                .clock(clock)
                .violationHistorySize(violationHistorySize)
                .cacheExpireAfterAccessMinutes(cacheExpireAfterAccessMinutes)
                .cacheMaximumSize(cacheMaximumSize);
    }

    /**
     * @return 是否真正启用 Redis（storage=REDIS 且模板存在）
     */
    public boolean isDistributed() {
        return storage == RateLimitStorage.REDIS && redisTemplate != null;
    }

    /**
     * Builder 类
     */
    public static class Builder {
        private final RateLimiterConfig config = new RateLimiterConfig();

        public Builder storage(RateLimitStorage storage) {
            config.storage = Objects.requireNonNull(storage, "storage cannot be null");
            return this;
        }

        public Builder redisTemplate(StringRedisTemplate redisTemplate) {
            config.redisTemplate = redisTemplate;
            return this;
        }

        public Builder redisKeyPrefix(String redisKeyPrefix) {
            config.redisKeyPrefix = Objects.requireNonNull(redisKeyPrefix, "redisKeyPrefix cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            config.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder violationHistorySize(int violationHistorySize) {
            config.violationHistorySize = violationHistorySize;
            return this;
        }

        public Builder cacheExpireAfterAccessMinutes(long cacheExpireAfterAccessMinutes) {
            config.cacheExpireAfterAccessMinutes = cacheExpireAfterAccessMinutes;
            return this;
        }

        public Builder cacheMaximumSize(long cacheMaximumSize) {
            config.cacheMaximumSize = cacheMaximumSize;
            return this;
        }

        /**
         * 构建配置对象
         *
         * @return 配置对象
         * @throws IllegalArgumentException 如果参数不合法
         */
        public RateLimiterConfig build() {
            if (config.violationHistorySize <= 0) {
                throw new IllegalArgumentException("violationHistorySize must be > 0");
            }
            if (config.cacheExpireAfterAccessMinutes <= 0) {
                throw new IllegalArgumentException("cacheExpireAfterAccessMinutes must be > 0");
            }
            if (config.cacheMaximumSize <= 0) {
                throw new IllegalArgumentException("cacheMaximumSize must be > 0");
            }
            return config;
        }
    }
}
