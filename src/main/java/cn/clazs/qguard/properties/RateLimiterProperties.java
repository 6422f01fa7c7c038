package cn.clazs.qguard.properties;

import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.LimitScope;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.enums.RateLimitStorage;
import cn.clazs.qguard.limiter.AdaptiveSettings;
import cn.clazs.qguard.registry.RateLimitPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 限流器配置属性类
 * 用于映射 application.yml 中的配置
 *
 * <p>YAML 配置示例：
 * <pre>
 * clazs:
 *   qguard:
 *     enabled: true
 *     storage: local
 *     default-policies-enabled: false
 *     policies:
 *       - name: user_requests
 *         algorithm: sliding_window
 *         scope: user
 *         max-requests: 5000
 *         window-seconds: 3600
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "clazs.qguard")
public class RateLimiterProperties {

    /**
     * 是否启用限流器
     */
    private boolean enabled = true;

    /**
     * 存储类型（默认：本地内存）
     */
    private RateLimitStorage storage = RateLimitStorage.LOCAL;

    /**
     * 是否安装默认策略（global_api、ip_requests 等）
     */
    private boolean defaultPoliciesEnabled = false;

    /**
     * 每个限流器保留的违规记录条数（默认：1000）
     */
    private int violationHistorySize = 1000;

    /**
     * 缓存过期时间，单位：分钟（默认：1440）
     * scope 在指定时间内没有访问后，其限流状态会自动从内存中清除
     */
    private long cacheExpireAfterAccessMinutes = 1440L;

    /**
     * 缓存最大 scope 数（默认：10000）
     * 防止恶意攻击导致内存溢出
     */
    private long cacheMaximumSize = 10000L;

    /**
     * Redis 配置
     */
    private RedisConfig redis = new RedisConfig();

    /**
     * 自适应限流配置
     */
    private AdaptiveConfig adaptive = new AdaptiveConfig();

    /**
     * 启动时注册的策略
     */
    private List<PolicyProperties> policies = new ArrayList<>();

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置不合法
     */
    public void validate() {
        if (storage == null) {
            throw new IllegalArgumentException("配置错误：storage 不能为 null");
        }
        if (violationHistorySize <= 0) {
            throw new IllegalArgumentException("配置错误：violationHistorySize 必须大于 0，当前值：" + violationHistorySize);
        }
        if (cacheExpireAfterAccessMinutes <= 0) {
            throw new IllegalArgumentException("配置错误：cacheExpireAfterAccessMinutes 必须大于 0");
        }
        if (cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("配置错误：cacheMaximumSize 必须大于 0");
        }
        if (redis == null || redis.getKeyPrefix() == null) {
            throw new IllegalArgumentException("配置错误：redis.keyPrefix 不能为 null");
        }
        if (adaptive == null) {
            throw new IllegalArgumentException("配置错误：adaptive 不能为 null");
        }
        adaptive.toSettings();

        Set<String> names = new HashSet<>();
        for (PolicyProperties policy : policies) {
            RateLimitPolicy built = policy.toPolicy();
            if (!names.add(built.getName())) {
                throw new IllegalArgumentException("配置错误：策略名重复：" + built.getName());
            }
        }
    }

    /**
     * 转换为限流器运行时配置模板（不含 Redis 模板）
     */
    public RateLimiterConfig.Builder toConfigBuilder() {
        return RateLimiterConfig.builder()
                .storage(storage)
                .redisKeyPrefix(redis.getKeyPrefix())
                .violationHistorySize(violationHistorySize)
                .cacheExpireAfterAccessMinutes(cacheExpireAfterAccessMinutes)
                .cacheMaximumSize(cacheMaximumSize);
    }

    /**
     * 获取配置摘要信息（用于日志输出）
     */
    public String getSummary() {
        return String.format(
                "RateLimiterProperties{enabled=%s, storage=%s, defaultPoliciesEnabled=%s, policies=%d, " +
                        "violationHistorySize=%d, cacheExpireAfterAccessMinutes=%d, cacheMaximumSize=%d, keyPrefix=%s}",
                enabled, storage, defaultPoliciesEnabled, policies.size(), violationHistorySize,
                cacheExpireAfterAccessMinutes, cacheMaximumSize, redis.getKeyPrefix()
        );
    }

    /**
     * Redis 配置类
     */
    @Data
    public static class RedisConfig {
        /**
         * Redis 键前缀（默认：qguard:）
         */
        private String keyPrefix = "qguard:";
    }

    /**
     * 自适应限流配置类
     */
    @Data
    public static class AdaptiveConfig {
        private double penaltyFactor = 0.8;
        private double recoveryFactor = 1.05;
        private double minFactor = 0.1;
        private double maxFactor = 1.0;
        private double penaltyThreshold = 0.1;
        private double recoveryThreshold = 0.8;

        /**
         * @throws IllegalArgumentException 参数不合法
         */
        public AdaptiveSettings toSettings() {
            return AdaptiveSettings.builder()
                    .penaltyFactor(penaltyFactor)
                    .recoveryFactor(recoveryFactor)
                    .minFactor(minFactor)
                    .maxFactor(maxFactor)
                    .penaltyThreshold(penaltyThreshold)
                    .recoveryThreshold(recoveryThreshold)
                    .build()
                    .validate();
        }
    }

    /**
     * 单个策略的配置
     */
    @Data
    public static class PolicyProperties {
        private String name;

        /**
         * 算法代码：fixed_window、sliding_window、token_bucket、leaky_bucket、adaptive
         */
        private String algorithm = RateLimitAlgorithm.SLIDING_WINDOW.getCode();

        /**
         * scope 代码：global、ip、user、api_key、endpoint、combined
         */
        private String scope = LimitScope.USER.getCode();

        private int maxRequests;
        private int windowSeconds;
        private int burstAllowance = 0;
        private int recoveryTimeSeconds = RateLimitPolicy.DEFAULT_RECOVERY_TIME_SECONDS;
        private boolean enabled = true;
        private double penaltyMultiplier = 1.0;
        private List<String> whitelist = new ArrayList<>();
        private List<String> blacklist = new ArrayList<>();

        /**
         * @throws IllegalArgumentException 参数不合法或算法/scope 代码未知
         */
        public RateLimitPolicy toPolicy() {
            return RateLimitPolicy.builder()
                    .name(name)
                    .algorithm(RateLimitAlgorithm.fromCode(algorithm))
                    .scope(LimitScope.fromCode(scope))
                    .maxRequests(maxRequests)
                    .windowSeconds(windowSeconds)
                    .burstAllowance(burstAllowance)
                    .recoveryTimeSeconds(recoveryTimeSeconds)
                    .enabled(enabled)
                    .penaltyMultiplier(penaltyMultiplier)
                    .whitelist(whitelist)
                    .blacklist(blacklist)
                    .build();
        }
    }
}
