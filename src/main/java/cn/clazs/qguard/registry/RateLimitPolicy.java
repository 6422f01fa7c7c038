package cn.clazs.qguard.registry;

import cn.clazs.qguard.enums.LimitScope;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流策略
 *
 * <p>注册后除黑白名单外不可变；黑白名单为并发集合，可在运行时增删
 *
 * <p>使用示例：
 * <pre>
 * RateLimitPolicy policy = RateLimitPolicy.builder()
 *         .name("api_limit")
 *         .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
 *         .scope(LimitScope.USER)
 *         .maxRequests(100)
 *         .windowSeconds(60)
 *         .build();
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
public class RateLimitPolicy {

    /**
     * 默认恢复时间（秒）：黑名单拒绝时 resetTime = now + recoveryTimeSeconds
     */
    public static final int DEFAULT_RECOVERY_TIME_SECONDS = 300;

    private final String name;

    private final RateLimitAlgorithm algorithm;

    private final LimitScope scope;

    private final int maxRequests;

    private final int windowSeconds;

    /**
     * 突发余量：令牌桶/漏桶的容量 = maxRequests + burstAllowance
     */
    private final int burstAllowance;

    private final int recoveryTimeSeconds;

    private final boolean enabled;

    /**
     * 惩罚倍数（保留字段，引擎本身不使用）
     */
    private final double penaltyMultiplier;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> whitelist = ConcurrentHashMap.newKeySet();

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> blacklist = ConcurrentHashMap.newKeySet();

    private RateLimitPolicy(Builder builder) {
        this.name = builder.name;
        this.algorithm = builder.algorithm;
        this.scope = builder.scope;
        this.maxRequests = builder.maxRequests;
        this.windowSeconds = builder.windowSeconds;
        this.burstAllowance = builder.burstAllowance;
        this.recoveryTimeSeconds = builder.recoveryTimeSeconds;
        this.enabled = builder.enabled;
        this.penaltyMultiplier = builder.penaltyMultiplier;
        this.whitelist.addAll(builder.whitelist);
        this.blacklist.addAll(builder.blacklist);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return 白名单只读视图
     */
    public Set<String> getWhitelist() {
        return Collections.unmodifiableSet(whitelist);
    }

    /**
     * @return 黑名单只读视图
     */
    public Set<String> getBlacklist() {
        return Collections.unmodifiableSet(blacklist);
    }

    public boolean isWhitelisted(String scopeValue) {
        return scopeValue != null && whitelist.contains(scopeValue);
    }

    public boolean isBlacklisted(String scopeValue) {
        return scopeValue != null && blacklist.contains(scopeValue);
    }

    void addToWhitelist(String scopeValue) {
        whitelist.add(scopeValue);
    }

    void removeFromWhitelist(String scopeValue) {
        if (scopeValue != null) {
            whitelist.remove(scopeValue);
        }
    }

    void addToBlacklist(String scopeValue) {
        blacklist.add(scopeValue);
    }

    void removeFromBlacklist(String scopeValue) {
        if (scopeValue != null) {
            blacklist.remove(scopeValue);
        }
    }

    @Override
    public String toString() {
        return String.format("RateLimitPolicy{name='%s', algorithm=%s, scope=%s, maxRequests=%d, windowSeconds=%d, "
                        + "burstAllowance=%d, enabled=%s}",
                name, algorithm.getCode(), scope.getCode(), maxRequests, windowSeconds, burstAllowance, enabled);
    }

    /**
     * Builder 类
     */
    public static class Builder {
        private String name;
        private RateLimitAlgorithm algorithm;
        private LimitScope scope;
        private int maxRequests;
        private int windowSeconds;
        private int burstAllowance = 0;
        private int recoveryTimeSeconds = DEFAULT_RECOVERY_TIME_SECONDS;
        private boolean enabled = true;
        private double penaltyMultiplier = 1.0D;
        private final Set<String> whitelist = new LinkedHashSet<>();
        private final Set<String> blacklist = new LinkedHashSet<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder algorithm(RateLimitAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder scope(LimitScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder maxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder windowSeconds(int windowSeconds) {
            this.windowSeconds = windowSeconds;
            return this;
        }

        public Builder burstAllowance(int burstAllowance) {
            this.burstAllowance = burstAllowance;
            return this;
        }

        public Builder recoveryTimeSeconds(int recoveryTimeSeconds) {
            this.recoveryTimeSeconds = recoveryTimeSeconds;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder penaltyMultiplier(double penaltyMultiplier) {
            this.penaltyMultiplier = penaltyMultiplier;
            return this;
        }

        public Builder whitelist(Collection<String> scopes) {
            if (scopes != null) {
                this.whitelist.addAll(scopes);
            }
            return this;
        }

        public Builder blacklist(Collection<String> scopes) {
            if (scopes != null) {
                this.blacklist.addAll(scopes);
            }
            return this;
        }

        /**
         * 构建策略对象
         *
         * @return 策略对象
         * @throws IllegalArgumentException 如果参数不合法
         */
        public RateLimitPolicy build() {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("policy name cannot be blank");
            }
            Objects.requireNonNull(algorithm, "algorithm cannot be null");
            Objects.requireNonNull(scope, "scope cannot be null");
            if (maxRequests <= 0) {
                throw new IllegalArgumentException("maxRequests must be > 0, got: " + maxRequests);
            }
            if (windowSeconds <= 0) {
                throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
            }
            if (burstAllowance < 0) {
                throw new IllegalArgumentException("burstAllowance must be >= 0, got: " + burstAllowance);
            }
            if (recoveryTimeSeconds < 0) {
                throw new IllegalArgumentException("recoveryTimeSeconds must be >= 0, got: " + recoveryTimeSeconds);
            }
            if (!(penaltyMultiplier > 0)) {
                throw new IllegalArgumentException("penaltyMultiplier must be > 0, got: " + penaltyMultiplier);
            }
            return new RateLimitPolicy(this);
        }
    }
}
