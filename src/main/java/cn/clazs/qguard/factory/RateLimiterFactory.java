package cn.clazs.qguard.factory;

import cn.clazs.qguard.core.RateLimiter;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.limiter.AdaptiveRateLimiter;
import cn.clazs.qguard.limiter.AdaptiveSettings;
import cn.clazs.qguard.limiter.FixedWindowRateLimiter;
import cn.clazs.qguard.limiter.LeakyBucketRateLimiter;
import cn.clazs.qguard.limiter.SlidingWindowRateLimiter;
import cn.clazs.qguard.limiter.TokenBucketRateLimiter;
import cn.clazs.qguard.registry.RateLimitPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 限流器工厂
 *
 * <p>根据策略的算法类型创建对应的限流器实例，存储方式、时钟等运行时参数取自同一个 {@link RateLimiterConfig} 模板
 *
 * <ul>
 *   <li>fixed_window / sliding_window：窗口内最多 maxRequests</li>
 *   <li>token_bucket：速率 maxRequests / windowSeconds（每秒），容量 maxRequests + burstAllowance</li>
 *   <li>leaky_bucket：泄漏速率 maxRequests / windowSeconds（每秒），容量 maxRequests + burstAllowance</li>
 *   <li>adaptive：滑动窗口 + 自适应因子</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RateLimiterFactory {

    @Getter
    private final RateLimiterConfig config;

    @Getter
    private final AdaptiveSettings adaptiveSettings;

    /**
     * 默认构造函数：本地存储 + 默认自适应参数
     */
    public RateLimiterFactory() {
        this(RateLimiterConfig.defaults(), AdaptiveSettings.defaults());
    }

    public RateLimiterFactory(RateLimiterConfig config) {
        this(config, AdaptiveSettings.defaults());
    }

    public RateLimiterFactory(RateLimiterConfig config, AdaptiveSettings adaptiveSettings) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.adaptiveSettings = Objects.requireNonNull(adaptiveSettings, "adaptiveSettings cannot be null").validate();
    }

    /**
     * 为策略创建限流器
     *
     * @param policy 限流策略
     * @return 新的限流器实例（名称与策略名相同）
     */
    public RateLimiter create(RateLimitPolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");

        String name = policy.getName();
        int max = policy.getMaxRequests();
        int window = policy.getWindowSeconds();
        int capacity = max + policy.getBurstAllowance();

        RateLimiter limiter;
        switch (policy.getAlgorithm()) {
            case FIXED_WINDOW:
                limiter = new FixedWindowRateLimiter(name, max, window, config);
                break;
            case SLIDING_WINDOW:
                limiter = new SlidingWindowRateLimiter(name, max, window, config);
                break;
            case TOKEN_BUCKET:
                limiter = TokenBucketRateLimiter.ofRate(name, (double) max / window, capacity, config);
                break;
            case LEAKY_BUCKET:
                limiter = LeakyBucketRateLimiter.perWindow(name, max, window, capacity, config);
                break;
            case ADAPTIVE:
                limiter = new AdaptiveRateLimiter(name, max, window, adaptiveSettings, config);
                break;
            default:
                throw new IllegalArgumentException("不支持的算法：" + policy.getAlgorithm());
        }

        log.debug("创建限流器：policy={}, limiter={}", name, limiter);
        return limiter;
    }
}
