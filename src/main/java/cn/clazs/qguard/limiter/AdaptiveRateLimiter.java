package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 自适应限流器
 *
 * <p>包装一个滑动窗口限流器，为每个 scope 维护一个 factor：
 * 实际阈值 = max(1, floor(maxRequests × factor))。
 * 每次判定后按剩余比例调整 factor：额度快耗尽时收紧，额度充裕时逐步放宽
 *
 * <p>factor 的读取与调整在本实例的锁内完成，调用底层限流器时不持有该锁
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class AdaptiveRateLimiter extends AbstractRateLimiter {

    private final SlidingWindowRateLimiter base;

    @Getter
    private final int maxRequests;

    @Getter
    private final int windowSeconds;

    @Getter
    private final AdaptiveSettings settings;

    /**
     * scope -> factor，不存在时视为 {@link AdaptiveSettings#initialFactor()}
     */
    private final Cache<String, Double> factors;

    private final ReentrantLock lock = new ReentrantLock();

    private long totalPenalties;

    private long totalRecoveries;

    public AdaptiveRateLimiter(String name, int maxRequests, int windowSeconds) {
        this(name, maxRequests, windowSeconds, AdaptiveSettings.defaults(), RateLimiterConfig.defaults());
    }

    public AdaptiveRateLimiter(String name, int maxRequests, int windowSeconds, AdaptiveSettings settings,
                               RateLimiterConfig config) {
        super(name, config);
        this.settings = Objects.requireNonNull(settings, "settings cannot be null").validate();
        this.base = new SlidingWindowRateLimiter(name, maxRequests, windowSeconds, config);
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
        this.factors = Caffeine.newBuilder()
                .expireAfterAccess(config.getCacheExpireAfterAccessMinutes(), TimeUnit.MINUTES)
                .maximumSize(config.getCacheMaximumSize())
                .build();
    }

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.ADAPTIVE;
    }

    @Override
    protected boolean doAcquire(String scope, int weight) {
        int ceiling = locked(() -> effectiveLimit(factorOf(scope)));

        boolean allowed = base.tryAcquire(scope, weight, ceiling);
        int remaining = base.getRemaining(scope, ceiling);

        locked(() -> {
            adjust(scope, remaining, ceiling);
            return null;
        });
        return allowed;
    }

    /**
     * 按剩余比例调整 factor（调用方持有锁）
     */
    private void adjust(String scope, int remaining, int ceiling) {
        double ratio = (double) remaining / ceiling;
        double previous = factors.get(scope, k -> settings.initialFactor());

        if (ratio < settings.getPenaltyThreshold()) {
            if (previous > settings.getMinFactor()) {
                double next = Math.max(settings.getMinFactor(), previous * settings.getPenaltyFactor());
                factors.put(scope, next);
                totalPenalties++;
                log.info("自适应惩罚：limiter={}, scope={}, factor {} -> {}",
                        getName(), scope, String.format("%.2f", previous), String.format("%.2f", next));
            }
        } else if (ratio > settings.getRecoveryThreshold()) {
            if (previous < settings.getMaxFactor()) {
                double next = Math.min(settings.getMaxFactor(), previous * settings.getRecoveryFactor());
                factors.put(scope, next);
                totalRecoveries++;
                log.debug("自适应恢复：limiter={}, scope={}, factor {} -> {}",
                        getName(), scope, String.format("%.2f", previous), String.format("%.2f", next));
            }
        }
    }

    private double factorOf(String scope) {
        Double factor = factors.getIfPresent(scope);
        return factor != null ? factor : settings.initialFactor();
    }

    private int effectiveLimit(double factor) {
        return Math.max(1, (int) Math.floor(maxRequests * factor));
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 剩余额度（按当前实际阈值计算）
     */
    @Override
    public Integer getRemaining(String scope) {
        validateScope(scope);
        return base.getRemaining(scope, getEffectiveLimit(scope));
    }

    /**
     * @return scope 当前的 factor（1.0 表示正常，小于 1.0 表示被惩罚）
     */
    public double getAdaptiveFactor(String scope) {
        return locked(() -> factorOf(scope));
    }

    /**
     * @return scope 当前的实际阈值
     */
    public int getEffectiveLimit(String scope) {
        return locked(() -> effectiveLimit(factorOf(scope)));
    }

    /**
     * 把 scope 的 factor 恢复为初始值
     */
    public void resetAdaptiveFactor(String scope) {
        locked(() -> {
            factors.invalidate(scope);
            return null;
        });
        log.info("重置自适应因子：limiter={}, scope={}", getName(), scope);
    }

    public AdaptiveStatistics getStatistics() {
        return locked(() -> {
            Collection<Double> values = factors.asMap().values();
            int active = 0;
            int penalized = 0;
            double sum = 0D;
            for (Double factor : values) {
                if (factor < settings.getMaxFactor()) {
                    active++;
                }
                if (factor < settings.initialFactor()) {
                    penalized++;
                }
                sum += factor;
            }
            return AdaptiveStatistics.builder()
                    .totalPenalties(totalPenalties)
                    .totalRecoveries(totalRecoveries)
                    .activePenalties(active)
                    .trackedScopes(values.size())
                    .penalizedScopes(penalized)
                    .averageFactor(values.isEmpty() ? settings.initialFactor() : sum / values.size())
                    .build();
        });
    }

    /**
     * 按底层滑动窗口的平均间隔估算
     */
    @Override
    protected long suggestDelayMillis(String scope, int weight) {
        return Math.max(1L, TimeUnit.SECONDS.toMillis(windowSeconds) / getEffectiveLimit(scope));
    }

    @Override
    protected int getLimitValue() {
        return maxRequests;
    }

    @Override
    public void reset(String scope) {
        validateScope(scope);
        base.reset(scope);
        resetAdaptiveFactor(scope);
    }

    @Override
    public void resetAll() {
        base.resetAll();
        locked(() -> {
            factors.invalidateAll();
            return null;
        });
    }
}
