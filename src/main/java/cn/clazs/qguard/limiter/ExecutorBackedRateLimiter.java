package cn.clazs.qguard.limiter;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.core.LimiterExecutor;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.exception.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * 基于执行器的限流器（桥接模式中的"RefinedAbstraction"角色）
 *
 * <p>内部持有一个可选的分布式执行器（Redis）和一个本地执行器；
 * 分布式执行器抛出 {@link BackendUnavailableException} 时，本次调用改由本地执行器完成，调用方无感知
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public abstract class ExecutorBackedRateLimiter extends AbstractRateLimiter {

    /**
     * 分布式执行器，未启用 Redis 时为 null
     */
    private final LimiterExecutor distributedExecutor;

    /**
     * 本地执行器（同时作为回退）
     */
    private final LimiterExecutor localExecutor;

    protected ExecutorBackedRateLimiter(String name, RateLimiterConfig config,
                                        LimiterExecutor localExecutor, LimiterExecutor distributedExecutor) {
        super(name, config);
        this.localExecutor = localExecutor;
        this.distributedExecutor = distributedExecutor;
    }

    /**
     * @return 当前 scope 使用的限流参数
     */
    protected abstract LimitRule rule();

    @Override
    protected boolean doAcquire(String scope, int weight) {
        LimitRule rule = rule();
        long now = now();
        return execute(executor -> executor.tryAcquire(scope, weight, rule, now));
    }

    @Override
    public Integer getRemaining(String scope) {
        validateScope(scope);
        LimitRule rule = rule();
        long now = now();
        return execute(executor -> executor.getRemaining(scope, rule, now));
    }

    @Override
    public void reset(String scope) {
        validateScope(scope);
        execute(executor -> {
            executor.reset(scope);
            return null;
        });
        if (distributedExecutor != null) {
            localExecutor.reset(scope);
        }
    }

    @Override
    public void resetAll() {
        execute(executor -> {
            executor.resetAll();
            return null;
        });
        if (distributedExecutor != null) {
            localExecutor.resetAll();
        }
    }

    /**
     * 优先在分布式执行器上执行，Redis 不可用时回退到本地执行器
     */
    protected <T> T execute(Function<LimiterExecutor, T> call) {
        if (distributedExecutor != null) {
            try {
                return call.apply(distributedExecutor);
            } catch (BackendUnavailableException e) {
                log.debug("Redis 不可用，回退到本地执行器：limiter={}, cause={}", getName(), e.getMessage());
            }
        }
        return call.apply(localExecutor);
    }

    /**
     * @return 是否配置了分布式执行器
     */
    public boolean isDistributed() {
        return distributedExecutor != null;
    }

    /**
     * 桶类算法的规则：过期时间取"桶从空到满（或从满到空）所需时间"，至少 60 秒
     */
    protected static LimitRule bucketRule(int capacity, double ratePerSecond) {
        long fillMillis = (long) Math.ceil(capacity / ratePerSecond * 1000D);
        return LimitRule.bucket(capacity, ratePerSecond, Math.max(60_000L, fillMillis));
    }
}
