package cn.clazs.qguard.limiter;

import cn.clazs.qguard.clock.Clock;
import cn.clazs.qguard.core.RateLimiter;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.ViolationType;
import cn.clazs.qguard.exception.RateLimitException;
import cn.clazs.qguard.exception.RateLimitTimeoutException;
import cn.clazs.qguard.violation.RateLimitViolation;
import cn.clazs.qguard.violation.ViolationLedger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 限流器基类
 *
 * <p>负责所有算法共有的部分：参数校验、黑白名单短路、违规台账、阻塞等待；
 * 具体算法只需实现 {@link #doAcquire(String, int)} 和 {@link #suggestDelayMillis(String, int)}
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public abstract class AbstractRateLimiter implements RateLimiter {

    /**
     * 单次等待的最长休眠时间（毫秒）
     */
    protected static final long MAX_BACKOFF_MILLIS = 1000L;

    @Getter
    private final String name;

    @Getter
    protected final RateLimiterConfig config;

    protected final Clock clock;

    private final ViolationLedger ledger;

    protected AbstractRateLimiter(String name, RateLimiterConfig config) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("limiter name cannot be blank");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = config.getClock();
        this.ledger = new ViolationLedger(config.getViolationHistorySize());
    }

    @Override
    public boolean acquire(String scope, int weight) {
        validate(scope, weight);

        if (ledger.isBlacklisted(scope)) {
            recordViolation(scope, ViolationType.ABUSE_PATTERN, weight, getLimitValue(),
                    Collections.singletonMap("reason", "blacklisted"));
            log.warn("黑名单请求被拒绝：limiter={}, scope={}", name, scope);
            return false;
        }
        if (ledger.isWhitelisted(scope)) {
            return true;
        }

        boolean allowed = doAcquire(scope, weight);
        if (!allowed && log.isDebugEnabled()) {
            log.debug("限流触发：limiter={}, algorithm={}, scope={}, weight={}", name, getAlgorithm(), scope, weight);
        }
        return allowed;
    }

    @Override
    public void waitIfNeeded(String scope, int weight, Duration maxWait) {
        validate(scope, weight);
        Objects.requireNonNull(maxWait, "maxWait cannot be null");
        if (ledger.isBlacklisted(scope)) {
            throw new RateLimitException(scope, "scope 在黑名单中，无法获取许可：" + scope);
        }

        long deadline = clock.currentTimeMillis() + Math.max(0L, maxWait.toMillis());
        while (true) {
            if (acquire(scope, weight)) {
                return;
            }

            long now = clock.currentTimeMillis();
            if (now >= deadline) {
                throw new RateLimitTimeoutException(scope, maxWait);
            }

            long delay = Math.min(suggestDelayMillis(scope, weight), MAX_BACKOFF_MILLIS);
            delay = Math.max(1L, Math.min(delay, deadline - now));
            try {
                clock.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitTimeoutException(scope, maxWait, e);
            }
        }
    }

    /**
     * 执行算法本身（已通过校验与黑白名单检查）
     */
    protected abstract boolean doAcquire(String scope, int weight);

    /**
     * 估算下次可能成功之前需要等待的时间（毫秒），调用方会限制在 [1, 1000] 内
     */
    protected abstract long suggestDelayMillis(String scope, int weight);

    /**
     * @return 记录违规时使用的阈值
     */
    protected abstract int getLimitValue();

    protected long now() {
        return clock.currentTimeMillis();
    }

    protected static void validateScope(String scope) {
        if (scope == null || scope.trim().isEmpty()) {
            throw new IllegalArgumentException("scope cannot be blank");
        }
    }

    protected static void validate(String scope, int weight) {
        validateScope(scope);
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0, got: " + weight);
        }
    }

    // ==================== 黑白名单 ====================

    @Override
    public void addToWhitelist(String scope) {
        validateScope(scope);
        ledger.addToWhitelist(scope);
        log.info("加入白名单：limiter={}, scope={}", name, scope);
    }

    @Override
    public void removeFromWhitelist(String scope) {
        ledger.removeFromWhitelist(scope);
    }

    @Override
    public void addToBlacklist(String scope) {
        validateScope(scope);
        ledger.addToBlacklist(scope);
        log.warn("加入黑名单：limiter={}, scope={}", name, scope);
    }

    @Override
    public void removeFromBlacklist(String scope) {
        ledger.removeFromBlacklist(scope);
    }

    @Override
    public boolean isWhitelisted(String scope) {
        return ledger.isWhitelisted(scope);
    }

    @Override
    public boolean isBlacklisted(String scope) {
        return ledger.isBlacklisted(scope);
    }

    // ==================== 违规记录 ====================

    @Override
    public RateLimitViolation recordViolation(String scope, ViolationType type, int requestsCount, int limitValue,
                                              Map<String, Object> metadata) {
        return ledger.record(scope, type, requestsCount, limitValue, metadata, Instant.ofEpochMilli(now()));
    }

    @Override
    public List<RateLimitViolation> getViolations(String scope, ViolationType type, Instant since) {
        return ledger.query(scope, type, since);
    }

    @Override
    public int getViolationCount(String scope, ViolationType type, Instant since) {
        return ledger.count(scope, type, since);
    }

    @Override
    public void clearViolations(String scope) {
        ledger.clear(scope);
    }

    @Override
    public String toString() {
        return String.format("%s{name='%s', algorithm=%s, storage=%s}",
                getClass().getSimpleName(), name, getAlgorithm(), config.getStorage());
    }
}
