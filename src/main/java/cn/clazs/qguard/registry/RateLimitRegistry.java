package cn.clazs.qguard.registry;

import cn.clazs.qguard.clock.Clock;
import cn.clazs.qguard.core.RateLimiter;
import cn.clazs.qguard.enums.LimitScope;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.enums.ViolationType;
import cn.clazs.qguard.exception.RateLimitException;
import cn.clazs.qguard.factory.RateLimiterFactory;
import cn.clazs.qguard.violation.RateLimitViolation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 限流策略注册中心
 *
 * <p>维护 策略名 -> (策略, 限流器) 的映射，按策略对 scope 做统一判定：
 * <ol>
 *     <li>策略不存在：放行（fail-open），remainingRequests = -1，并打印告警</li>
 *     <li>黑名单：拒绝，记录 ABUSE_PATTERN 违规</li>
 *     <li>白名单：放行，remainingRequests = -1</li>
 *     <li>策略禁用：放行</li>
 *     <li>交给限流器判定，拒绝时记录 HARD_LIMIT 违规</li>
 * </ol>
 *
 * <p>使用示例：
 * <pre>
 * RateLimitRegistry registry = new RateLimitRegistry(new RateLimiterFactory());
 * registry.addLimit(RateLimitPolicy.builder()
 *         .name("api_limit")
 *         .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
 *         .scope(LimitScope.USER)
 *         .maxRequests(100)
 *         .windowSeconds(60)
 *         .build());
 *
 * RateLimitResult result = registry.checkRateLimit("api_limit", "user123");
 * if (!result.isAllowed()) {
 *     // 拒绝请求，result.getRetryAfterSeconds() 秒后重试
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RateLimitRegistry {

    /**
     * 策略不存在时的提示信息
     */
    public static final String LIMIT_NOT_FOUND = "Limit configuration not found";

    /**
     * 策略与其限流器
     */
    private static final class Registration {
        final RateLimitPolicy policy;
        final RateLimiter limiter;

        Registration(RateLimitPolicy policy, RateLimiter limiter) {
            this.policy = policy;
            this.limiter = limiter;
        }
    }

    private final ConcurrentMap<String, Registration> registrations = new ConcurrentHashMap<>();

    private final RateLimiterFactory limiterFactory;

    private final Clock clock;

    private final AtomicLong totalRequests = new AtomicLong(0);

    private final AtomicLong totalViolations = new AtomicLong(0);

    private final Map<ViolationType, AtomicLong> violationsByType = new EnumMap<>(ViolationType.class);

    /**
     * 创建空的注册中心
     *
     * @param limiterFactory 限流器工厂
     */
    public RateLimitRegistry(RateLimiterFactory limiterFactory) {
        this(limiterFactory, false);
    }

    /**
     * @param limiterFactory 限流器工厂
     * @param installDefaultPolicies 是否安装默认策略（见 {@link #defaultPolicies()}）
     */
    public RateLimitRegistry(RateLimiterFactory limiterFactory, boolean installDefaultPolicies) {
        if (limiterFactory == null) {
            throw new IllegalArgumentException("limiterFactory cannot be null");
        }
        this.limiterFactory = limiterFactory;
        this.clock = limiterFactory.getConfig().getClock();
        for (ViolationType type : ViolationType.values()) {
            violationsByType.put(type, new AtomicLong(0));
        }

        if (installDefaultPolicies) {
            defaultPolicies().forEach(this::addLimit);
        }

        log.info("RateLimitRegistry 初始化完成：storage={}, policies={}",
                limiterFactory.getConfig().getStorage(), registrations.size());
    }

    /**
     * 默认策略集合
     */
    public static List<RateLimitPolicy> defaultPolicies() {
        return Arrays.asList(
                policy("global_api", RateLimitAlgorithm.SLIDING_WINDOW, LimitScope.GLOBAL, 10000, 3600, 500),
                policy("ip_requests", RateLimitAlgorithm.TOKEN_BUCKET, LimitScope.IP, 1000, 3600, 50),
                policy("user_requests", RateLimitAlgorithm.SLIDING_WINDOW, LimitScope.USER, 5000, 3600, 100),
                policy("api_key_requests", RateLimitAlgorithm.FIXED_WINDOW, LimitScope.API_KEY, 10000, 3600, 200),
                policy("mcp_endpoint", RateLimitAlgorithm.LEAKY_BUCKET, LimitScope.ENDPOINT, 500, 60, 25),
                policy("burst_protection", RateLimitAlgorithm.ADAPTIVE, LimitScope.IP, 100, 60, 10)
        );
    }

    private static RateLimitPolicy policy(String name, RateLimitAlgorithm algorithm, LimitScope scope,
                                          int maxRequests, int windowSeconds, int burstAllowance) {
        return RateLimitPolicy.builder()
                .name(name)
                .algorithm(algorithm)
                .scope(scope)
                .maxRequests(maxRequests)
                .windowSeconds(windowSeconds)
                .burstAllowance(burstAllowance)
                .build();
    }

    /**
     * 注册（或替换）策略
     *
     * @param policy 限流策略
     * @return 为该策略创建的限流器
     */
    public RateLimiter addLimit(RateLimitPolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");

        RateLimiter limiter = limiterFactory.create(policy);
        policy.getWhitelist().forEach(limiter::addToWhitelist);
        policy.getBlacklist().forEach(limiter::addToBlacklist);

        Registration previous = registrations.put(policy.getName(), new Registration(policy, limiter));
        if (previous != null) {
            log.info("替换限流策略：{}", policy);
        } else {
            log.info("注册限流策略：{}", policy);
        }
        return limiter;
    }

    // ==================== 判定 ====================

    public RateLimitResult checkRateLimit(String policyName, String scope) {
        return checkRateLimit(policyName, scope, 1, null);
    }

    /**
     * 按策略判定一次请求
     *
     * @param policyName 策略名
     * @param scope scope 值（IP、用户ID、API Key 等）
     * @param weight 请求权重（> 0）
     * @param context 附加上下文，拒绝时作为违规记录的 metadata（可为 null）
     * @return 判定结果
     * @throws IllegalArgumentException 参数不合法
     */
    public RateLimitResult checkRateLimit(String policyName, String scope, int weight, Map<String, Object> context) {
        validate(scope, weight);

        long now = clock.currentTimeMillis();
        Registration registration = lookup(policyName);
        if (registration == null) {
            log.warn("限流策略不存在，直接放行：policy={}, scope={}", policyName, scope);
            return RateLimitResult.builder()
                    .allowed(true)
                    .limitName(policyName)
                    .remainingRequests(-1)
                    .resetTime(Instant.ofEpochMilli(now))
                    .meta("error", LIMIT_NOT_FOUND)
                    .build();
        }

        RateLimitPolicy policy = registration.policy;
        RateLimiter limiter = registration.limiter;
        totalRequests.incrementAndGet();

        // 黑名单
        if (policy.isBlacklisted(scope) || limiter.isBlacklisted(scope)) {
            RateLimitViolation violation = limiter.recordViolation(scope, ViolationType.ABUSE_PATTERN, weight, 0,
                    Collections.singletonMap("reason", "blacklisted"));
            countViolation(violation);
            log.warn("黑名单请求被拒绝：policy={}, scope={}", policyName, scope);
            return RateLimitResult.builder()
                    .allowed(false)
                    .limitName(policyName)
                    .remainingRequests(0)
                    .resetTime(Instant.ofEpochMilli(now).plusSeconds(policy.getRecoveryTimeSeconds()))
                    .violation(violation)
                    .build();
        }

        // 白名单
        if (policy.isWhitelisted(scope) || limiter.isWhitelisted(scope)) {
            return RateLimitResult.builder()
                    .allowed(true)
                    .limitName(policyName)
                    .remainingRequests(-1)
                    .resetTime(Instant.ofEpochMilli(now))
                    .meta("reason", "whitelisted")
                    .build();
        }

        // 策略禁用
        if (!policy.isEnabled()) {
            return RateLimitResult.builder()
                    .allowed(true)
                    .limitName(policyName)
                    .remainingRequests(-1)
                    .resetTime(Instant.ofEpochMilli(now))
                    .meta("reason", "disabled")
                    .build();
        }

        Instant resetTime = Instant.ofEpochMilli(now).plusSeconds(policy.getWindowSeconds());
        if (!limiter.acquire(scope, weight)) {
            Map<String, Object> metadata = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
            RateLimitViolation violation = limiter.recordViolation(scope, ViolationType.HARD_LIMIT, weight,
                    policy.getMaxRequests(), metadata);
            countViolation(violation);
            log.warn("请求超出限流阈值：policy={}, scope={}, weight={}, limit={}/{}s",
                    policyName, scope, weight, policy.getMaxRequests(), policy.getWindowSeconds());
            return RateLimitResult.builder()
                    .allowed(false)
                    .limitName(policyName)
                    .remainingRequests(0)
                    .resetTime(resetTime)
                    .retryAfterSeconds(policy.getWindowSeconds())
                    .violation(violation)
                    .build();
        }

        Integer remaining = limiter.getRemaining(scope);
        return RateLimitResult.builder()
                .allowed(true)
                .limitName(policyName)
                .remainingRequests(remaining != null ? remaining : 0)
                .resetTime(resetTime)
                .build();
    }

    /**
     * 阻塞等待直到策略放行
     *
     * <p>策略不存在、白名单、策略禁用时立即返回
     *
     * @throws RateLimitException scope 在黑名单中
     * @throws cn.clazs.qguard.exception.RateLimitTimeoutException 超过 maxWait 仍未放行
     */
    public void waitIfNeeded(String policyName, String scope, int weight, Duration maxWait) {
        validate(scope, weight);

        Registration registration = lookup(policyName);
        if (registration == null) {
            log.warn("限流策略不存在，直接放行：policy={}, scope={}", policyName, scope);
            return;
        }
        RateLimitPolicy policy = registration.policy;
        if (policy.isBlacklisted(scope)) {
            throw new RateLimitException(scope, "scope 在黑名单中，无法获取许可：" + scope);
        }
        if (policy.isWhitelisted(scope) || !policy.isEnabled()) {
            return;
        }
        registration.limiter.waitIfNeeded(scope, weight, maxWait);
    }

    private Registration lookup(String policyName) {
        if (policyName == null || policyName.trim().isEmpty()) {
            return null;
        }
        return registrations.get(policyName);
    }

    private void countViolation(RateLimitViolation violation) {
        if (violation == null) {
            return;
        }
        totalViolations.incrementAndGet();
        violationsByType.get(violation.getViolationType()).incrementAndGet();
    }

    private static void validate(String scope, int weight) {
        if (scope == null || scope.trim().isEmpty()) {
            throw new IllegalArgumentException("scope cannot be blank");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0, got: " + weight);
        }
    }

    // ==================== 黑白名单 ====================

    /**
     * @return 策略是否存在
     */
    public boolean addToWhitelist(String policyName, String scope) {
        Registration registration = lookup(policyName);
        if (registration == null) {
            log.warn("限流策略不存在，忽略白名单操作：policy={}, scope={}", policyName, scope);
            return false;
        }
        registration.limiter.addToWhitelist(scope);
        registration.policy.addToWhitelist(scope);
        log.info("加入白名单：policy={}, scope={}", policyName, scope);
        return true;
    }

    public boolean removeFromWhitelist(String policyName, String scope) {
        Registration registration = lookup(policyName);
        if (registration == null) {
            return false;
        }
        registration.policy.removeFromWhitelist(scope);
        registration.limiter.removeFromWhitelist(scope);
        log.info("移出白名单：policy={}, scope={}", policyName, scope);
        return true;
    }

    /**
     * @return 策略是否存在
     */
    public boolean addToBlacklist(String policyName, String scope) {
        Registration registration = lookup(policyName);
        if (registration == null) {
            log.warn("限流策略不存在，忽略黑名单操作：policy={}, scope={}", policyName, scope);
            return false;
        }
        registration.limiter.addToBlacklist(scope);
        registration.policy.addToBlacklist(scope);
        log.warn("加入黑名单：policy={}, scope={}", policyName, scope);
        return true;
    }

    public boolean removeFromBlacklist(String policyName, String scope) {
        Registration registration = lookup(policyName);
        if (registration == null) {
            return false;
        }
        registration.policy.removeFromBlacklist(scope);
        registration.limiter.removeFromBlacklist(scope);
        log.info("移出黑名单：policy={}, scope={}", policyName, scope);
        return true;
    }

    // ==================== 查询与管理 ====================

    /**
     * 查询违规记录
     *
     * @param policyName 策略名；null 表示全部策略
     * @return 违规记录（按时间从旧到新）；策略不存在时返回空列表
     */
    public List<RateLimitViolation> getViolations(String policyName) {
        if (policyName != null) {
            Registration registration = lookup(policyName);
            return registration != null ? registration.limiter.getViolations() : Collections.emptyList();
        }
        List<RateLimitViolation> all = new ArrayList<>();
        registrations.values().forEach(r -> all.addAll(r.limiter.getViolations()));
        all.sort(Comparator.comparing(RateLimitViolation::getTimestamp));
        return all;
    }

    /**
     * 重置策略下指定 scope 的限流状态
     *
     * @return 策略是否存在
     */
    public boolean reset(String policyName, String scope) {
        Registration registration = lookup(policyName);
        if (registration == null) {
            return false;
        }
        registration.limiter.reset(scope);
        log.debug("重置限流状态：policy={}, scope={}", policyName, scope);
        return true;
    }

    public RateLimitPolicy getPolicy(String policyName) {
        Registration registration = lookup(policyName);
        return registration != null ? registration.policy : null;
    }

    public RateLimiter getLimiter(String policyName) {
        Registration registration = lookup(policyName);
        return registration != null ? registration.limiter : null;
    }

    public boolean hasLimit(String policyName) {
        return policyName != null && registrations.containsKey(policyName);
    }

    /**
     * @return 已注册的策略名（按字典序）
     */
    public Set<String> getPolicyNames() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }

    /**
     * 获取统计信息
     */
    public RateLimitStatistics getStatistics() {
        Map<String, Long> byType = new LinkedHashMap<>();
        violationsByType.forEach((type, count) -> {
            if (count.get() > 0) {
                byType.put(type.getCode(), count.get());
            }
        });
        return RateLimitStatistics.builder()
                .totalRequests(totalRequests.get())
                .totalViolations(totalViolations.get())
                .violationsByType(Collections.unmodifiableMap(byType))
                .activeLimits(registrations.size())
                .build();
    }
}
