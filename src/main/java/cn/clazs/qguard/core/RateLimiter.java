package cn.clazs.qguard.core;

import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.enums.ViolationType;
import cn.clazs.qguard.violation.RateLimitViolation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 限流器统一接口
 *
 * <p>所有算法（固定窗口、滑动窗口、令牌桶、漏桶、自适应）都实现此接口，
 * 由 {@link cn.clazs.qguard.registry.RateLimitRegistry} 按策略统一调度
 *
 * @author clazs
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * @return 限流器名称（通常为策略名）
     */
    String getName();

    /**
     * @return 算法类型
     */
    RateLimitAlgorithm getAlgorithm();

    /**
     * 尝试获取 1 个许可
     *
     * @param scope scope 值（IP、用户ID、API Key 等）
     * @return true-允许通过, false-被限流
     */
    default boolean acquire(String scope) {
        return acquire(scope, 1);
    }

    /**
     * 尝试获取 weight 个许可，只有放行时才修改状态
     *
     * <p>黑名单中的 scope 永远返回 false（并记录 ABUSE_PATTERN 违规），白名单中的 scope 永远返回 true
     *
     * @param scope scope 值
     * @param weight 请求权重（必须 > 0）
     * @return true-允许通过, false-被限流
     * @throws IllegalArgumentException scope 为空或 weight <= 0
     */
    boolean acquire(String scope, int weight);

    /**
     * 阻塞等待直到获取到许可
     *
     * <p>在两次尝试之间休眠（不持有限流器内部锁），超过 maxWait 抛出超时异常
     *
     * @param scope scope 值
     * @param weight 请求权重
     * @param maxWait 最长等待时间
     * @throws cn.clazs.qguard.exception.RateLimitTimeoutException 等待超时或线程被中断
     * @throws cn.clazs.qguard.exception.RateLimitException scope 在黑名单中
     */
    void waitIfNeeded(String scope, int weight, Duration maxWait);

    /**
     * 查询剩余额度
     *
     * @param scope scope 值
     * @return 剩余额度；不支持时返回 null
     */
    Integer getRemaining(String scope);

    /**
     * 重置指定 scope 的状态
     */
    void reset(String scope);

    /**
     * 重置全部 scope 的状态
     */
    void resetAll();

    // ==================== 黑白名单 ====================

    void addToWhitelist(String scope);

    void removeFromWhitelist(String scope);

    void addToBlacklist(String scope);

    void removeFromBlacklist(String scope);

    boolean isWhitelisted(String scope);

    boolean isBlacklisted(String scope);

    // ==================== 违规记录 ====================

    /**
     * 记录一次违规
     *
     * @param scope scope 值
     * @param type 违规类型
     * @param requestsCount 请求权重
     * @param limitValue 被突破的阈值
     * @param metadata 附加信息（可为 null）
     * @return 违规记录；白名单 scope 返回 null
     */
    RateLimitViolation recordViolation(String scope, ViolationType type, int requestsCount, int limitValue,
                                       Map<String, Object> metadata);

    /**
     * @return 全部违规记录（从旧到新）
     */
    default List<RateLimitViolation> getViolations() {
        return getViolations(null, null, null);
    }

    /**
     * 按条件查询违规记录，参数为 null 表示不过滤
     */
    List<RateLimitViolation> getViolations(String scope, ViolationType type, Instant since);

    int getViolationCount(String scope, ViolationType type, Instant since);

    /**
     * 清除违规记录
     *
     * @param scope 只清除该 scope；null 表示全部
     */
    void clearViolations(String scope);
}
