package cn.clazs.qguard.exception;

import cn.clazs.qguard.registry.RateLimitResult;
import lombok.Getter;

/**
 * 限流异常
 * 当请求被拒绝、且调用方选择以异常形式感知时抛出（如 {@code @DoRateLimit} 切面）
 *
 * <p>注意：引擎内部把"拒绝"视为正常结果（acquire 返回 false），不会主动抛出此异常
 *
 * <p>使用示例：
 * <pre>
 * try {
 *     // 业务代码
 * } catch (RateLimitException e) {
 *     log.warn("限流触发：scope={}, retryAfter={}s", e.getLimitKey(), e.getRetryAfterSeconds());
 *     return "请求过于频繁，请稍后再试";
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitException extends RuntimeException {

    /**
     * 限流的 Key（scope 值：IP、用户ID、API Key 等）
     */
    @Getter
    private final String limitKey;

    /**
     * 限流判定结果，可能为 null
     */
    @Getter
    private final transient RateLimitResult result;

    /**
     * @param limitKey 限流的 Key
     */
    public RateLimitException(String limitKey) {
        this(limitKey, "访问过于频繁，请稍后再试", (RateLimitResult) null);
    }

    /**
     * @param limitKey 限流的 Key
     * @param message  错误提示信息
     */
    public RateLimitException(String limitKey, String message) {
        this(limitKey, message, (RateLimitResult) null);
    }

    /**
     * @param limitKey 限流的 Key
     * @param message  错误提示信息
     * @param result   限流判定结果
     */
    public RateLimitException(String limitKey, String message, RateLimitResult result) {
        super(message);
        this.limitKey = limitKey;
        this.result = result;
    }

    protected RateLimitException(String limitKey, String message, Throwable cause) {
        super(message, cause);
        this.limitKey = limitKey;
        this.result = null;
    }

    /**
     * @return 建议的重试间隔（秒），未知时返回 null
     */
    public Integer getRetryAfterSeconds() {
        return result != null ? result.getRetryAfterSeconds() : null;
    }

    @Override
    public String toString() {
        return String.format("%s{limitKey='%s', message='%s'}", getClass().getSimpleName(), limitKey, getMessage());
    }
}
