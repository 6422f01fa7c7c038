package cn.clazs.qguard.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 等待许可超时
 *
 * <p>由 {@code waitIfNeeded} 在 maxWait 耗尽仍未获取到许可时抛出，用于和"直接拒绝"区分
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitTimeoutException extends RateLimitException {

    @Getter
    private final Duration maxWait;

    public RateLimitTimeoutException(String limitKey, Duration maxWait) {
        super(limitKey, "Rate limit wait exceeded " + maxWait.toMillis() + "ms for scope " + limitKey);
        this.maxWait = maxWait;
    }

    public RateLimitTimeoutException(String limitKey, Duration maxWait, InterruptedException cause) {
        super(limitKey, "Rate limit wait interrupted for scope " + limitKey, cause);
        this.maxWait = maxWait;
    }
}
