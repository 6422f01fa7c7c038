package cn.clazs.qguard.registry;

import cn.clazs.qguard.violation.RateLimitViolation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 一次限流判定的结果
 *
 * @author clazs
 * @since 1.0.0
 */
@Value
@Builder
public class RateLimitResult {

    /** 是否放行 */
    boolean allowed;

    /** 策略名 */
    String limitName;

    /** 剩余额度，-1 表示不限（白名单、禁用、策略不存在） */
    int remainingRequests;

    /** 额度预计恢复的时间 */
    Instant resetTime;

    /** 建议的重试间隔（秒），放行时为 null */
    Integer retryAfterSeconds;

    /** 本次产生的违规记录，可能为 null */
    RateLimitViolation violation;

    /** 附加信息（如 reason=whitelisted） */
    @Singular("meta")
    Map<String, Object> metadata;
}
