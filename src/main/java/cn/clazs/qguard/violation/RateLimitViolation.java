package cn.clazs.qguard.violation;

import cn.clazs.qguard.enums.ViolationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 违规记录（不可变）
 *
 * @author clazs
 * @since 1.0.0
 */
@Value
@Builder
public class RateLimitViolation {

    /** 唯一ID（UUID） */
    String violationId;

    /** 被限流的 scope 值 */
    String scope;

    ViolationType violationType;

    Instant timestamp;

    /** 本次请求的权重 */
    int requestsCount;

    /** 被突破的阈值（黑名单时为 0） */
    int limitValue;

    Map<String, Object> metadata;
}
