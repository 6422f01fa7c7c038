package cn.clazs.qguard.registry;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 注册中心统计快照
 *
 * @author clazs
 * @since 1.0.0
 */
@Value
@Builder
public class RateLimitStatistics {

    /** 针对已注册策略的判定次数 */
    long totalRequests;

    /** 注册中心记录的违规总数 */
    long totalViolations;

    /** 按违规类型（code）统计 */
    Map<String, Long> violationsByType;

    /** 已注册的策略数 */
    int activeLimits;
}
