package cn.clazs.qguard.limiter;

import lombok.Builder;
import lombok.Value;

/**
 * 自适应限流器统计快照
 *
 * @author clazs
 * @since 1.0.0
 */
@Value
@Builder
public class AdaptiveStatistics {

    /** 累计惩罚次数 */
    long totalPenalties;

    /** 累计恢复次数 */
    long totalRecoveries;

    /** 当前处于惩罚中（factor &lt; maxFactor）的 scope 数 */
    int activePenalties;

    /** 当前跟踪的 scope 数 */
    int trackedScopes;

    /** factor &lt; 1.0 的 scope 数 */
    int penalizedScopes;

    /** 平均 factor，没有跟踪任何 scope 时为 1.0 */
    double averageFactor;
}
