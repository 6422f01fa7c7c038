package cn.clazs.qguard.limiter;

import lombok.Builder;
import lombok.Value;

/**
 * 自适应限流参数
 *
 * <ul>
 *   <li>剩余比例 &lt; penaltyThreshold 时：factor = max(minFactor, factor × penaltyFactor)</li>
 *   <li>剩余比例 &gt; recoveryThreshold 时：factor = min(maxFactor, factor × recoveryFactor)</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class AdaptiveSettings {

    @Builder.Default
    double penaltyFactor = 0.8;

    @Builder.Default
    double recoveryFactor = 1.05;

    @Builder.Default
    double minFactor = 0.1;

    @Builder.Default
    double maxFactor = 1.0;

    @Builder.Default
    double penaltyThreshold = 0.1;

    @Builder.Default
    double recoveryThreshold = 0.8;

    public static AdaptiveSettings defaults() {
        return AdaptiveSettings.builder().build();
    }

    /**
     * 新 scope 的初始 factor：1.0 收敛到 [minFactor, maxFactor] 内
     */
    public double initialFactor() {
        return Math.min(maxFactor, Math.max(minFactor, 1.0D));
    }

    /**
     * 校验参数
     *
     * @throws IllegalArgumentException 参数不合法
     */
    public AdaptiveSettings validate() {
        if (!(penaltyFactor > 0 && penaltyFactor < 1)) {
            throw new IllegalArgumentException("penaltyFactor must be in (0, 1), got: " + penaltyFactor);
        }
        if (!(recoveryFactor > 1)) {
            throw new IllegalArgumentException("recoveryFactor must be > 1, got: " + recoveryFactor);
        }
        if (!(minFactor > 0 && minFactor <= maxFactor)) {
            throw new IllegalArgumentException("minFactor must be in (0, maxFactor], got: " + minFactor);
        }
        if (!(penaltyThreshold >= 0 && penaltyThreshold < recoveryThreshold && recoveryThreshold <= 1)) {
            throw new IllegalArgumentException(String.format(
                    "thresholds must satisfy 0 <= penaltyThreshold < recoveryThreshold <= 1, got: %s, %s",
                    penaltyThreshold, recoveryThreshold));
        }
        return this;
    }
}
