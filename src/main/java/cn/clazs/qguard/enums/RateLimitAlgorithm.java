package cn.clazs.qguard.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 限流算法类型枚举
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum RateLimitAlgorithm {

    /**
     * 固定窗口计数器
     * 窗口边界处最多可能放行 2 倍阈值的请求
     */
    FIXED_WINDOW("fixed_window", "固定窗口"),

    /**
     * 滑动窗口日志（记录每个请求的时间戳）
     */
    SLIDING_WINDOW("sliding_window", "滑动窗口"),

    /**
     * 令牌桶：允许突发，长期速率收敛到配置值
     */
    TOKEN_BUCKET("token_bucket", "令牌桶"),

    /**
     * 漏桶：按恒定速率泄漏
     */
    LEAKY_BUCKET("leaky_bucket", "漏桶"),

    /**
     * 自适应：基于滑动窗口，按使用率动态收紧或放宽阈值
     */
    ADAPTIVE("adaptive", "自适应");

    private final String code;
    private final String description;

    /**
     * 根据代码获取枚举值（同时兼容 "sliding-window" 这种中划线写法）
     *
     * @param code 算法代码
     * @return 对应的算法枚举
     * @throws IllegalArgumentException 如果代码不存在
     */
    public static RateLimitAlgorithm fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().replace('-', '_');
            for (RateLimitAlgorithm algorithm : values()) {
                if (algorithm.code.equalsIgnoreCase(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Unknown algorithm code: " + code);
    }
}
