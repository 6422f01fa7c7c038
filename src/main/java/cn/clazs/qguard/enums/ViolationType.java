package cn.clazs.qguard.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 违规类型
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum ViolationType {

    SOFT_LIMIT("soft_limit", "软限制"),

    /** 超过策略阈值被拒绝 */
    HARD_LIMIT("hard_limit", "硬限制"),

    BURST_LIMIT("burst_limit", "突发限制"),

    /** 命中黑名单 */
    ABUSE_PATTERN("abuse_pattern", "滥用");

    private final String code;
    private final String description;
}
