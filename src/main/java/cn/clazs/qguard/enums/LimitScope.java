package cn.clazs.qguard.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 限流范围（策略作用在哪一类标识上）
 *
 * <p>引擎本身不解析 scope 值，只做相等比较；这里的类型用于策略描述和调用方选择 scope 值
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum LimitScope {

    /** 全局共享一个额度 */
    GLOBAL("global", "全局"),

    /** 按客户端 IP */
    IP("ip", "IP"),

    /** 按用户 ID */
    USER("user", "用户"),

    /** 按 API Key */
    API_KEY("api_key", "API Key"),

    /** 按接口 */
    ENDPOINT("endpoint", "接口"),

    /** 组合键（如 用户+接口） */
    COMBINED("combined", "组合");

    private final String code;
    private final String description;

    /**
     * 根据代码获取枚举值
     *
     * @param code 范围代码
     * @return 对应的范围枚举
     * @throws IllegalArgumentException 如果代码不存在
     */
    public static LimitScope fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().replace('-', '_');
            for (LimitScope scope : values()) {
                if (scope.code.equalsIgnoreCase(normalized)) {
                    return scope;
                }
            }
        }
        throw new IllegalArgumentException("Unknown scope code: " + code);
    }
}
