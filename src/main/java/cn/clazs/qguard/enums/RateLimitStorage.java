package cn.clazs.qguard.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 限流存储类型枚举
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum RateLimitStorage {

    /**
     * 进程内存储，状态保存在 Caffeine 缓存中
     */
    LOCAL("local", "本地内存"),

    /**
     * Redis 存储（基于 Redis String/ZSet/Hash + Lua 脚本）
     * Redis 不可用时单次调用自动降级到本地内存
     */
    REDIS("redis", "Redis");

    private final String code;
    private final String description;
}
