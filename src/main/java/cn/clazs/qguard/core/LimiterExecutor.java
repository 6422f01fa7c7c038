package cn.clazs.qguard.core;

/**
 * 限流执行器接口
 *
 * <p>这是桥接模式的核心接口，定义了"如何在特定存储介质上执行限流算法"
 * 每个实现类代表一种"算法+存储"的组合：
 * <ul>
 *   <li>{@code executor.local}：本地内存实现，同一实例内所有 scope 共用一把锁</li>
 *   <li>{@code executor.redis}：Redis 实现，通过 Lua 脚本保证原子性；
 *       Redis 异常统一转换为 {@link cn.clazs.qguard.exception.BackendUnavailableException}</li>
 * </ul>
 *
 * <p>设计原则：
 * <ul>
 *   <li>无业务状态：限流状态全部保存在存储介质中（内存/Redis）</li>
 *   <li>线程安全：实现类必须保证并发安全</li>
 *   <li>原子性：tryAcquire 操作必须是原子的，且只有放行时才修改状态</li>
 *   <li>时间由调用方传入，便于测试和跨进程保持一致</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
public interface LimiterExecutor {

    /**
     * 尝试获取许可
     *
     * @param key 限流键（scope 值，如 user:123、10.0.0.1）
     * @param permits 本次请求的权重（> 0）
     * @param rule 限流参数
     * @param nowMillis 当前时间戳（毫秒）
     * @return true-允许通过, false-被限流
     */
    boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis);

    /**
     * 查询剩余额度（不消耗许可）
     *
     * @param key 限流键
     * @param rule 限流参数
     * @param nowMillis 当前时间戳（毫秒）
     * @return 剩余额度，范围 [0, rule.limit]
     */
    int getRemaining(String key, LimitRule rule, long nowMillis);

    /**
     * 重置指定 key 的限流状态
     *
     * @param key 限流键
     */
    void reset(String key);

    /**
     * 重置全部限流状态
     */
    void resetAll();
}
