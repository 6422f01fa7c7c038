package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimiterExecutor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 本地执行器基类
 *
 * <p>scope 状态表基于 Caffeine 缓存：长时间不访问的 scope 自动清除，最大数量受限（防止恶意 key 刷爆内存）
 * <p>线程安全：同一执行器实例内所有 scope 共用一把 ReentrantLock，临界区为 O(1) 或 O(窗口大小)
 *
 * @param <S> 单个 scope 的状态类型
 * @author clazs
 * @since 1.0.0
 */
public abstract class AbstractLocalExecutor<S> implements LimiterExecutor {

    /**
     * 默认缓存过期时间（分钟）
     */
    protected static final long DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES = 1440;

    /**
     * 默认缓存最大容量
     */
    protected static final long DEFAULT_CACHE_MAXIMUM_SIZE = 10_000;

    /**
     * scope 状态表：key -> 状态
     */
    protected final Cache<String, S> stateCache;

    /**
     * 保护 stateCache 及其中所有状态对象的锁
     */
    private final ReentrantLock lock = new ReentrantLock();

    protected AbstractLocalExecutor(long expireAfterAccessMinutes, long maximumSize) {
        this.stateCache = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * 在锁内执行
     */
    protected <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset(String key) {
        locked(() -> {
            stateCache.invalidate(key);
            return null;
        });
    }

    @Override
    public void resetAll() {
        locked(() -> {
            stateCache.invalidateAll();
            return null;
        });
    }

    /**
     * @return 当前缓存的 scope 数量（估算值）
     */
    public long getTrackedScopeCount() {
        return stateCache.estimatedSize();
    }

    /**
     * 把浮点额度转换为整数剩余额度，结果落在 [0, limit]
     */
    protected static int clampRemaining(double remaining, int limit) {
        if (remaining <= 0) {
            return 0;
        }
        return (int) Math.min(limit, Math.floor(remaining));
    }
}
