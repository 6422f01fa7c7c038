package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimitRule;
import cn.clazs.qguard.util.TimestampUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 本地固定窗口执行器
 *
 * <p>时间按 floor(now / window) * window 对齐分段，每个 scope 只保存当前窗口的计数
 * <p>写入时顺带清理已过期的窗口（每个窗口长度最多清理一次）
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class LocalFixedWindowExecutor extends AbstractLocalExecutor<LocalFixedWindowExecutor.Window> {

    /**
     * 单个 scope 的窗口计数
     */
    static final class Window {
        /** 窗口起始时间戳 */
        final long windowStart;

        /** 窗口结束时间戳（过期时间） */
        final long expires;

        /** 当前窗口已放行的请求数 */
        int count;

        Window(long windowStart, long expires) {
            this.windowStart = windowStart;
            this.expires = expires;
        }
    }

    /** 上一次清理的时间戳 */
    private long lastSweepMillis;

    public LocalFixedWindowExecutor() {
        this(DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    public LocalFixedWindowExecutor(long expireAfterAccessMinutes, long maximumSize) {
        super(expireAfterAccessMinutes, maximumSize);
    }

    @Override
    public boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis) {
        long windowStart = TimestampUtil.windowStart(nowMillis, rule.getWindowMillis());

        return locked(() -> {
            sweepExpired(nowMillis, rule.getWindowMillis());

            Window window = stateCache.getIfPresent(key);
            int current = currentCount(window, windowStart);
            if (current + permits > rule.getLimit()) {
                return false;
            }

            if (window == null || window.windowStart < windowStart) {
                window = new Window(windowStart, windowStart + rule.getWindowMillis());
                stateCache.put(key, window);
            }
            window.count += permits;
            return true;
        });
    }

    @Override
    public int getRemaining(String key, LimitRule rule, long nowMillis) {
        long windowStart = TimestampUtil.windowStart(nowMillis, rule.getWindowMillis());
        return locked(() -> {
            int current = currentCount(stateCache.getIfPresent(key), windowStart);
            return Math.max(0, rule.getLimit() - current);
        });
    }

    /**
     * 窗口已切换时计数视为 0；时钟回拨时沿用较新的窗口
     */
    private static int currentCount(Window window, long windowStart) {
        if (window == null || window.windowStart < windowStart) {
            return 0;
        }
        return window.count;
    }

    private void sweepExpired(long nowMillis, long windowMillis) {
        if (nowMillis - lastSweepMillis < windowMillis) {
            return;
        }
        lastSweepMillis = nowMillis;
        long before = stateCache.estimatedSize();
        stateCache.asMap().values().removeIf(w -> w.expires <= nowMillis);
        if (log.isDebugEnabled()) {
            log.debug("清理过期窗口：before={}, after={}", before, stateCache.estimatedSize());
        }
    }
}
