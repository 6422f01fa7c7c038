package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimitRule;

/**
 * 本地滑动窗口执行器
 *
 * <p>基于环形数组 + 二分查找保存每个 scope 已放行请求的时间戳（从旧到新）
 * <p>每次读写前先淘汰 {@code ts < now - window} 的时间戳，因此窗口内计数精确
 * <p>空间复杂度：O(窗口内请求数)，数组不够时按 1.5 倍扩容
 *
 * @author clazs
 * @since 1.0.0
 */
public class LocalSlidingWindowExecutor extends AbstractLocalExecutor<LocalSlidingWindowExecutor.RingBuffer> {

    /**
     * 环形缓冲区：存储单个 scope 的时间戳
     */
    static final class RingBuffer {
        /** 时间戳数组（环形缓冲区） */
        long[] timestamps;

        /** 当前有效元素数量 */
        int size;

        /** 指向最旧的元素（逻辑索引0） */
        int head;

        RingBuffer(int capacity) {
            this.timestamps = new long[Math.max(1, capacity)];
        }

        int capacity() {
            return timestamps.length;
        }

        /**
         * 获取逻辑索引对应的时间戳
         *
         * @param logicalIndex 逻辑索引（0=最旧，size-1=最新）
         */
        long getLogical(int logicalIndex) {
            if (logicalIndex < 0 || logicalIndex >= size) {
                throw new IndexOutOfBoundsException("Index: " + logicalIndex + ", Size: " + size);
            }
            return timestamps[(head + logicalIndex) % capacity()];
        }

        /**
         * 二分查找：找到逻辑索引中第一个时间戳 >= target 的位置
         *
         * @return 范围 [0, size]
         */
        int lowerBound(long target) {
            int l = 0, r = size - 1;

            while (l <= r) {
                int mid = l + ((r - l) >> 1); // 防溢出
                if (getLogical(mid) < target)
                    l = mid + 1;
                else
                    r = mid - 1;
            }

            return l;
        }

        /**
         * 淘汰所有早于 cutoff 的时间戳
         */
        void evictBefore(long cutoff) {
            if (size == 0) {
                return;
            }
            int expired = lowerBound(cutoff);
            head = (head + expired) % capacity();
            size -= expired;
        }

        /**
         * 追加 count 个相同的时间戳
         */
        void append(long timestamp, int count) {
            ensureCapacity(size + count);
            for (int i = 0; i < count; i++) {
                timestamps[(head + size) % capacity()] = timestamp;
                size++;
            }
        }

        long newest() {
            return getLogical(size - 1);
        }

        private void ensureCapacity(int required) {
            if (required <= capacity()) {
                return;
            }
            int newCapacity = Math.max(required, capacity() + (capacity() >> 1));
            long[] copy = new long[newCapacity];
            for (int i = 0; i < size; i++) {
                copy[i] = getLogical(i);
            }
            timestamps = copy;
            head = 0;
        }
    }

    public LocalSlidingWindowExecutor() {
        this(DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    public LocalSlidingWindowExecutor(long expireAfterAccessMinutes, long maximumSize) {
        super(expireAfterAccessMinutes, maximumSize);
    }

    @Override
    public boolean tryAcquire(String key, int permits, LimitRule rule, long nowMillis) {
        return locked(() -> {
            RingBuffer buffer = stateCache.get(key, k -> new RingBuffer(rule.getLimit()));

            // 时钟回拨检测与修正
            long currentTime = nowMillis;
            if (buffer.size > 0 && currentTime < buffer.newest()) {
                currentTime = buffer.newest();
            }

            buffer.evictBefore(currentTime - rule.getWindowMillis());
            if (buffer.size + permits > rule.getLimit()) {
                return false;
            }

            buffer.append(currentTime, permits);
            return true;
        });
    }

    @Override
    public int getRemaining(String key, LimitRule rule, long nowMillis) {
        return locked(() -> {
            RingBuffer buffer = stateCache.getIfPresent(key);
            if (buffer == null) {
                return rule.getLimit();
            }
            buffer.evictBefore(nowMillis - rule.getWindowMillis());
            return Math.max(0, rule.getLimit() - buffer.size);
        });
    }

    /**
     * 查询窗口内的请求数（测试与监控用）
     */
    public int getCurrentCount(String key, LimitRule rule, long nowMillis) {
        return rule.getLimit() - getRemaining(key, rule, nowMillis);
    }
}
