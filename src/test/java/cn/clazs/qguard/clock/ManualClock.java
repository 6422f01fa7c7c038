package cn.clazs.qguard.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试用手动时钟：sleep 直接推进时间，不阻塞线程
 */
public class ManualClock implements Clock {

    /**
     * 2023-11-14T22:14:00Z，对齐到整分钟
     */
    public static final long START = 1_700_000_040_000L;

    private final AtomicLong now;

    public ManualClock() {
        this(START);
    }

    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    @Override
    public void sleep(long millis) {
        now.addAndGet(millis);
    }

    public void advance(long millis) {
        now.addAndGet(millis);
    }

    public void set(long millis) {
        now.set(millis);
    }
}
