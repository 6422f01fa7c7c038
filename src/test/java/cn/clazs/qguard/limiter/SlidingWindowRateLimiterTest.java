package cn.clazs.qguard.limiter;

import cn.clazs.qguard.clock.ManualClock;
import cn.clazs.qguard.core.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SlidingWindowRateLimiter 测试类
 */
@DisplayName("SlidingWindowRateLimiter 滑动窗口测试")
class SlidingWindowRateLimiterTest {

    private ManualClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        limiter = new SlidingWindowRateLimiter("sliding", 3, 10, RateLimiterConfig.builder().clock(clock).build());
    }

    @Test
    @DisplayName("精度：只淘汰 ts < now - window 的记录")
    void testPrecision() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.acquire("u1"));
        }
        assertFalse(limiter.acquire("u1"));

        clock.advance(5_000L);
        assertFalse(limiter.acquire("u1"), "窗口内仍有 3 条记录");

        clock.set(ManualClock.START + 10_000L);
        assertEquals(0, limiter.getRemaining("u1"), "ts == now - window 的记录仍在窗口内");

        clock.set(ManualClock.START + 10_001L);
        assertEquals(3, limiter.getRemaining("u1"));
        assertTrue(limiter.acquire("u1"));
    }

    @Test
    @DisplayName("滑动：旧请求逐个过期")
    void testRollingExpiry() {
        assertTrue(limiter.acquire("u1"));
        clock.advance(4_000L);
        assertTrue(limiter.acquire("u1"));
        assertTrue(limiter.acquire("u1"));
        assertFalse(limiter.acquire("u1"));

        // 第一条在 START，START + 10001 时过期
        clock.set(ManualClock.START + 10_001L);
        assertTrue(limiter.acquire("u1"));
        assertFalse(limiter.acquire("u1"));
    }

    @Test
    @DisplayName("权重：weight 个时间戳一起写入，超限时不写入")
    void testWeight() {
        assertTrue(limiter.acquire("u1", 2));
        assertFalse(limiter.acquire("u1", 2));
        assertEquals(1, limiter.getRemaining("u1"));
    }

    @Test
    @DisplayName("阈值覆盖：以更小的阈值判定")
    void testCeilingOverride() {
        assertTrue(limiter.tryAcquire("u1", 1, 1));
        assertFalse(limiter.tryAcquire("u1", 1, 1));
        assertEquals(0, limiter.getRemaining("u1", 1));
        assertEquals(2, limiter.getRemaining("u1"));
    }

    @Test
    @DisplayName("参数校验：scope 为空或权重非正时抛出异常")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire(" "));
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire(null));
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire("u1", 0));
        assertEquals(3, limiter.getRemaining("u1"), "校验失败不应修改状态");
    }
}
