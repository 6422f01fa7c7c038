package cn.clazs.qguard.limiter;

import cn.clazs.qguard.clock.ManualClock;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FixedWindowRateLimiter 测试类
 */
@DisplayName("FixedWindowRateLimiter 固定窗口测试")
class FixedWindowRateLimiterTest {

    private ManualClock clock;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        limiter = new FixedWindowRateLimiter("fixed", 5, 60, RateLimiterConfig.builder().clock(clock).build());
    }

    @Test
    @DisplayName("端到端：5 次放行，第 6 次拒绝，重置时间为下一个整分钟")
    void testEndToEnd() {
        clock.advance(10_000L);

        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.acquire("ip1"), "第" + (i + 1) + "次请求应该被允许");
        }
        assertFalse(limiter.acquire("ip1"), "第6次请求应该被限流");

        assertEquals(Instant.ofEpochMilli(ManualClock.START + 60_000L), limiter.getResetTime("ip1"));
        assertEquals(RateLimitAlgorithm.FIXED_WINDOW, limiter.getAlgorithm());
    }

    @Test
    @DisplayName("窗口切换：边界一到剩余额度恢复为 maxRequests")
    void testWindowReset() {
        for (int i = 0; i < 5; i++) {
            limiter.acquire("ip1");
        }
        assertEquals(0, limiter.getRemaining("ip1"));

        clock.set(ManualClock.START + 59_999L);
        assertEquals(0, limiter.getRemaining("ip1"), "窗口结束前不应恢复");

        clock.set(ManualClock.START + 60_000L);
        assertEquals(5, limiter.getRemaining("ip1"));
        assertTrue(limiter.acquire("ip1"));
    }

    @Test
    @DisplayName("权重：超出额度时不修改计数")
    void testWeightDoesNotMutateOnDeny() {
        assertTrue(limiter.acquire("ip1", 3));
        assertFalse(limiter.acquire("ip1", 3));
        assertEquals(2, limiter.getRemaining("ip1"));
        assertTrue(limiter.acquire("ip1", 2));
    }

    @Test
    @DisplayName("窗口交界：最多放行 2 × maxRequests")
    void testBoundaryBurst() {
        clock.set(ManualClock.START + 59_000L);
        assertTrue(limiter.acquire("ip1", 5));

        clock.set(ManualClock.START + 60_000L);
        assertTrue(limiter.acquire("ip1", 5));
        assertFalse(limiter.acquire("ip1"));
    }

    @Test
    @DisplayName("重置：reset 清空单个 scope，其他 scope 不受影响")
    void testReset() {
        limiter.acquire("a", 5);
        limiter.acquire("b", 5);

        limiter.reset("a");

        assertEquals(5, limiter.getRemaining("a"));
        assertEquals(0, limiter.getRemaining("b"));

        limiter.resetAll();
        assertEquals(5, limiter.getRemaining("b"));
    }
}
