package cn.clazs.qguard.limiter;

import cn.clazs.qguard.clock.ManualClock;
import cn.clazs.qguard.core.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LeakyBucketRateLimiter 测试类
 */
@DisplayName("LeakyBucketRateLimiter 漏桶测试")
class LeakyBucketRateLimiterTest {

    private ManualClock clock;
    private LeakyBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        limiter = new LeakyBucketRateLimiter("leaky", 1.0D, 5, RateLimiterConfig.builder().clock(clock).build());
    }

    @Test
    @DisplayName("容量：装满后拒绝，泄漏后放行")
    void testCapacityAndLeak() {
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.acquire("u1"));
        }
        assertFalse(limiter.acquire("u1"));

        clock.advance(1_000L);
        assertTrue(limiter.acquire("u1"));
        assertFalse(limiter.acquire("u1"));
    }

    @Test
    @DisplayName("等待时间：按泄漏速率估算")
    void testTimeUntilAvailable() {
        assertEquals(Duration.ZERO, limiter.getTimeUntilAvailable("u1", 5));

        limiter.acquire("u1", 5);
        long wait = limiter.getTimeUntilAvailable("u1", 2).toMillis();
        assertTrue(wait >= 1_999L && wait <= 2_000L, "两个单位约需 2 秒，实际：" + wait);

        assertNull(limiter.getTimeUntilAvailable("u1", 6), "超过容量的权重永远无法容纳");
    }

    @Test
    @DisplayName("按窗口创建：leakRate = requestsPerWindow / windowSeconds")
    void testPerWindow() {
        LeakyBucketRateLimiter perWindow = LeakyBucketRateLimiter.perWindow("leaky", 500, 60, 525,
                RateLimiterConfig.defaults());

        assertEquals(500D / 60D, perWindow.getLeakRate(), 1e-9);
        assertEquals(525, perWindow.getCapacity());
    }

    @Test
    @DisplayName("参数校验：容量和速率必须大于 0")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new LeakyBucketRateLimiter("leaky", 0D, 5));
        assertThrows(IllegalArgumentException.class, () -> new LeakyBucketRateLimiter("leaky", 1D, 0));
        assertThrows(IllegalArgumentException.class,
                () -> LeakyBucketRateLimiter.perWindow("leaky", 0, 60, 5, RateLimiterConfig.defaults()));
    }
}
