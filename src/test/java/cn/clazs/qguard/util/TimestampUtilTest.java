package cn.clazs.qguard.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimestampUtil 测试类
 */
@DisplayName("TimestampUtil 时间窗口工具测试")
class TimestampUtilTest {

    @Test
    @DisplayName("窗口起点：向下对齐到窗口长度的整数倍")
    void testWindowStart() {
        assertEquals(120_000L, TimestampUtil.windowStart(179_999L, 60_000L));
        assertEquals(180_000L, TimestampUtil.windowStart(180_000L, 60_000L));
        assertEquals(-60_000L, TimestampUtil.windowStart(-1L, 60_000L), "负数时间同样向下对齐");
    }

    @Test
    @DisplayName("下一个边界：当前窗口起点 + 窗口长度")
    void testNextWindowBoundary() {
        assertEquals(180_000L, TimestampUtil.nextWindowBoundary(125_000L, 60_000L));
        assertEquals(240_000L, TimestampUtil.nextWindowBoundary(180_000L, 60_000L));
    }

    @Test
    @DisplayName("参数校验：窗口长度必须大于 0")
    void testInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> TimestampUtil.windowStart(1L, 0L));
    }

    @Test
    @DisplayName("秒转毫秒：溢出时抛出异常")
    void testSecondsToMillis() {
        assertEquals(60_000L, TimestampUtil.secondsToMillis(60L));
        assertThrows(ArithmeticException.class, () -> TimestampUtil.secondsToMillis(Long.MAX_VALUE));
    }
}
