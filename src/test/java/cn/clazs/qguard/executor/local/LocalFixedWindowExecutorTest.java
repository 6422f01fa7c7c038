package cn.clazs.qguard.executor.local;

import cn.clazs.qguard.core.LimitRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LocalFixedWindowExecutor 测试类
 */
@DisplayName("LocalFixedWindowExecutor 本地固定窗口测试")
class LocalFixedWindowExecutorTest {

    private static final long BASE = 1_700_000_040_000L;

    private LocalFixedWindowExecutor executor;
    private LimitRule rule;

    @BeforeEach
    void setUp() {
        executor = new LocalFixedWindowExecutor();
        rule = LimitRule.window(2, 10_000L);
    }

    @Test
    @DisplayName("窗口对齐：计数在对齐边界清零")
    void testAlignedWindows() {
        assertTrue(executor.tryAcquire("u1", 2, rule, BASE + 9_999L));
        assertFalse(executor.tryAcquire("u1", 1, rule, BASE + 9_999L));

        assertTrue(executor.tryAcquire("u1", 1, rule, BASE + 10_000L));
        assertEquals(1, executor.getRemaining("u1", rule, BASE + 10_000L));
    }

    @Test
    @DisplayName("时钟回拨：沿用较新的窗口计数")
    void testClockRollback() {
        executor.tryAcquire("u1", 2, rule, BASE + 10_000L);

        assertFalse(executor.tryAcquire("u1", 1, rule, BASE + 5_000L));
        assertEquals(0, executor.getRemaining("u1", rule, BASE + 5_000L));
    }

    @Test
    @DisplayName("过期清理：写入时清除已经结束的窗口")
    void testSweepExpiredWindows() {
        executor.tryAcquire("a", 1, rule, BASE);
        executor.tryAcquire("b", 1, rule, BASE);
        assertEquals(2, executor.getTrackedScopeCount());

        executor.tryAcquire("c", 1, rule, BASE + 20_000L);

        assertEquals(1, executor.getTrackedScopeCount());
        assertEquals(2, executor.getRemaining("a", rule, BASE + 20_000L));
    }

    @Test
    @DisplayName("重置：resetAll 清空全部 scope")
    void testResetAll() {
        executor.tryAcquire("a", 2, rule, BASE);
        executor.tryAcquire("b", 2, rule, BASE);

        executor.resetAll();

        assertEquals(2, executor.getRemaining("a", rule, BASE));
        assertEquals(2, executor.getRemaining("b", rule, BASE));
    }
}
