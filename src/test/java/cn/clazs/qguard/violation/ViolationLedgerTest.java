package cn.clazs.qguard.violation;

import cn.clazs.qguard.enums.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ViolationLedger 测试类
 */
@DisplayName("ViolationLedger 违规台账测试")
class ViolationLedgerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ViolationLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ViolationLedger(3);
    }

    @Test
    @DisplayName("记录：字段完整且 metadata 只读")
    void testRecord() {
        RateLimitViolation v = ledger.record("ip1", ViolationType.HARD_LIMIT, 2, 10,
                Collections.singletonMap("path", "/api"), T0);

        assertNotNull(v);
        assertNotNull(v.getViolationId());
        assertEquals("ip1", v.getScope());
        assertEquals(ViolationType.HARD_LIMIT, v.getViolationType());
        assertEquals(2, v.getRequestsCount());
        assertEquals(10, v.getLimitValue());
        assertEquals(T0, v.getTimestamp());
        assertEquals("/api", v.getMetadata().get("path"));
        assertThrows(UnsupportedOperationException.class, () -> v.getMetadata().put("x", "y"));
    }

    @Test
    @DisplayName("环形队列：超过容量时淘汰最旧的记录")
    void testRingEviction() {
        for (int i = 0; i < 5; i++) {
            ledger.record("s" + i, ViolationType.HARD_LIMIT, 1, 1, null, T0.plusSeconds(i));
        }

        List<RateLimitViolation> all = ledger.query(null, null, null);
        assertEquals(3, all.size(), "长度不应超过容量");
        assertEquals("s2", all.get(0).getScope(), "最旧的两条应被淘汰");
        assertEquals("s4", all.get(2).getScope());
    }

    @Test
    @DisplayName("白名单：不产生违规记录")
    void testWhitelistRecordsNothing() {
        ledger.addToWhitelist("vip");

        assertNull(ledger.record("vip", ViolationType.HARD_LIMIT, 1, 1, null, T0));
        assertEquals(0, ledger.size());
    }

    @Test
    @DisplayName("黑白名单同时存在：黑名单优先，仍然记录")
    void testBlacklistWinsOverWhitelist() {
        ledger.addToWhitelist("both");
        ledger.addToBlacklist("both");

        assertNotNull(ledger.record("both", ViolationType.ABUSE_PATTERN, 1, 0, null, T0));
        assertEquals(1, ledger.size());
    }

    @Test
    @DisplayName("查询：按 scope、类型、时间过滤")
    void testQueryFilters() {
        ledger.record("a", ViolationType.HARD_LIMIT, 1, 1, null, T0);
        ledger.record("a", ViolationType.ABUSE_PATTERN, 1, 0, null, T0.plusSeconds(10));
        ledger.record("b", ViolationType.HARD_LIMIT, 1, 1, null, T0.plusSeconds(20));

        assertEquals(2, ledger.count("a", null, null));
        assertEquals(2, ledger.count(null, ViolationType.HARD_LIMIT, null));
        assertEquals(2, ledger.count(null, null, T0.plusSeconds(10)), "since 边界应包含在内");
        assertEquals(1, ledger.count("a", ViolationType.ABUSE_PATTERN, T0));
    }

    @Test
    @DisplayName("清除：按 scope 清除或全部清除")
    void testClear() {
        ledger.record("a", ViolationType.HARD_LIMIT, 1, 1, null, T0);
        ledger.record("b", ViolationType.HARD_LIMIT, 1, 1, null, T0);

        ledger.clear("a");
        assertEquals(1, ledger.size());
        assertEquals("b", ledger.query(null, null, null).get(0).getScope());

        ledger.clear(null);
        assertEquals(0, ledger.size());
    }

    @Test
    @DisplayName("参数校验：容量必须大于 0")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ViolationLedger(0));
    }

    @Test
    @DisplayName("黑白名单：增删与查询，null 安全")
    void testListsNullSafe() {
        ledger.addToBlacklist("bad");
        assertTrue(ledger.isBlacklisted("bad"));
        ledger.removeFromBlacklist("bad");
        assertFalse(ledger.isBlacklisted("bad"));

        assertFalse(ledger.isWhitelisted(null));
        assertDoesNotThrow(() -> ledger.removeFromWhitelist(null));
    }
}
