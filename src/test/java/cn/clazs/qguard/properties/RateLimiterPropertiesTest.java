package cn.clazs.qguard.properties;

import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.LimitScope;
import cn.clazs.qguard.enums.RateLimitAlgorithm;
import cn.clazs.qguard.enums.RateLimitStorage;
import cn.clazs.qguard.limiter.AdaptiveSettings;
import cn.clazs.qguard.registry.RateLimitPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterProperties 测试类
 */
@DisplayName("RateLimiterProperties 配置类测试")
class RateLimiterPropertiesTest {

    private RateLimiterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RateLimiterProperties();
    }

    private static RateLimiterProperties.PolicyProperties policy(String name) {
        RateLimiterProperties.PolicyProperties policy = new RateLimiterProperties.PolicyProperties();
        policy.setName(name);
        policy.setMaxRequests(100);
        policy.setWindowSeconds(60);
        return policy;
    }

    // ==================== 默认值测试 ====================

    @Test
    @DisplayName("默认值：启用、本地存储、不安装默认策略")
    void testDefaults() {
        assertTrue(properties.isEnabled());
        assertEquals(RateLimitStorage.LOCAL, properties.getStorage());
        assertFalse(properties.isDefaultPoliciesEnabled());
        assertEquals(1000, properties.getViolationHistorySize());
        assertEquals(1440L, properties.getCacheExpireAfterAccessMinutes());
        assertEquals(10000L, properties.getCacheMaximumSize());
        assertEquals("qguard:", properties.getRedis().getKeyPrefix());
        assertTrue(properties.getPolicies().isEmpty());
        assertDoesNotThrow(() -> properties.validate());
    }

    @Test
    @DisplayName("默认值：自适应参数与 AdaptiveSettings 默认值一致")
    void testAdaptiveDefaults() {
        assertEquals(AdaptiveSettings.defaults(), properties.getAdaptive().toSettings());
    }

    // ==================== 转换测试 ====================

    @Test
    @DisplayName("策略转换：算法与 scope 代码支持连字符写法")
    void testPolicyConversion() {
        RateLimiterProperties.PolicyProperties source = policy("login");
        source.setAlgorithm("token-bucket");
        source.setScope("api-key");
        source.setBurstAllowance(20);
        source.setEnabled(false);
        source.setWhitelist(Collections.singletonList("vip"));
        source.setBlacklist(Arrays.asList("bad1", "bad2"));

        RateLimitPolicy policy = source.toPolicy();

        assertEquals("login", policy.getName());
        assertEquals(RateLimitAlgorithm.TOKEN_BUCKET, policy.getAlgorithm());
        assertEquals(LimitScope.API_KEY, policy.getScope());
        assertEquals(20, policy.getBurstAllowance());
        assertFalse(policy.isEnabled());
        assertTrue(policy.isWhitelisted("vip"));
        assertEquals(2, policy.getBlacklist().size());
        assertEquals(RateLimitPolicy.DEFAULT_RECOVERY_TIME_SECONDS, policy.getRecoveryTimeSeconds());
    }

    @Test
    @DisplayName("运行时配置：存储、键前缀和缓存参数传递到 RateLimiterConfig")
    void testToConfigBuilder() {
        properties.setStorage(RateLimitStorage.REDIS);
        properties.getRedis().setKeyPrefix("app:");
        properties.setViolationHistorySize(50);
        properties.setCacheMaximumSize(200L);

        RateLimiterConfig config = properties.toConfigBuilder().build();

        assertEquals(RateLimitStorage.REDIS, config.getStorage());
        assertEquals("app:", config.getRedisKeyPrefix());
        assertEquals(50, config.getViolationHistorySize());
        assertEquals(200L, config.getCacheMaximumSize());
        assertFalse(config.isDistributed(), "没有 RedisTemplate 时不启用分布式");
    }

    // ==================== 参数验证测试 ====================

    @Test
    @DisplayName("参数验证：数值参数必须大于 0")
    void testValidateNumbers() {
        properties.setViolationHistorySize(0);
        assertThrows(IllegalArgumentException.class, () -> properties.validate());

        properties.setViolationHistorySize(1000);
        properties.setCacheExpireAfterAccessMinutes(0L);
        assertThrows(IllegalArgumentException.class, () -> properties.validate());

        properties.setCacheExpireAfterAccessMinutes(1L);
        properties.setCacheMaximumSize(-1L);
        assertThrows(IllegalArgumentException.class, () -> properties.validate());
    }

    @Test
    @DisplayName("参数验证：未知的算法代码")
    void testValidateUnknownAlgorithm() {
        RateLimiterProperties.PolicyProperties bad = policy("bad");
        bad.setAlgorithm("round_robin");
        properties.setPolicies(Collections.singletonList(bad));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> properties.validate());
        assertTrue(e.getMessage().contains("round_robin"));
    }

    @Test
    @DisplayName("参数验证：策略参数不合法")
    void testValidateInvalidPolicy() {
        RateLimiterProperties.PolicyProperties bad = policy("bad");
        bad.setWindowSeconds(0);
        properties.setPolicies(Collections.singletonList(bad));

        assertThrows(IllegalArgumentException.class, () -> properties.validate());
    }

    @Test
    @DisplayName("参数验证：策略名重复")
    void testValidateDuplicateNames() {
        properties.setPolicies(Arrays.asList(policy("same"), policy("same")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> properties.validate());
        assertTrue(e.getMessage().contains("same"));
    }

    @Test
    @DisplayName("参数验证：自适应参数不合法")
    void testValidateAdaptive() {
        properties.getAdaptive().setMinFactor(2.0);

        assertThrows(IllegalArgumentException.class, () -> properties.validate());
    }

    @Test
    @DisplayName("摘要：包含存储类型与策略数量")
    void testSummary() {
        properties.setPolicies(Collections.singletonList(policy("p1")));

        String summary = properties.getSummary();
        assertTrue(summary.contains("storage=LOCAL"));
        assertTrue(summary.contains("policies=1"));
    }
}
