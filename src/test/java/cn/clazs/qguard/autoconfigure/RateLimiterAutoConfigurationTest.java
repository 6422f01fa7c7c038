package cn.clazs.qguard.autoconfigure;

import cn.clazs.qguard.aspect.RateLimitAspect;
import cn.clazs.qguard.enums.RateLimitStorage;
import cn.clazs.qguard.factory.RateLimiterFactory;
import cn.clazs.qguard.limiter.FixedWindowRateLimiter;
import cn.clazs.qguard.limiter.TokenBucketRateLimiter;
import cn.clazs.qguard.properties.RateLimiterProperties;
import cn.clazs.qguard.registry.RateLimitRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * RateLimiterAutoConfiguration 测试
 *
 * <p>使用 ApplicationContextRunner 启动最小的 Spring 容器，验证 Bean 注册、配置绑定和条件装配
 *
 * @author clazs
 * @since 1.0.0
 */
@DisplayName("RateLimiterAutoConfiguration 测试")
class RateLimiterAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RateLimiterAutoConfiguration.class));

    // ==================== Bean 创建测试 ====================

    @Test
    @DisplayName("Bean 创建：默认配置下注册工厂、注册中心和切面")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertNotNull(context.getBean(RateLimiterProperties.class));
            assertNotNull(context.getBean(RateLimiterFactory.class));
            assertNotNull(context.getBean(RateLimitAspect.class));

            RateLimitRegistry registry = context.getBean(RateLimitRegistry.class);
            assertTrue(registry.getPolicyNames().isEmpty(), "默认不安装任何策略");
        });
    }

    @Test
    @DisplayName("条件装配：enabled=false 时不注册任何 Bean")
    void testDisabled() {
        contextRunner.withPropertyValues("clazs.qguard.enabled=false").run(context -> {
            assertTrue(context.getBeansOfType(RateLimitRegistry.class).isEmpty());
            assertTrue(context.getBeansOfType(RateLimitAspect.class).isEmpty());
        });
    }

    @Test
    @DisplayName("配置绑定：yml 中声明的策略在启动时注册")
    void testPoliciesFromProperties() {
        contextRunner.withPropertyValues(
                "clazs.qguard.policies[0].name=login",
                "clazs.qguard.policies[0].algorithm=token-bucket",
                "clazs.qguard.policies[0].scope=ip",
                "clazs.qguard.policies[0].max-requests=60",
                "clazs.qguard.policies[0].window-seconds=60",
                "clazs.qguard.policies[0].burst-allowance=10",
                "clazs.qguard.policies[0].blacklist[0]=10.0.0.1"
        ).run(context -> {
            RateLimitRegistry registry = context.getBean(RateLimitRegistry.class);

            assertTrue(registry.hasLimit("login"));
            TokenBucketRateLimiter limiter = (TokenBucketRateLimiter) registry.getLimiter("login");
            assertEquals(70, limiter.getBurstSize());
            assertFalse(registry.checkRateLimit("login", "10.0.0.1").isAllowed());
            assertTrue(registry.checkRateLimit("login", "10.0.0.2").isAllowed());
        });
    }

    @Test
    @DisplayName("配置绑定：启用默认策略")
    void testDefaultPoliciesEnabled() {
        contextRunner.withPropertyValues("clazs.qguard.default-policies-enabled=true").run(context -> {
            RateLimitRegistry registry = context.getBean(RateLimitRegistry.class);
            assertEquals(6, registry.getPolicyNames().size());
            assertTrue(registry.hasLimit("burst_protection"));
        });
    }

    @Test
    @DisplayName("Redis：storage=redis 但没有 RedisTemplate 时退化为本地存储")
    void testRedisWithoutTemplate() {
        contextRunner.withPropertyValues(
                "clazs.qguard.storage=redis",
                "clazs.qguard.policies[0].name=api",
                "clazs.qguard.policies[0].algorithm=fixed_window",
                "clazs.qguard.policies[0].max-requests=10",
                "clazs.qguard.policies[0].window-seconds=60"
        ).run(context -> {
            RateLimiterFactory factory = context.getBean(RateLimiterFactory.class);
            assertEquals(RateLimitStorage.REDIS, factory.getConfig().getStorage());
            assertFalse(factory.getConfig().isDistributed());

            FixedWindowRateLimiter limiter =
                    (FixedWindowRateLimiter) context.getBean(RateLimitRegistry.class).getLimiter("api");
            assertFalse(limiter.isDistributed());
        });
    }

    @Test
    @DisplayName("Redis：容器中存在 RedisTemplate 时启用分布式执行器")
    void testRedisWithTemplate() {
        contextRunner.withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
                .withPropertyValues(
                        "clazs.qguard.storage=redis",
                        "clazs.qguard.redis.key-prefix=app:",
                        "clazs.qguard.policies[0].name=api",
                        "clazs.qguard.policies[0].algorithm=fixed_window",
                        "clazs.qguard.policies[0].max-requests=10",
                        "clazs.qguard.policies[0].window-seconds=60"
                ).run(context -> {
                    RateLimiterFactory factory = context.getBean(RateLimiterFactory.class);
                    assertTrue(factory.getConfig().isDistributed());
                    assertEquals("app:", factory.getConfig().getRedisKeyPrefix());

                    FixedWindowRateLimiter limiter =
                            (FixedWindowRateLimiter) context.getBean(RateLimitRegistry.class).getLimiter("api");
                    assertTrue(limiter.isDistributed());
                });
    }

    @Test
    @DisplayName("本地存储：即使存在 RedisTemplate 也不使用")
    void testLocalStorageIgnoresTemplate() {
        contextRunner.withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
                .run(context -> assertFalse(context.getBean(RateLimiterFactory.class).getConfig().isDistributed()));
    }

    @Test
    @DisplayName("配置校验：非法配置导致启动失败")
    void testInvalidConfiguration() {
        contextRunner.withPropertyValues("clazs.qguard.violation-history-size=0")
                .run(context -> assertNotNull(context.getStartupFailure()));

        contextRunner.withPropertyValues(
                "clazs.qguard.policies[0].name=bad",
                "clazs.qguard.policies[0].algorithm=unknown",
                "clazs.qguard.policies[0].max-requests=10",
                "clazs.qguard.policies[0].window-seconds=60"
        ).run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("用户自定义：已存在的注册中心 Bean 不被覆盖")
    void testUserDefinedRegistry() {
        RateLimitRegistry custom = new RateLimitRegistry(new RateLimiterFactory());
        contextRunner.withBean(RateLimitRegistry.class, () -> custom)
                .run(context -> assertSame(custom, context.getBean(RateLimitRegistry.class)));
    }

    @Test
    @DisplayName("自动配置注册：spring.factories 指向自动配置类")
    void testSpringFactories() throws IOException {
        Properties factories = PropertiesLoaderUtils.loadProperties(
                new ClassPathResource("META-INF/spring.factories"));

        String value = factories.getProperty("org.springframework.boot.autoconfigure.EnableAutoConfiguration");
        assertNotNull(value);
        assertTrue(value.contains(RateLimiterAutoConfiguration.class.getName()));
    }
}
