package cn.clazs.qguard.autoconfigure;

import cn.clazs.qguard.aspect.RateLimitAspect;
import cn.clazs.qguard.core.RateLimiterConfig;
import cn.clazs.qguard.enums.RateLimitStorage;
import cn.clazs.qguard.factory.RateLimiterFactory;
import cn.clazs.qguard.properties.RateLimiterProperties;
import cn.clazs.qguard.registry.RateLimitRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 限流器自动配置类
 *
 * <p>这是 QGuard Spring Boot Starter 的核心配置类，负责自动创建和注册所需的 Bean
 *
 * <p>自动配置的功能：
 * <ul>
 *     <li>自动注册 {@link RateLimiterProperties} 配置属性 Bean</li>
 *     <li>自动注册 {@link RateLimiterFactory} 限流器工厂 Bean（storage=redis 时注入 {@link StringRedisTemplate}）</li>
 *     <li>自动注册 {@link RateLimitRegistry} 策略注册中心 Bean，并注册 yml 中声明的策略</li>
 *     <li>自动注册 {@link RateLimitAspect} AOP 切面 Bean</li>
 *     <li>支持通过 {@code clazs.qguard.enabled=false} 关闭自动配置</li>
 *     <li>支持用户自定义 Bean 覆盖（@ConditionalOnMissingBean）</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 配置 application.yml
 * clazs:
 *   qguard:
 *     storage: local
 *     policies:
 *       - name: user_requests
 *         algorithm: sliding_window
 *         scope: user
 *         max-requests: 100
 *         window-seconds: 60
 *
 * // 2. 直接使用注解
 * @Service
 * public class UserService {
 *     @DoRateLimit(policy = "user_requests", key = "#userId")
 *     public String getUserInfo(String userId) {
 *         return "info";
 *     }
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 * @see RateLimiterProperties
 * @see RateLimiterFactory
 * @see RateLimitRegistry
 * @see RateLimitAspect
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
@ConditionalOnProperty(prefix = "clazs.qguard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimiterAutoConfiguration {

    /**
     * 注册限流器工厂 Bean
     *
     * <p>storage=redis 但容器中没有 {@link StringRedisTemplate} 时打印告警并使用本地存储
     *
     * @param properties 从 application.yml 读取的配置属性
     * @param redisTemplateProvider Redis 模板（可选）
     * @return 限流器工厂
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimiterFactory rateLimiterFactory(RateLimiterProperties properties,
                                                 ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        // 验证配置
        properties.validate();

        RateLimiterConfig.Builder builder = properties.toConfigBuilder();
        if (properties.getStorage() == RateLimitStorage.REDIS) {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate != null) {
                builder.redisTemplate(redisTemplate);
                log.info("Redis 模板已注入到限流器工厂");
            } else {
                log.warn("storage=redis 但未检测到 StringRedisTemplate，限流器将使用本地存储");
            }
        }

        RateLimiterFactory factory = new RateLimiterFactory(builder.build(), properties.getAdaptive().toSettings());
        log.info("RateLimiterFactory Bean 创建成功，配置：{}", properties.getSummary());
        return factory;
    }

    /**
     * 注册策略注册中心 Bean
     *
     * @param properties 从 application.yml 读取的配置属性
     * @param rateLimiterFactory 限流器工厂
     * @return 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimitRegistry rateLimitRegistry(RateLimiterProperties properties,
                                               RateLimiterFactory rateLimiterFactory) {
        RateLimitRegistry registry = new RateLimitRegistry(rateLimiterFactory, properties.isDefaultPoliciesEnabled());
        properties.getPolicies().forEach(policy -> registry.addLimit(policy.toPolicy()));

        log.info("RateLimitRegistry Bean 创建成功，策略：{}", registry.getPolicyNames());
        return registry;
    }

    /**
     * 注册限流切面 Bean
     *
     * @param registry 策略注册中心
     * @return 限流切面
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimitAspect rateLimitAspect(RateLimitRegistry registry) {
        log.info("初始化 RateLimitAspect Bean");
        return new RateLimitAspect(registry);
    }
}
