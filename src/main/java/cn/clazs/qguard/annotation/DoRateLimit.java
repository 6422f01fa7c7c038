package cn.clazs.qguard.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 限流注解
 * 用于标记需要按策略限流的方法
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 按用户限流（SpEL 表达式）
 * @DoRateLimit(policy = "user_requests", key = "#userId")
 * public String getUserInfo(String userId) {
 *     return "info";
 * }
 *
 * // 2. 使用对象属性
 * @DoRateLimit(policy = "api_key_requests", key = "#request.apiKey")
 * public String callApi(ApiRequest request) {
 *     return "response";
 * }
 *
 * // 3. 按权重扣减（一次批量请求算 10 次）
 * @DoRateLimit(policy = "mcp_endpoint", key = "'batch'", weight = 10)
 * public void batchImport(List<Item> items) {
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DoRateLimit {

    /**
     * 策略名（需已在 {@link cn.clazs.qguard.registry.RateLimitRegistry} 中注册；未注册时放行）
     */
    String policy();

    /**
     * scope 值（支持SpEL表达式）
     *
     * <p>SpEL 表达式示例：
     * <ul>
     *     <li>{@code #userId}：按参数 userId 分别计数</li>
     *     <li>{@code #request.apiKey}：按参数 request 的 apiKey 属性计数</li>
     *     <li>{@code 'global'}：所有调用共用一个计数</li>
     * </ul>
     *
     * @return SpEL 表达式或常量字符串
     */
    String key();

    /**
     * 请求权重（默认 1）
     */
    int weight() default 1;

    /**
     * 限流失败时的错误信息（可选）
     */
    String message() default "访问过于频繁，请稍后再试";
}
