package cn.clazs.qguard.aspect;

import cn.clazs.qguard.annotation.DoRateLimit;
import cn.clazs.qguard.exception.RateLimitException;
import cn.clazs.qguard.registry.RateLimitRegistry;
import cn.clazs.qguard.registry.RateLimitResult;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流切面
 * 拦截标注了 @DoRateLimit 注解的方法，按策略进行限流控制
 *
 * <p>核心功能：
 * <ul>
 *     <li>解析 SpEL 表达式得到 scope 值</li>
 *     <li>以 {method, class} 作为上下文调用 {@link RateLimitRegistry#checkRateLimit}</li>
 *     <li>被拒绝时抛出携带判定结果的 {@link RateLimitException}</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Aspect
public class RateLimitAspect {

    /**
     * 限流策略注册中心
     */
    private final RateLimitRegistry rateLimitRegistry;

    /**
     * SpEL 表达式解析器
     */
    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * 已解析的表达式缓存
     */
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    /**
     * 参数名称发现器（用于获取方法参数名）
     */
    private final ParameterNameDiscoverer nameDiscoverer = new DefaultParameterNameDiscoverer();

    public RateLimitAspect(RateLimitRegistry rateLimitRegistry) {
        this.rateLimitRegistry = rateLimitRegistry;
    }

    /**
     * 拦截标注了 {@link DoRateLimit} 的方法，先按策略放行判定再执行目标方法
     *
     * @param joinPoint AOP连接点
     * @param doRateLimit 限流注解
     * @throws Throwable 目标方法抛出的异常，或被拒绝时的 {@link RateLimitException}
     */
    @Around("@annotation(doRateLimit)")
    public Object around(ProceedingJoinPoint joinPoint, DoRateLimit doRateLimit) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String scope = parseKey(doRateLimit.key(), method, joinPoint.getArgs());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("method", method.getName());
        context.put("class", method.getDeclaringClass().getName());

        RateLimitResult result = rateLimitRegistry.checkRateLimit(doRateLimit.policy(), scope, doRateLimit.weight(),
                context);
        if (!result.isAllowed()) {
            log.warn("限流触发：policy={}, scope={}, method={}.{}, retryAfter={}s",
                    doRateLimit.policy(), scope, method.getDeclaringClass().getSimpleName(), method.getName(),
                    result.getRetryAfterSeconds());
            throw new RateLimitException(scope, doRateLimit.message(), result);
        }

        if (log.isDebugEnabled()) {
            log.debug("限流放行：policy={}, scope={}, remaining={}",
                    doRateLimit.policy(), scope, result.getRemainingRequests());
        }
        return joinPoint.proceed();
    }

    /**
     * 解析 SpEL 表达式获取 scope 值
     *
     * <p>支持以下表达式：
     * <ul>
     *     <li>{@code #userId}：取参数 userId</li>
     *     <li>{@code #request.apiKey}：取参数 request 的 apiKey 属性</li>
     *     <li>{@code 'global'}：单引号包裹的字面量</li>
     * </ul>
     *
     * @throws IllegalArgumentException 表达式结果为 null
     */
    private String parseKey(String keyExpression, Method method, Object[] args) {
        // 如果表达式不包含 # 也不含单引号，则认为是常量字符串，直接返回
        if (!keyExpression.contains("#") && !keyExpression.contains("'")) {
            return keyExpression;
        }

        EvaluationContext context = new StandardEvaluationContext();
        String[] parameterNames = nameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        Expression expression = expressionCache.computeIfAbsent(keyExpression, parser::parseExpression);
        Object value = expression.getValue(context);
        if (value == null) {
            throw new IllegalArgumentException("限流 Key 表达式求值为 null: " + keyExpression);
        }
        return value.toString();
    }
}
