package cn.clazs.qguard.exception;

/**
 * 分布式存储不可用（连接失败、超时、脚本执行错误等）
 *
 * <p>由 Redis 执行器抛出，在限流器边界被捕获并降级到本地内存，不会传播给调用方
 *
 * @author clazs
 * @since 1.0.0
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
