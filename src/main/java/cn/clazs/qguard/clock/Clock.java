package cn.clazs.qguard.clock;

/**
 * 时间源
 *
 * <p>所有限流器都通过它读取当前时间并在等待重试时休眠，测试中可替换为手动推进的实现
 *
 * @author clazs
 * @since 1.0.0
 */
public interface Clock {

    /**
     * @return 当前时间戳（毫秒）
     */
    long currentTimeMillis();

    /**
     * 休眠指定毫秒数
     *
     * @param millis 休眠时长（毫秒）
     * @throws InterruptedException 线程被中断
     */
    void sleep(long millis) throws InterruptedException;
}
