package cn.clazs.qguard.violation;

import cn.clazs.qguard.enums.ViolationType;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 违规台账 + 黑白名单
 *
 * <p>每个限流器实例持有一个台账：
 * <ul>
 *   <li>违规记录保存在固定容量的环形队列中，满了之后淘汰最旧的记录</li>
 *   <li>白名单/黑名单为并发 Set，读操作无锁</li>
 * </ul>
 *
 * <p>白名单中的 scope 不会产生违规记录；同时在黑白名单中的 scope 以黑名单为准
 *
 * @author clazs
 * @since 1.0.0
 */
public class ViolationLedger {

    /**
     * 默认违规记录容量
     */
    public static final int DEFAULT_CAPACITY = 1000;

    @Getter
    private final int capacity;

    /** 违规记录（最旧的在队头） */
    private final Deque<RateLimitViolation> violations;

    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> whitelist = ConcurrentHashMap.newKeySet();

    private final Set<String> blacklist = ConcurrentHashMap.newKeySet();

    public ViolationLedger() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity 违规记录容量（必须 > 0）
     */
    public ViolationLedger(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Violation capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.violations = new ArrayDeque<>(Math.min(capacity, 64));
    }

    // ==================== 黑白名单 ====================

    public void addToWhitelist(String scope) {
        whitelist.add(scope);
    }

    public void removeFromWhitelist(String scope) {
        if (scope != null) {
            whitelist.remove(scope);
        }
    }

    public void addToBlacklist(String scope) {
        blacklist.add(scope);
    }

    public void removeFromBlacklist(String scope) {
        if (scope != null) {
            blacklist.remove(scope);
        }
    }

    public boolean isWhitelisted(String scope) {
        return scope != null && whitelist.contains(scope);
    }

    public boolean isBlacklisted(String scope) {
        return scope != null && blacklist.contains(scope);
    }

    // ==================== 违规记录 ====================

    /**
     * 记录一次违规
     *
     * @param scope 被限流的 scope
     * @param type 违规类型
     * @param requestsCount 请求权重
     * @param limitValue 被突破的阈值
     * @param metadata 附加信息（可为 null）
     * @param timestamp 违规发生时间
     * @return 新建的违规记录；scope 在白名单（且不在黑名单）中时返回 null
     */
    public RateLimitViolation record(String scope, ViolationType type, int requestsCount, int limitValue,
                                     Map<String, Object> metadata, Instant timestamp) {
        if (isWhitelisted(scope) && !isBlacklisted(scope)) {
            return null;
        }

        RateLimitViolation violation = RateLimitViolation.builder()
                .violationId(UUID.randomUUID().toString())
                .scope(scope)
                .violationType(type)
                .timestamp(timestamp)
                .requestsCount(requestsCount)
                .limitValue(limitValue)
                .metadata(metadata == null || metadata.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();

        lock.lock();
        try {
            if (violations.size() >= capacity) {
                violations.pollFirst();
            }
            violations.addLast(violation);
        } finally {
            lock.unlock();
        }
        return violation;
    }

    /**
     * 按条件查询违规记录，结果按时间从旧到新排列
     *
     * @param scope 过滤 scope（null 表示不过滤）
     * @param type 过滤类型（null 表示不过滤）
     * @param since 只返回该时间点（含）之后的记录（null 表示不过滤）
     */
    public List<RateLimitViolation> query(String scope, ViolationType type, Instant since) {
        List<RateLimitViolation> result = new ArrayList<>();
        lock.lock();
        try {
            for (RateLimitViolation v : violations) {
                if (scope != null && !scope.equals(v.getScope())) {
                    continue;
                }
                if (type != null && type != v.getViolationType()) {
                    continue;
                }
                if (since != null && v.getTimestamp().isBefore(since)) {
                    continue;
                }
                result.add(v);
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    public int count(String scope, ViolationType type, Instant since) {
        return query(scope, type, since).size();
    }

    /**
     * 清除违规记录
     *
     * @param scope 只清除该 scope 的记录；null 表示全部清除
     */
    public void clear(String scope) {
        lock.lock();
        try {
            if (scope == null) {
                violations.clear();
            } else {
                violations.removeIf(v -> scope.equals(v.getScope()));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 当前保存的违规记录数
     */
    public int size() {
        lock.lock();
        try {
            return violations.size();
        } finally {
            lock.unlock();
        }
    }
}
