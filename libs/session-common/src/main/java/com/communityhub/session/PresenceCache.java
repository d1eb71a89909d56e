package com.communityhub.session;

import com.alibaba.fastjson2.JSON;
import com.communityhub.session.config.SessionRedisConfig;
import com.communityhub.session.model.PresenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 跨实例共享的在线状态缓存。
 *
 * 存储：Redis String，键空间如下：
 * - user:online:{userId} -> PresenceEntry JSON（带 TTL）
 *
 * 所有方法直接抛出 Redis 异常，降级策略由调用方决定。
 */
@Slf4j
public class PresenceCache {

    /** Redis Key 前缀：用户在线状态 */
    private static final String ONLINE_KEY_PREFIX = "user:online:";

    /** 在线状态默认 TTL（24 小时） */
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    /**
     * 仅当条目仍归属指定连接时删除，避免旧连接断开时误删新连接的在线状态。
     */
    private static final String DELETE_IF_OWNER_SCRIPT =
            "local v = redis.call('GET', KEYS[1]) " +
            "if not v then return 0 end " +
            "local ok, entry = pcall(cjson.decode, v) " +
            "if ok and entry['connectionId'] == ARGV[1] then return redis.call('DEL', KEYS[1]) end " +
            "return 0";

    private final RedisTemplate<String, String> redis;

    public PresenceCache(@Qualifier(SessionRedisConfig.SESSION_REDIS_TEMPLATE_BEAN) RedisTemplate<String, String> redis) {
        this.redis = redis;
    }

    /**
     * 写入在线状态（覆盖已有条目）。
     *
     * @param entry 在线条目，userId / connectionId 必填
     * @param ttl   存活时间，null 或非正数使用默认值
     */
    public void setOnline(PresenceEntry entry, Duration ttl) {
        Objects.requireNonNull(entry, "entry must not be null");
        requireText(entry.getUserId(), "userId");
        requireText(entry.getConnectionId(), "connectionId");
        if (entry.getLastSeenAt() == null) {
            entry.setLastSeenAt(Instant.now().toEpochMilli());
        }
        Duration effective = (ttl == null || ttl.isZero() || ttl.isNegative()) ? DEFAULT_TTL : ttl;
        redis.opsForValue().set(key(entry.getUserId()), JSON.toJSONString(entry), effective);
    }

    /**
     * 清除在线状态。
     *
     * @param userId       用户 ID
     * @param connectionId 断开的连接 ID；为 null 时无条件删除
     * @return true 表示条目被删除
     */
    public boolean setOffline(String userId, String connectionId) {
        requireText(userId, "userId");
        if (connectionId == null) {
            return Boolean.TRUE.equals(redis.delete(key(userId)));
        }
        DefaultRedisScript<Long> script = new DefaultRedisScript<>(DELETE_IF_OWNER_SCRIPT, Long.class);
        Long removed = redis.execute(script, List.of(key(userId)), connectionId);
        return removed != null && removed > 0;
    }

    /**
     * 查询用户是否在线（存在未过期条目即视为在线）。
     */
    public boolean isOnline(String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        return Boolean.TRUE.equals(redis.hasKey(key(userId)));
    }

    /**
     * 获取在线条目，不存在或解析失败返回 null。
     */
    public PresenceEntry get(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        String json = redis.opsForValue().get(key(userId));
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JSON.parseObject(json, PresenceEntry.class);
        } catch (Exception ex) {
            log.warn("在线状态解析失败，忽略: userId={}", userId, ex);
            return null;
        }
    }

    private static String key(String userId) {
        return ONLINE_KEY_PREFIX + userId;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
