package com.communityhub.chatservice.presence;

import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.session.PresenceCache;
import com.communityhub.session.model.PresenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线状态注册表（本地内存 + 共享缓存）。
 *
 * - 本地：ConcurrentHashMap，userId → PresenceEntry，后连接覆盖前连接
 * - 共享：session-common 的 PresenceCache（Redis），多实例可见
 *
 * 降级策略：PresenceCache bean 不存在或 Redis 不可用时只用本地内存（仅支持单实例）。
 * 在线状态仅供展示/推送判断，不用于鉴权。
 */
@Slf4j
@Component
public class PresenceRegistry {

    private static final String SERVICE = "chat-service";

    private final PresenceCache cache;
    private final ChatProperties chatProperties;
    private final ConcurrentHashMap<String, PresenceEntry> local = new ConcurrentHashMap<>();
    private volatile boolean cacheAvailable = false;

    public PresenceRegistry(@Autowired(required = false) PresenceCache cache, ChatProperties chatProperties) {
        this.cache = cache;
        this.chatProperties = chatProperties;
        if (cache != null) {
            checkCache();
        } else {
            log.warn("PresenceCache bean 不存在，在线状态仅保存在本地内存（仅支持单实例）");
        }
    }

    private void checkCache() {
        try {
            cache.isOnline("__startup_check__");
            cacheAvailable = true;
            log.info("Redis 连接正常，在线状态写入共享缓存（支持多实例）");
        } catch (Exception e) {
            cacheAvailable = false;
            log.warn("Redis 连接失败，在线状态降级为本地内存: {}", e.getMessage());
        }
    }

    public boolean isCacheAvailable() {
        return cacheAvailable;
    }

    /**
     * 标记上线，重复调用覆盖之前的连接
     */
    public void markOnline(String userId, String connectionId) {
        if (userId == null || connectionId == null) {
            return;
        }
        long now = Instant.now().toEpochMilli();
        local.put(userId, newEntry(userId, connectionId, now));
        if (cacheAvailable) {
            try {
                cache.setOnline(newEntry(userId, connectionId, now), chatProperties.getPresenceTtl());
            } catch (Exception e) {
                log.warn("共享缓存写入在线状态失败，仅保留本地: userId={}, error={}", userId, e.getMessage());
            }
        }
    }

    /**
     * 标记下线：只移除仍归属该连接的条目。
     *
     * @return true 表示本地条目被移除
     */
    public boolean markOffline(String userId, String connectionId) {
        if (userId == null || connectionId == null) {
            return false;
        }
        boolean[] removed = {false};
        local.computeIfPresent(userId, (key, entry) -> {
            if (connectionId.equals(entry.getConnectionId())) {
                removed[0] = true;
                return null;
            }
            return entry;
        });
        if (cacheAvailable) {
            try {
                cache.setOffline(userId, connectionId);
            } catch (Exception e) {
                log.warn("共享缓存清除在线状态失败: userId={}, error={}", userId, e.getMessage());
            }
        }
        return removed[0];
    }

    /**
     * 本地或共享缓存任一存在即视为在线（socket 可能在其他实例上）
     */
    public boolean isOnline(String userId) {
        if (userId == null) {
            return false;
        }
        if (local.containsKey(userId)) {
            return true;
        }
        if (!cacheAvailable) {
            return false;
        }
        try {
            return cache.isOnline(userId);
        } catch (Exception e) {
            log.warn("共享缓存查询在线状态失败，按本地结果返回: userId={}, error={}", userId, e.getMessage());
            return false;
        }
    }

    public Map<String, Boolean> onlineStatus(Collection<String> userIds) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        if (userIds == null) {
            return result;
        }
        for (String userId : userIds) {
            if (userId != null) {
                result.put(userId, isOnline(userId));
            }
        }
        return result;
    }

    public Optional<PresenceEntry> localEntry(String userId) {
        return Optional.ofNullable(local.get(userId));
    }

    public int localCount() {
        return local.size();
    }

    private static PresenceEntry newEntry(String userId, String connectionId, long now) {
        return PresenceEntry.builder()
                .userId(userId)
                .connectionId(connectionId)
                .service(SERVICE)
                .lastSeenAt(now)
                .build();
    }
}
