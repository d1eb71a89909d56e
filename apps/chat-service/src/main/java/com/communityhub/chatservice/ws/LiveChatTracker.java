package com.communityhub.chatservice.ws;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本实例的客服会话簿记：sessionId → 参与连接 + 最近活动时间。
 * 只影响本地状态，不改变会话的持久化状态。
 */
@Component
public class LiveChatTracker {

    private final Map<String, Tracked> sessions = new ConcurrentHashMap<>();

    public void addParticipant(String sessionId, String connectionId) {
        sessions.compute(sessionId, (key, tracked) -> {
            Tracked t = tracked != null ? tracked : new Tracked();
            t.participants.add(connectionId);
            t.lastActivity = Instant.now();
            return t;
        });
    }

    /**
     * 移除参与连接，最后一个离开时丢弃该会话的簿记
     */
    public void removeParticipant(String sessionId, String connectionId) {
        sessions.computeIfPresent(sessionId, (key, tracked) -> {
            tracked.participants.remove(connectionId);
            return tracked.participants.isEmpty() ? null : tracked;
        });
    }

    public void touch(String sessionId) {
        Tracked tracked = sessions.get(sessionId);
        if (tracked != null) {
            tracked.lastActivity = Instant.now();
        }
    }

    public void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    public boolean isTracked(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Set<String> participants(String sessionId) {
        Tracked tracked = sessions.get(sessionId);
        return tracked == null ? Set.of() : Set.copyOf(tracked.participants);
    }

    public Optional<Instant> lastActivity(String sessionId) {
        Tracked tracked = sessions.get(sessionId);
        return tracked == null ? Optional.empty() : Optional.of(tracked.lastActivity);
    }

    private static final class Tracked {
        private final Set<String> participants = ConcurrentHashMap.newKeySet();
        private volatile Instant lastActivity = Instant.now();
    }
}
