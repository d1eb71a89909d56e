package com.communityhub.chatservice.ws;

import com.communityhub.chatservice.presence.PresenceRegistry;
import com.communityhub.chatservice.repository.UserRepository;
import com.communityhub.chatservice.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 连接生命周期：建立时登记连接/在线状态/私有房间，断开时一次性清理。
 *
 * SessionDisconnectEvent 可能重复发布，清理以 Connection#markDisconnected 为准只执行一次。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionLifecycleListener {

    private final RoomRouter router;
    private final PresenceRegistry presenceRegistry;
    private final ConnectedAdminRegistry adminRegistry;
    private final LiveChatTracker liveChatTracker;
    private final UserRepository userRepository;

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        AuthenticatedUser user = extractUser(event.getUser());
        if (!StringUtils.hasText(sessionId) || user == null) {
            log.warn("WS connect missing session or principal, session={}", sessionId);
            return;
        }
        Connection connection = new Connection(sessionId, user, Instant.now());
        router.register(connection);
        router.join(connection, RoomKeys.user(user.userId()));
        presenceRegistry.markOnline(user.userId(), sessionId);
        if (connection.isAdmin()) {
            adminRegistry.register(connection);
        }
        persistPresence(user.userId(), true);
        log.info("WS connected: user={}, role={}, session={}, connectedAt={}",
                user.userId(), user.role(), sessionId, connection.getConnectedAt());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (!StringUtils.hasText(sessionId)) {
            return;
        }
        Connection connection = router.find(sessionId).orElse(null);
        if (connection == null || !connection.markDisconnected()) {
            return;
        }
        String userId = connection.getUserId();

        List<String> leftRooms = router.removeConnection(sessionId);
        for (String roomId : leftRooms) {
            RoomKeys.liveChatSessionId(roomId)
                    .ifPresent(liveChatId -> liveChatTracker.removeParticipant(liveChatId, sessionId));
        }
        adminRegistry.unregister(connection);

        presenceRegistry.markOffline(userId, sessionId);
        List<Connection> remaining = router.connectionsOf(userId);
        if (!remaining.isEmpty()) {
            presenceRegistry.markOnline(userId, remaining.get(0).getId());
        }
        persistPresence(userId, !remaining.isEmpty());

        log.info("WS disconnected: user={}, session={}, rooms={}, status={}",
                userId, sessionId, leftRooms.size(), event.getCloseStatus());
    }

    /**
     * 尽力写入在线标记与最后活跃时间，失败不影响连接处理
     */
    private void persistPresence(String userId, boolean online) {
        try {
            userRepository.updatePresence(UUID.fromString(userId), online, OffsetDateTime.now());
        } catch (Exception e) {
            log.warn("persist last active failed, userId={}", userId, e);
        }
    }

    private static AuthenticatedUser extractUser(Principal principal) {
        if (principal instanceof Authentication authentication
                && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        return null;
    }
}
