package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.common.exception.AccessDeniedException;
import com.communityhub.chatservice.common.exception.DuplicateSessionException;
import com.communityhub.chatservice.common.exception.InvalidStateException;
import com.communityhub.chatservice.common.exception.NotFoundException;
import com.communityhub.chatservice.common.exception.PersistenceFailureException;
import com.communityhub.chatservice.entity.LiveChatMessage;
import com.communityhub.chatservice.entity.LiveChatSession;
import com.communityhub.chatservice.repository.LiveChatMessageRepository;
import com.communityhub.chatservice.repository.LiveChatSessionRepository;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.AdminBroadcastService;
import com.communityhub.chatservice.service.AdminNotificationService;
import com.communityhub.chatservice.service.LiveChatService;
import com.communityhub.chatservice.service.UserProfileService;
import com.communityhub.chatservice.service.dto.LiveChatEvents;
import com.communityhub.chatservice.service.dto.LiveChatMessageView;
import com.communityhub.chatservice.service.dto.LiveChatNotification;
import com.communityhub.chatservice.service.dto.LiveChatSessionDetail;
import com.communityhub.chatservice.service.dto.LiveChatSessionView;
import com.communityhub.chatservice.service.dto.PageResult;
import com.communityhub.chatservice.service.dto.ParticipantView;
import com.communityhub.chatservice.service.dto.SenderView;
import com.communityhub.chatservice.ws.ConnectedAdminRegistry;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.LiveChatTracker;
import com.communityhub.chatservice.ws.RoomKeys;
import com.communityhub.chatservice.ws.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 在线客服会话实现
 *
 * 并发控制：
 * - 发起：先查重，再依赖 active_user_key 唯一约束兜底
 * - 接入/退出/结束/取消：条件更新（CAS），影响行数为 0 即失败，提交后才广播
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveChatServiceImpl implements LiveChatService {

    static final String SESSION_NOT_FOUND = "Chat session not found";
    static final String ADMIN_REQUIRED = "Access denied. Admin privileges required.";
    static final String SESSION_ACCESS_DENIED = "Access denied to this chat session";
    static final String ALREADY_CLAIMED = "This chat session is already being handled by another admin";
    static final String JOIN_INACTIVE = "Can only join active chat sessions";
    static final String CANCEL_INACTIVE = "Can only cancel active chat sessions";
    static final String END_INACTIVE = "Can only end active chat sessions";
    static final String NOT_HANDLING = "You are not handling this chat session";
    static final String MESSAGE_REQUIRED = "Message is required";
    static final String DEFAULT_END_REASON = "Session ended";

    private static final int SESSION_INFO_MESSAGES = 50;
    private static final int MAX_PAGE_SIZE = 100;

    private final LiveChatSessionRepository sessionRepository;
    private final LiveChatMessageRepository messageRepository;
    private final UserProfileService userProfileService;
    private final AdminBroadcastService adminBroadcastService;
    private final AdminNotificationService adminNotificationService;
    private final ConnectedAdminRegistry adminRegistry;
    private final LiveChatTracker tracker;
    private final RoomRouter router;

    @Override
    public LiveChatSessionView start(AuthenticatedUser user) {
        UUID userId = user.id();
        if (sessionRepository.existsByUserIdAndStatus(userId, LiveChatSession.Status.ACTIVE)) {
            throw new DuplicateSessionException();
        }
        LiveChatSession session;
        try {
            session = sessionRepository.saveAndFlush(LiveChatSession.builder()
                    .userId(userId)
                    .status(LiveChatSession.Status.ACTIVE)
                    .activeUserKey(userId.toString())
                    .build());
        } catch (DataIntegrityViolationException e) {
            // 并发发起：唯一键冲突
            log.info("duplicate live chat start rejected by unique key, userId={}", user.userId());
            throw new DuplicateSessionException();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to start chat session", e);
        }
        log.info("live chat started: sessionId={}, userId={}", session.getId(), user.userId());

        LiveChatSessionView view = LiveChatSessionView.of(session, SenderView.of(user), null);
        int delivered = adminBroadcastService.notifyAllAdmins(LiveChatEvents.NOTIFICATION,
                LiveChatNotification.newSession(view));
        int stored = adminNotificationService.notifyNewLiveChat(session, user.displayName());
        log.debug("new live chat announced: sessionId={}, adminConnections={}, notifications={}",
                session.getId(), delivered, stored);
        return view;
    }

    @Override
    public LiveChatSessionView claim(AuthenticatedUser admin, UUID sessionId, Connection connection) {
        requireAdmin(admin);
        LiveChatSession session = load(sessionId);
        if (!session.isActive()) {
            throw new InvalidStateException(JOIN_INACTIVE);
        }
        if (sessionRepository.claim(sessionId, admin.id()) == 0) {
            log.info("live chat claim lost: sessionId={}, admin={}", sessionId, admin.userId());
            throw new AccessDeniedException(ALREADY_CLAIMED);
        }
        session = load(sessionId);
        log.info("live chat claimed: sessionId={}, admin={}", sessionId, admin.userId());

        String roomId = RoomKeys.liveChat(sessionId);
        if (connection != null) {
            adminRegistry.register(connection);
            if (router.join(connection, roomId)) {
                tracker.addParticipant(sessionId.toString(), connection.getId());
            }
        }
        router.broadcast(roomId, LiveChatEvents.ADMIN_JOINED,
                new LiveChatEvents.AdminJoined(sessionId.toString(), ParticipantView.of(admin)));
        return view(session);
    }

    @Override
    public void unclaim(AuthenticatedUser admin, UUID sessionId, Connection connection) {
        requireAdmin(admin);
        if (sessionRepository.unclaim(sessionId, admin.id()) == 0) {
            throw new InvalidStateException(NOT_HANDLING);
        }
        log.info("live chat released: sessionId={}, admin={}", sessionId, admin.userId());

        String roomId = RoomKeys.liveChat(sessionId);
        if (connection != null && router.leave(connection, roomId)) {
            tracker.removeParticipant(sessionId.toString(), connection.getId());
        }
        router.broadcast(roomId, LiveChatEvents.ADMIN_LEFT,
                new LiveChatEvents.AdminLeft(sessionId.toString(), admin.userId(), ParticipantView.of(admin)));
    }

    @Override
    public void join(Connection connection, UUID sessionId) {
        AuthenticatedUser user = connection.getUser();
        LiveChatSession session = load(sessionId);
        requireAccess(session, user);

        String roomId = RoomKeys.liveChat(sessionId);
        router.join(connection, roomId);
        tracker.addParticipant(sessionId.toString(), connection.getId());

        router.broadcast(roomId, LiveChatEvents.USER_JOINED,
                new LiveChatEvents.UserJoined(sessionId.toString(), ParticipantView.of(user)), connection.getId());
        router.send(connection, LiveChatEvents.SESSION_INFO,
                new LiveChatEvents.SessionInfo(sessionId.toString(), view(session), recentMessages(sessionId)));
    }

    @Override
    public void leave(Connection connection, UUID sessionId) {
        String roomId = RoomKeys.liveChat(sessionId);
        boolean left = router.leave(connection, roomId);
        tracker.removeParticipant(sessionId.toString(), connection.getId());
        if (left) {
            router.broadcast(roomId, LiveChatEvents.USER_LEFT,
                    new LiveChatEvents.UserLeft(sessionId.toString(), ParticipantView.of(connection.getUser())));
        }
    }

    @Override
    public LiveChatMessageView sendMessage(AuthenticatedUser sender, UUID sessionId, String text, Connection connection) {
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException(MESSAGE_REQUIRED);
        }
        LiveChatSession session = load(sessionId);
        requireAccess(session, sender);
        if (!session.isActive()) {
            throw new InvalidStateException("Can only send messages to active chat sessions");
        }

        LiveChatMessage.SenderType senderType = sender.isAdmin()
                ? LiveChatMessage.SenderType.ADMIN
                : LiveChatMessage.SenderType.USER;
        LiveChatMessage saved;
        try {
            saved = messageRepository.save(LiveChatMessage.builder()
                    .sessionId(sessionId)
                    .senderId(sender.id())
                    .senderType(senderType)
                    .message(text.trim())
                    .build());
        } catch (DataAccessException e) {
            log.error("persist live chat message failed: sessionId={}, sender={}", sessionId, sender.userId(), e);
            throw new PersistenceFailureException("Failed to send message", e);
        }
        tracker.touch(sessionId.toString());

        SenderView senderView = SenderView.of(sender);
        LiveChatMessageView view = LiveChatMessageView.of(saved, senderView);
        router.broadcast(RoomKeys.liveChat(sessionId), LiveChatEvents.NEW_MESSAGE,
                new LiveChatEvents.NewMessage(sessionId.toString(), view));

        if (senderType == LiveChatMessage.SenderType.USER) {
            LiveChatNotification notification = LiveChatNotification.newMessage(sessionId.toString(), view, senderView);
            if (session.getAdminId() != null) {
                router.emitToUser(session.getAdminId().toString(), LiveChatEvents.NOTIFICATION, notification);
            } else {
                adminBroadcastService.notifyAllAdmins(LiveChatEvents.NOTIFICATION, notification);
            }
        }
        return view;
    }

    @Override
    public void typing(Connection connection, UUID sessionId, boolean started) {
        String roomId = RoomKeys.liveChat(sessionId);
        if (!router.isSubscribed(connection.getId(), roomId)) {
            log.debug("live chat typing ignored, not in room: sessionId={}, session={}", sessionId, connection.getId());
            return;
        }
        router.broadcast(roomId, started ? LiveChatEvents.USER_TYPING : LiveChatEvents.USER_STOP_TYPING,
                new LiveChatEvents.Typing(sessionId.toString(), ParticipantView.of(connection.getUser())),
                connection.getId());
    }

    @Override
    public LiveChatSessionView end(AuthenticatedUser user, UUID sessionId, String reason) {
        LiveChatSession session = load(sessionId);
        requireAccess(session, user);
        if (!session.isActive()) {
            throw new InvalidStateException(END_INACTIVE);
        }
        String notes = StringUtils.hasText(reason) ? reason.trim() : DEFAULT_END_REASON;
        LiveChatSession ended = terminate(sessionId, LiveChatSession.Status.ENDED, notes, END_INACTIVE);
        log.info("live chat ended: sessionId={}, by={}", sessionId, user.userId());

        router.broadcast(RoomKeys.liveChat(sessionId), LiveChatEvents.SESSION_ENDED,
                new LiveChatEvents.SessionEnded(sessionId.toString(), notes, ParticipantView.of(user)));
        tracker.remove(sessionId.toString());
        return view(ended);
    }

    @Override
    public LiveChatSessionView cancel(AuthenticatedUser admin, UUID sessionId, String notes) {
        requireAdmin(admin);
        LiveChatSession session = load(sessionId);
        if (!session.isActive()) {
            throw new InvalidStateException(CANCEL_INACTIVE);
        }
        String kept = StringUtils.hasText(notes) ? notes.trim() : session.getNotes();
        LiveChatSession cancelled = terminate(sessionId, LiveChatSession.Status.CANCELLED, kept, CANCEL_INACTIVE);
        log.info("live chat cancelled: sessionId={}, by={}", sessionId, admin.userId());

        router.broadcast(RoomKeys.liveChat(sessionId), LiveChatEvents.SESSION_CANCELLED,
                new LiveChatEvents.SessionCancelled(sessionId.toString(), cancelled.getNotes(), ParticipantView.of(admin)));
        tracker.remove(sessionId.toString());
        return view(cancelled);
    }

    /**
     * 条件更新进入终态，已提交后才返回；并发下只有一方成功，失败方不广播
     */
    private LiveChatSession terminate(UUID sessionId, LiveChatSession.Status terminal, String notes, String inactiveMessage) {
        int updated;
        try {
            updated = sessionRepository.terminate(sessionId, terminal, notes);
        } catch (DataAccessException e) {
            log.error("terminate live chat failed: sessionId={}, status={}", sessionId, terminal, e);
            throw new PersistenceFailureException("Failed to update chat session", e);
        }
        if (updated == 0) {
            log.info("live chat already finished: sessionId={}, wanted={}", sessionId, terminal);
            throw new InvalidStateException(inactiveMessage);
        }
        return load(sessionId);
    }

    @Override
    public void announce(AuthenticatedUser admin, UUID sessionId) {
        requireAdmin(admin);
        LiveChatSession session = load(sessionId);
        LiveChatSessionView view = view(session);
        adminBroadcastService.notifyAllAdmins(LiveChatEvents.NOTIFICATION,
                LiveChatNotification.newSession(view), admin.userId());
    }

    @Override
    public List<LiveChatSessionView> availableSessions(AuthenticatedUser admin) {
        requireAdmin(admin);
        List<LiveChatSession> sessions = sessionRepository
                .findByStatusAndAdminIdIsNullOrderByStartedAtAsc(LiveChatSession.Status.ACTIVE);
        return views(sessions);
    }

    @Override
    public PageResult<LiveChatSessionView> listSessions(AuthenticatedUser admin, String status, int page, int limit) {
        requireAdmin(admin);
        PageRequest request = PageRequest.of(pageIndex(page), pageSize(limit), Sort.by(Sort.Direction.DESC, "startedAt"));
        LiveChatSession.Status filter = parseStatus(status);
        Page<LiveChatSession> result = filter == null
                ? sessionRepository.findAll(request)
                : sessionRepository.findByStatus(filter, request);
        return page(result);
    }

    @Override
    public LiveChatSessionDetail getSession(AuthenticatedUser user, UUID sessionId) {
        LiveChatSession session = load(sessionId);
        if (!session.isOwnedBy(user.id()) && !user.isAdmin()) {
            throw new AccessDeniedException(SESSION_ACCESS_DENIED);
        }
        return new LiveChatSessionDetail(view(session), recentMessages(sessionId));
    }

    @Override
    public PageResult<LiveChatSessionView> userSessions(AuthenticatedUser user, String status, int page, int limit) {
        PageRequest request = PageRequest.of(pageIndex(page), pageSize(limit));
        LiveChatSession.Status filter = parseStatus(status);
        Page<LiveChatSession> result = filter == null
                ? sessionRepository.findByUserIdOrderByStartedAtDesc(user.id(), request)
                : sessionRepository.findByUserIdAndStatusOrderByStartedAtDesc(user.id(), filter, request);
        return page(result);
    }

    @Override
    public PageResult<LiveChatMessageView> messages(AuthenticatedUser user, UUID sessionId, int page, int limit) {
        LiveChatSession session = load(sessionId);
        requireAccess(session, user);
        Page<LiveChatMessage> result = messageRepository.findBySessionIdOrderByCreatedAtAsc(
                sessionId, PageRequest.of(pageIndex(page), pageSize(limit)));
        Map<UUID, SenderView> senders = userProfileService.profiles(
                result.getContent().stream().map(LiveChatMessage::getSenderId).toList());
        return PageResult.of(result, m -> LiveChatMessageView.of(m, senders.get(m.getSenderId())));
    }

    @Override
    @Transactional
    public void delete(AuthenticatedUser admin, UUID sessionId) {
        requireAdmin(admin);
        LiveChatSession session = load(sessionId);
        messageRepository.deleteBySessionId(sessionId);
        sessionRepository.delete(session);
        tracker.remove(sessionId.toString());
        log.info("live chat deleted: sessionId={}, by={}", sessionId, admin.userId());
    }

    private LiveChatSession load(UUID sessionId) {
        return sessionRepository.findById(sessionId).orElseThrow(() -> new NotFoundException(SESSION_NOT_FOUND));
    }

    private static void requireAdmin(AuthenticatedUser user) {
        if (!user.isAdmin()) {
            throw new AccessDeniedException(ADMIN_REQUIRED);
        }
    }

    /**
     * 发起人、接入的管理员或任意管理员
     */
    private static void requireAccess(LiveChatSession session, AuthenticatedUser user) {
        UUID id = user.id();
        if (!session.isOwnedBy(id) && !session.isAssignedTo(id) && !user.isAdmin()) {
            throw new AccessDeniedException(SESSION_ACCESS_DENIED);
        }
    }

    /**
     * 最近的消息，时间正序
     */
    private List<LiveChatMessageView> recentMessages(UUID sessionId) {
        List<LiveChatMessage> newestFirst = messageRepository.findBySessionIdOrderByCreatedAtDesc(
                sessionId, PageRequest.of(0, SESSION_INFO_MESSAGES));
        List<LiveChatMessage> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        Map<UUID, SenderView> senders = userProfileService.profiles(
                ordered.stream().map(LiveChatMessage::getSenderId).toList());
        return ordered.stream().map(m -> LiveChatMessageView.of(m, senders.get(m.getSenderId()))).toList();
    }

    private LiveChatSessionView view(LiveChatSession session) {
        return LiveChatSessionView.of(session,
                userProfileService.profile(session.getUserId()),
                userProfileService.profile(session.getAdminId()));
    }

    private List<LiveChatSessionView> views(List<LiveChatSession> sessions) {
        Map<UUID, SenderView> profiles = userProfileService.profiles(sessions.stream()
                .flatMap(s -> Stream.of(s.getUserId(), s.getAdminId()))
                .filter(Objects::nonNull)
                .toList());
        return sessions.stream()
                .map(s -> LiveChatSessionView.of(s, profiles.get(s.getUserId()),
                        s.getAdminId() == null ? null : profiles.get(s.getAdminId())))
                .toList();
    }

    private PageResult<LiveChatSessionView> page(Page<LiveChatSession> result) {
        List<LiveChatSessionView> items = views(result.getContent());
        return new PageResult<>(items, result.getTotalElements(), result.getNumber() + 1, result.getTotalPages());
    }

    private static LiveChatSession.Status parseStatus(String status) {
        if (!StringUtils.hasText(status)) {
            return null;
        }
        try {
            return LiveChatSession.Status.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status: " + status);
        }
    }

    private static int pageIndex(int page) {
        return Math.max(page, 1) - 1;
    }

    private static int pageSize(int limit) {
        return Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
    }
}
