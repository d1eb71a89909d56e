package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.chatservice.common.exception.PersistenceFailureException;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.infrastructure.client.PushNotificationClient;
import com.communityhub.chatservice.presence.PresenceRegistry;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.ChatMessagingService;
import com.communityhub.chatservice.service.ChatService;
import com.communityhub.chatservice.service.MessageContents;
import com.communityhub.chatservice.service.dto.ChatEvents;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.service.dto.SenderView;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RoomKeys;
import com.communityhub.chatservice.ws.RoomRouter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 普通聊天实时流程实现
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatMessagingServiceImpl implements ChatMessagingService {

    private static final int PUSH_PREVIEW_LENGTH = 100;

    private final ChatService chatService;
    private final RoomRouter router;
    private final PresenceRegistry presenceRegistry;
    private final PushNotificationClient pushNotificationClient;
    private final ChatProperties chatProperties;

    @Override
    public void joinChat(Connection connection, UUID chatId) {
        chatService.requireParticipant(chatId, connection.getUser().id());
        if (router.join(connection, RoomKeys.chat(chatId))) {
            log.debug("joined chat room: chatId={}, user={}, session={}", chatId, connection.getUserId(), connection.getId());
        }
    }

    @Override
    public void leaveChat(Connection connection, UUID chatId) {
        chatService.requireParticipant(chatId, connection.getUser().id());
        router.leave(connection, RoomKeys.chat(chatId));
    }

    @Override
    public MessageView sendMessage(Connection connection, UUID chatId, JsonNode content, String type,
                                   Map<String, Object> media, Map<String, Object> location, UUID replyToId) {
        AuthenticatedUser sender = connection.getUser();
        // 1. 聊天存在 + 有效参与者
        chatService.requireParticipant(chatId, sender.id());

        // 2. 内容归一化 + 长度校验
        ChatMessage.MessageType messageType = ChatMessage.MessageType.parse(type);
        MessageContent normalized = MessageContents.normalize(content, messageType);
        if (MessageContents.textLength(normalized) > chatProperties.getMessageMaxLength()) {
            throw new IllegalArgumentException(
                    "Message exceeds " + chatProperties.getMessageMaxLength() + " characters");
        }

        // 3. 持久化（同一事务刷新 lastMessageAt）
        ChatMessage saved;
        try {
            saved = chatService.appendMessage(chatId, sender.id(), messageType, normalized, media, location, replyToId);
        } catch (DataAccessException e) {
            log.error("persist message failed: chatId={}, sender={}", chatId, sender.userId(), e);
            throw new PersistenceFailureException("Failed to send message", e);
        }

        // 4. 广播给聊天房间（含发送者自己的其他连接）
        MessageView view = MessageView.of(saved, SenderView.of(sender));
        int delivered = router.broadcast(RoomKeys.chat(chatId), ChatEvents.NEW_MESSAGE, new ChatEvents.NewMessage(view));
        log.debug("message sent: chatId={}, messageId={}, delivered={}", chatId, saved.getId(), delivered);

        // 5. 离线参与者走推送
        pushToOffline(chatId, sender, normalized);
        return view;
    }

    @Override
    public void typing(Connection connection, UUID chatId, boolean started) {
        String roomId = RoomKeys.chat(chatId);
        // 未加入房间（未通过参与者校验）的输入事件直接丢弃
        if (!router.isSubscribed(connection.getId(), roomId)) {
            log.debug("typing ignored, not in room: chatId={}, session={}", chatId, connection.getId());
            return;
        }
        AuthenticatedUser user = connection.getUser();
        ChatEvents.Typing payload = new ChatEvents.Typing(chatId.toString(), user.userId(),
                started ? user.username() : null);
        router.broadcast(roomId, started ? ChatEvents.USER_TYPING : ChatEvents.USER_STOP_TYPING,
                payload, connection.getId());
    }

    @Override
    public void markRead(Connection connection, UUID chatId, List<UUID> messageIds) {
        AuthenticatedUser user = connection.getUser();
        try {
            chatService.markRead(chatId, user.id(), messageIds);
        } catch (DataAccessException e) {
            log.error("mark read failed: chatId={}, user={}", chatId, user.userId(), e);
            throw new PersistenceFailureException("Failed to mark messages as read", e);
        }
        if (messageIds == null || messageIds.isEmpty()) {
            return;
        }
        // 整个房间（含本人其他连接）都收到请求中的 id
        router.broadcast(RoomKeys.chat(chatId), ChatEvents.MESSAGES_READ,
                new ChatEvents.MessagesRead(chatId.toString(), user.userId(),
                        messageIds.stream().map(UUID::toString).toList()));
    }

    @Override
    public void sendOnlineStatus(Connection connection, Collection<String> userIds) {
        Map<String, Boolean> status = presenceRegistry.onlineStatus(userIds);
        router.send(connection, ChatEvents.ONLINE_STATUS_RESPONSE, status);
    }

    private void pushToOffline(UUID chatId, AuthenticatedUser sender, MessageContent content) {
        List<UUID> others;
        try {
            others = chatService.otherParticipants(chatId, sender.id());
        } catch (Exception e) {
            log.warn("load participants for push failed: chatId={}", chatId, e);
            return;
        }
        String preview = preview(content);
        for (UUID participant : others) {
            String participantId = participant.toString();
            if (presenceRegistry.isOnline(participantId)) {
                continue;
            }
            try {
                pushNotificationClient.dispatch(new PushNotificationClient.PushRequest(
                        participantId,
                        sender.displayName(),
                        preview,
                        Map.of("chatId", chatId.toString(), "senderId", sender.userId())));
            } catch (Exception e) {
                log.warn("push dispatch failed: userId={}, chatId={}", participantId, chatId, e);
            }
        }
    }

    private static String preview(MessageContent content) {
        String text = content.text();
        if (text == null || text.isBlank()) {
            return "[" + content.getClass().getSimpleName().toLowerCase() + "]";
        }
        return text.length() > PUSH_PREVIEW_LENGTH ? text.substring(0, PUSH_PREVIEW_LENGTH) + "..." : text;
    }
}
