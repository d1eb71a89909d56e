package com.communityhub.chatservice.controller.ws;

import com.communityhub.chatservice.common.Ids;
import com.communityhub.chatservice.controller.ws.dto.ChatRef;
import com.communityhub.chatservice.controller.ws.dto.MarkRead;
import com.communityhub.chatservice.controller.ws.dto.OnlineStatusQuery;
import com.communityhub.chatservice.controller.ws.dto.SendChatMessage;
import com.communityhub.chatservice.service.ChatMessagingService;
import com.communityhub.chatservice.service.dto.ChatEvents;
import com.communityhub.chatservice.service.dto.ErrorPayload;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.UUID;

/**
 * WebSocket 普通聊天控制器
 * 客户端发往 /app/{event}，结果以 /user/queue/{event} 下发
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ChatWsController {

    private static final String CHAT_NOT_FOUND = "Chat not found";

    private final ChatMessagingService chatMessagingService;
    private final RoomRouter router;

    /**
     * 订阅聊天房间（需为聊天的有效参与者）
     */
    @MessageMapping("/join_chat")
    public void joinChat(@Payload ChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "join_chat");
        if (connection == null) {
            return;
        }
        chatMessagingService.joinChat(connection, Ids.parse(cmd.getChatId(), CHAT_NOT_FOUND));
    }

    @MessageMapping("/leave_chat")
    public void leaveChat(@Payload ChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "leave_chat");
        if (connection == null) {
            return;
        }
        chatMessagingService.leaveChat(connection, Ids.parse(cmd.getChatId(), CHAT_NOT_FOUND));
    }

    /**
     * 发送消息，发送者取自连接身份
     */
    @MessageMapping("/send_message")
    public void sendMessage(@Payload SendChatMessage cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "send_message");
        if (connection == null) {
            return;
        }
        UUID chatId = Ids.parse(cmd.getChatId(), CHAT_NOT_FOUND);
        UUID replyToId = cmd.getReplyToId() == null ? null : Ids.parse(cmd.getReplyToId(), "Message not found");
        chatMessagingService.sendMessage(connection, chatId, cmd.getContent(), cmd.getType(),
                cmd.getMedia(), cmd.getLocation(), replyToId);
    }

    @MessageMapping("/typing_start")
    public void typingStart(@Payload ChatRef cmd, SimpMessageHeaderAccessor sha) {
        typing(cmd, sha, true);
    }

    @MessageMapping("/typing_stop")
    public void typingStop(@Payload ChatRef cmd, SimpMessageHeaderAccessor sha) {
        typing(cmd, sha, false);
    }

    @MessageMapping("/mark_read")
    public void markRead(@Payload MarkRead cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "mark_read");
        if (connection == null) {
            return;
        }
        UUID chatId = Ids.parse(cmd.getChatId(), CHAT_NOT_FOUND);
        List<UUID> messageIds = cmd.getMessageIds() == null ? List.of() : cmd.getMessageIds().stream()
                .map(id -> Ids.parse(id, "Message not found"))
                .toList();
        chatMessagingService.markRead(connection, chatId, messageIds);
    }

    @MessageMapping("/get_online_status")
    public void onlineStatus(@Payload OnlineStatusQuery cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "get_online_status");
        if (connection == null) {
            return;
        }
        chatMessagingService.sendOnlineStatus(connection, cmd.getUserIds() == null ? List.of() : cmd.getUserIds());
    }

    /**
     * 处理失败只通知发起的连接
     */
    @MessageExceptionHandler
    public void handleException(Exception e, SimpMessageHeaderAccessor sha) {
        String sessionId = sha.getSessionId();
        String message = WsErrors.messageOf(e, sha.getDestination(), sessionId);
        router.find(sessionId).ifPresent(c -> router.send(c, ChatEvents.ERROR, new ErrorPayload(message)));
    }

    private void typing(ChatRef cmd, SimpMessageHeaderAccessor sha, boolean started) {
        Connection connection = connection(sha, started ? "typing_start" : "typing_stop");
        if (connection == null) {
            return;
        }
        chatMessagingService.typing(connection, Ids.parse(cmd.getChatId(), CHAT_NOT_FOUND), started);
    }

    private Connection connection(SimpMessageHeaderAccessor sha, String event) {
        Connection connection = router.find(sha.getSessionId()).orElse(null);
        if (connection == null || !connection.isLive()) {
            log.warn("WS {} denied: unknown connection, session={}", event, sha.getSessionId());
            return null;
        }
        return connection;
    }
}
