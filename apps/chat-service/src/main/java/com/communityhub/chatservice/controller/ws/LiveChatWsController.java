package com.communityhub.chatservice.controller.ws;

import com.communityhub.chatservice.common.Ids;
import com.communityhub.chatservice.controller.ws.dto.EndLiveChat;
import com.communityhub.chatservice.controller.ws.dto.LiveChatRef;
import com.communityhub.chatservice.controller.ws.dto.SendLiveChatMessage;
import com.communityhub.chatservice.service.LiveChatService;
import com.communityhub.chatservice.service.dto.ErrorPayload;
import com.communityhub.chatservice.service.dto.LiveChatEvents;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.UUID;

/**
 * WebSocket 在线客服控制器
 * 错误统一以 live_chat_error 下发给发起的连接
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class LiveChatWsController {

    private static final String SESSION_NOT_FOUND = "Chat session not found";

    private final LiveChatService liveChatService;
    private final RoomRouter router;

    @MessageMapping("/join_live_chat")
    public void join(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "join_live_chat");
        if (connection == null) {
            return;
        }
        liveChatService.join(connection, sessionId(cmd.getSessionId()));
    }

    @MessageMapping("/leave_live_chat")
    public void leave(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "leave_live_chat");
        if (connection == null) {
            return;
        }
        liveChatService.leave(connection, sessionId(cmd.getSessionId()));
    }

    @MessageMapping("/send_live_chat_message")
    public void sendMessage(@Payload SendLiveChatMessage cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "send_live_chat_message");
        if (connection == null) {
            return;
        }
        liveChatService.sendMessage(connection.getUser(), sessionId(cmd.getSessionId()), cmd.getMessage(), connection);
    }

    @MessageMapping("/live_chat_typing_start")
    public void typingStart(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "live_chat_typing_start");
        if (connection == null) {
            return;
        }
        liveChatService.typing(connection, sessionId(cmd.getSessionId()), true);
    }

    @MessageMapping("/live_chat_typing_stop")
    public void typingStop(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "live_chat_typing_stop");
        if (connection == null) {
            return;
        }
        liveChatService.typing(connection, sessionId(cmd.getSessionId()), false);
    }

    /**
     * 管理员把排队中的会话通知给其他管理员
     */
    @MessageMapping("/new_live_chat_session")
    public void announce(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "new_live_chat_session");
        if (connection == null) {
            return;
        }
        liveChatService.announce(connection.getUser(), sessionId(cmd.getSessionId()));
    }

    @MessageMapping("/admin_join_live_chat")
    public void adminJoin(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "admin_join_live_chat");
        if (connection == null) {
            return;
        }
        liveChatService.claim(connection.getUser(), sessionId(cmd.getSessionId()), connection);
    }

    @MessageMapping("/admin_leave_live_chat")
    public void adminLeave(@Payload LiveChatRef cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "admin_leave_live_chat");
        if (connection == null) {
            return;
        }
        liveChatService.unclaim(connection.getUser(), sessionId(cmd.getSessionId()), connection);
    }

    @MessageMapping("/end_live_chat_session")
    public void end(@Payload EndLiveChat cmd, SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "end_live_chat_session");
        if (connection == null) {
            return;
        }
        liveChatService.end(connection.getUser(), sessionId(cmd.getSessionId()), cmd.getReason());
    }

    @MessageMapping("/get_available_live_chats")
    public void available(SimpMessageHeaderAccessor sha) {
        Connection connection = connection(sha, "get_available_live_chats");
        if (connection == null) {
            return;
        }
        router.send(connection, LiveChatEvents.AVAILABLE,
                new LiveChatEvents.Available(liveChatService.availableSessions(connection.getUser())));
    }

    @MessageExceptionHandler
    public void handleException(Exception e, SimpMessageHeaderAccessor sha) {
        String sessionId = sha.getSessionId();
        String message = WsErrors.messageOf(e, sha.getDestination(), sessionId);
        router.find(sessionId).ifPresent(c -> router.send(c, LiveChatEvents.ERROR, new ErrorPayload(message)));
    }

    private static UUID sessionId(String raw) {
        return Ids.parse(raw, SESSION_NOT_FOUND);
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
