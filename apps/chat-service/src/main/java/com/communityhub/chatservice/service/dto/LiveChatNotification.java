package com.communityhub.chatservice.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * live_chat_notification 事件载荷。
 * type：new_session（新会话排队）/ new_message（用户新消息）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveChatNotification(
        String type,
        String sessionId,
        LiveChatSessionView session,
        LiveChatMessageView message,
        SenderView user
) {

    public static final String NEW_SESSION = "new_session";
    public static final String NEW_MESSAGE = "new_message";

    public static LiveChatNotification newSession(LiveChatSessionView session) {
        return new LiveChatNotification(NEW_SESSION, session.id(), session, null, session.user());
    }

    public static LiveChatNotification newMessage(String sessionId, LiveChatMessageView message, SenderView user) {
        return new LiveChatNotification(NEW_MESSAGE, sessionId, null, message, user);
    }
}
