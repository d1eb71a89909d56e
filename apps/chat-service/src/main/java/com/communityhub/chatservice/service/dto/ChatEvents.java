package com.communityhub.chatservice.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 普通聊天的下行事件名与载荷
 */
public final class ChatEvents {

    public static final String NEW_MESSAGE = "new_message";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOP_TYPING = "user_stop_typing";
    public static final String MESSAGES_READ = "messages_read";
    public static final String ONLINE_STATUS_RESPONSE = "online_status_response";
    public static final String MESSAGE_EDITED = "message_edited";
    public static final String MESSAGE_REACTION = "message_reaction";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String ERROR = "error";

    private ChatEvents() {
    }

    public record NewMessage(MessageView message) {
    }

    /**
     * 停止输入时不带 username
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Typing(String chatId, String userId, String username) {
    }

    public record MessagesRead(String chatId, String userId, List<String> messageIds) {
    }

    public record MessageEdited(MessageView message) {
    }

    public record MessageReaction(String chatId, String messageId, List<?> reactions) {
    }

    public record MessageDeleted(String chatId, String messageId) {
    }
}
