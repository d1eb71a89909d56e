package com.communityhub.chatservice.service.dto;

import java.util.List;

/**
 * 在线客服的下行事件名与载荷
 */
public final class LiveChatEvents {

    public static final String USER_JOINED = "live_chat_user_joined";
    public static final String USER_LEFT = "live_chat_user_left";
    public static final String SESSION_INFO = "live_chat_session_info";
    public static final String NEW_MESSAGE = "new_live_chat_message";
    public static final String NOTIFICATION = "live_chat_notification";
    public static final String ADMIN_JOINED = "admin_joined_live_chat";
    public static final String ADMIN_LEFT = "admin_left_live_chat";
    public static final String USER_TYPING = "live_chat_user_typing";
    public static final String USER_STOP_TYPING = "live_chat_user_stop_typing";
    public static final String AVAILABLE = "available_live_chats";
    public static final String SESSION_ENDED = "live_chat_session_ended";
    public static final String SESSION_CANCELLED = "live_chat_session_cancelled";
    public static final String ERROR = "live_chat_error";

    private LiveChatEvents() {
    }

    public record UserJoined(String sessionId, ParticipantView user) {
    }

    public record UserLeft(String sessionId, ParticipantView user) {
    }

    public record SessionInfo(String sessionId, LiveChatSessionView session, List<LiveChatMessageView> messages) {
    }

    public record NewMessage(String sessionId, LiveChatMessageView message) {
    }

    public record AdminJoined(String sessionId, ParticipantView admin) {
    }

    public record AdminLeft(String sessionId, String adminId, ParticipantView admin) {
    }

    public record Typing(String sessionId, ParticipantView user) {
    }

    public record Available(List<LiveChatSessionView> sessions) {
    }

    public record SessionEnded(String sessionId, String reason, ParticipantView endedBy) {
    }

    public record SessionCancelled(String sessionId, String notes, ParticipantView cancelledBy) {
    }
}
