package com.communityhub.chatservice.ws;

import java.util.Optional;

/**
 * 统一管理房间 ID 的前缀与拼接。
 */
public final class RoomKeys {

    private static final String CHAT = "chat:";
    private static final String LIVE_CHAT = "live_chat:";
    private static final String USER = "user:";

    private RoomKeys() {}

    // ---- 普通聊天 ----
    public static String chat(Object chatId) {
        return CHAT + chatId;
    }

    // ---- 在线客服会话 ----
    public static String liveChat(Object sessionId) {
        return LIVE_CHAT + sessionId;
    }

    // ---- 用户私有房间（定向推送） ----
    public static String user(Object userId) {
        return USER + userId;
    }

    /**
     * 从房间 ID 中取出客服会话 ID，非客服房间返回 empty
     */
    public static Optional<String> liveChatSessionId(String roomId) {
        if (roomId == null || !roomId.startsWith(LIVE_CHAT)) {
            return Optional.empty();
        }
        return Optional.of(roomId.substring(LIVE_CHAT.length()));
    }
}
