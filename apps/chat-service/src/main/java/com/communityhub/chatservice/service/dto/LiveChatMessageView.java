package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.entity.LiveChatMessage;

import java.time.OffsetDateTime;

public record LiveChatMessageView(
        String id,
        String sessionId,
        String senderId,
        String senderType,
        String message,
        OffsetDateTime createdAt,
        SenderView sender
) {

    public static LiveChatMessageView of(LiveChatMessage message, SenderView sender) {
        return new LiveChatMessageView(
                message.getId().toString(),
                message.getSessionId().toString(),
                message.getSenderId().toString(),
                message.getSenderType().name().toLowerCase(),
                message.getMessage(),
                message.getCreatedAt(),
                sender);
    }
}
