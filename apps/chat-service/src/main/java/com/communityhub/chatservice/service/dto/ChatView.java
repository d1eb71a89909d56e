package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.entity.Chat;
import com.communityhub.chatservice.entity.ChatParticipant;

import java.time.OffsetDateTime;
import java.util.List;

public record ChatView(
        String id,
        String type,
        String name,
        String createdBy,
        List<String> participantIds,
        OffsetDateTime lastMessageAt,
        OffsetDateTime createdAt
) {

    public static ChatView of(Chat chat, List<ChatParticipant> activeParticipants) {
        return new ChatView(
                chat.getId().toString(),
                chat.getChatType().name().toLowerCase(),
                chat.getName(),
                chat.getCreatedBy().toString(),
                activeParticipants.stream().map(p -> p.getUserId().toString()).toList(),
                chat.getLastMessageAt(),
                chat.getCreatedAt());
    }
}
