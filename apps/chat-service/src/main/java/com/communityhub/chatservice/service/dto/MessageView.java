package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.MessageContent;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * 消息下发视图（实时推送与历史查询共用）
 */
public record MessageView(
        String id,
        String chatId,
        String senderId,
        SenderView sender,
        String type,
        MessageContent content,
        Map<String, Object> media,
        Map<String, Object> location,
        String replyToId,
        List<ChatMessage.ReadReceipt> readBy,
        String status,
        boolean edited,
        List<ChatMessage.Reaction> reactions,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static MessageView of(ChatMessage message, SenderView sender) {
        return new MessageView(
                message.getId().toString(),
                message.getChatId().toString(),
                message.getSenderId().toString(),
                sender,
                message.getMessageType().name().toLowerCase(),
                message.getContent(),
                message.getMedia(),
                message.getLocation(),
                message.getReplyToId() == null ? null : message.getReplyToId().toString(),
                message.getReadBy() == null ? List.of() : List.copyOf(message.getReadBy()),
                message.getStatus().name().toLowerCase(),
                Boolean.TRUE.equals(message.getEdited()),
                message.getReactions() == null ? List.of() : List.copyOf(message.getReactions()),
                message.getCreatedAt(),
                message.getUpdatedAt());
    }
}
