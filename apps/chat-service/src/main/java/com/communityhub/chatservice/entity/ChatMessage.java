package com.communityhub.chatservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 聊天消息表实体
 * 对应数据库表：messages
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_chat_time", columnList = "chat_id,created_at"),
    @Index(name = "idx_messages_sender", columnList = "sender_id"),
    @Index(name = "idx_messages_reply", columnList = "reply_to_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "chat_id", nullable = false, updatable = false)
    private UUID chatId;

    @Column(name = "sender_id", nullable = false, updatable = false)
    private UUID senderId;

    @Column(name = "message_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private MessageType messageType = MessageType.TEXT;

    /**
     * 归一化后的消息内容（JSONB）
     */
    @Column(name = "content", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private MessageContent content;

    /**
     * 媒体附件信息（JSONB，如 url、缩略图等）
     */
    @Column(name = "media", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> media;

    /**
     * 位置信息（JSONB）
     */
    @Column(name = "location", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> location;

    @Column(name = "reply_to_id")
    private UUID replyToId;

    /**
     * 已读记录：[{userId, readAt}]
     */
    @Column(name = "read_by", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<ReadReceipt> readBy = new ArrayList<>();

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.SENT;

    @Column(name = "edited", nullable = false)
    @Builder.Default
    private Boolean edited = false;

    /**
     * 编辑历史：[{content, editedAt}]
     */
    @Column(name = "edit_history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<EditRecord> editHistory = new ArrayList<>();

    /**
     * 表情回应：[{userId, emoji, createdAt}]
     */
    @Column(name = "reactions", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<Reaction> reactions = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public boolean isReadBy(UUID userId) {
        String id = userId.toString();
        return readBy != null && readBy.stream().anyMatch(r -> id.equals(r.userId()));
    }

    public enum MessageType {
        TEXT,
        IMAGE,
        VIDEO,
        AUDIO,
        FILE,
        LOCATION,
        CONTACT,
        SYSTEM;

        public boolean isMedia() {
            return this == IMAGE || this == VIDEO || this == AUDIO || this == FILE;
        }

        /**
         * 宽松解析，未知或空值视为 TEXT
         */
        public static MessageType parse(String value) {
            if (value == null || value.isBlank()) {
                return TEXT;
            }
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return TEXT;
            }
        }
    }

    public enum DeliveryStatus {
        SENT,
        DELIVERED,
        READ
    }

    public record ReadReceipt(String userId, OffsetDateTime readAt) {
    }

    public record EditRecord(MessageContent content, OffsetDateTime editedAt) {
    }

    public record Reaction(String userId, String emoji, OffsetDateTime createdAt) {
    }
}
