package com.communityhub.chatservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 在线客服消息表实体（只追加）
 * 对应数据库表：live_chat_messages
 */
@Entity
@Table(name = "live_chat_messages", indexes = {
    @Index(name = "idx_live_chat_messages_session_time", columnList = "session_id,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "sender_id", nullable = false, updatable = false)
    private UUID senderId;

    /**
     * 发送方身份：USER（用户）、ADMIN（客服）
     */
    @Column(name = "sender_type", nullable = false, length = 10, updatable = false)
    @Enumerated(EnumType.STRING)
    private SenderType senderType;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public enum SenderType {
        USER,
        ADMIN
    }
}
