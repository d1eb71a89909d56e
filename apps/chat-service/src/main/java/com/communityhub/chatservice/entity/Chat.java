package com.communityhub.chatservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 聊天表实体
 * 对应数据库表：chats
 */
@Entity
@Table(name = "chats", indexes = {
    @Index(name = "idx_chats_type", columnList = "chat_type"),
    @Index(name = "idx_chats_last_message", columnList = "last_message_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_chats_direct_key", columnNames = "direct_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chat {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * 聊天类型：DIRECT（一对一）、GROUP（群聊）
     */
    @Column(name = "chat_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private ChatType chatType;

    /**
     * 群名称（群聊时使用）
     */
    @Column(name = "name", length = 100)
    private String name;

    /**
     * 私聊唯一键（格式：min(user1,user2)||'|'||max(user1,user2)），用于私聊去重
     */
    @Column(name = "direct_key", length = 80)
    private String directKey;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "last_message_at")
    private OffsetDateTime lastMessageAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public enum ChatType {
        DIRECT,
        GROUP
    }

    public static String directKeyOf(UUID a, UUID b) {
        String x = a.toString();
        String y = b.toString();
        return x.compareTo(y) <= 0 ? x + "|" + y : y + "|" + x;
    }
}
