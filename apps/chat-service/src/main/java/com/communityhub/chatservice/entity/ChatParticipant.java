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
 * 聊天参与者表实体
 * 对应数据库表：chat_participants
 */
@Entity
@Table(name = "chat_participants", indexes = {
    @Index(name = "idx_chat_participant_chat", columnList = "chat_id"),
    @Index(name = "idx_chat_participant_user", columnList = "user_id,active")
}, uniqueConstraints = {
    @UniqueConstraint(columnNames = {"chat_id", "user_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "chat_id", nullable = false)
    private UUID chatId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * 成员角色：MEMBER（成员）、ADMIN（群管理员）
     */
    @Column(name = "participant_role", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private ParticipantRole participantRole = ParticipantRole.MEMBER;

    /**
     * 是否仍在聊天中（离开后置为 false，保留记录）
     */
    @Column(name = "active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    @Column(name = "left_at")
    private OffsetDateTime leftAt;

    @Column(name = "last_read_at")
    private OffsetDateTime lastReadAt;

    public enum ParticipantRole {
        MEMBER,
        ADMIN
    }
}
