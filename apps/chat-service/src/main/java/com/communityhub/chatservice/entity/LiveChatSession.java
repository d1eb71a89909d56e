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
 * 在线客服会话表实体
 * 对应数据库表：live_chats
 *
 * 状态只有 ACTIVE / ENDED / CANCELLED 三种持久化值，
 * “待接入 / 已接入”由 adminId 是否为空区分，见 {@link #phase()}。
 */
@Entity
@Table(name = "live_chats", indexes = {
    @Index(name = "idx_live_chats_user", columnList = "user_id"),
    @Index(name = "idx_live_chats_status_admin", columnList = "status,admin_id"),
    @Index(name = "idx_live_chats_started", columnList = "started_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_live_chats_active_user", columnNames = "active_user_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveChatSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * 发起会话的用户
     */
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    /**
     * 接入的管理员（未接入时为空）
     */
    @Column(name = "admin_id")
    private UUID adminId;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.ACTIVE;

    /**
     * 进行中会话唯一键：ACTIVE 时等于 userId，进入终态时置空（见 LiveChatSessionRepository#terminate）。
     * 唯一约束保证每个用户同时最多一个进行中的会话。
     */
    @Column(name = "active_user_key", length = 40)
    private String activeUserKey;

    @CreationTimestamp
    @Column(name = "started_at", nullable = false, updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public Phase phase() {
        return switch (status) {
            case ACTIVE -> adminId == null ? Phase.REQUESTED : Phase.CLAIMED;
            case ENDED -> Phase.ENDED;
            case CANCELLED -> Phase.CANCELLED;
        };
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public boolean isOwnedBy(UUID user) {
        return userId != null && userId.equals(user);
    }

    public boolean isAssignedTo(UUID admin) {
        return adminId != null && adminId.equals(admin);
    }

    public enum Status {
        ACTIVE,
        ENDED,
        CANCELLED;

        public boolean isTerminal() {
            return this != ACTIVE;
        }
    }

    public enum Phase {
        REQUESTED,
        CLAIMED,
        ENDED,
        CANCELLED
    }
}
