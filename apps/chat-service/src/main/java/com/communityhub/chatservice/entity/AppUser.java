package com.communityhub.chatservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 用户表实体（只映射聊天子系统用到的字段）
 * 对应数据库表：users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_role_status", columnList = "role,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppUser {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "role", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Role role = Role.USER;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.ACTIVE;

    @Column(name = "is_online", nullable = false)
    @Builder.Default
    private Boolean isOnline = false;

    @Column(name = "last_active")
    private OffsetDateTime lastActive;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * 展示名：displayName 为空时退回 username
     */
    public String resolveDisplayName() {
        return displayName != null && !displayName.isBlank() ? displayName : username;
    }

    public enum Role {
        USER,
        MODERATOR,
        ADMIN
    }

    public enum Status {
        ACTIVE,
        SUSPENDED,
        BANNED
    }
}
