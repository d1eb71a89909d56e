package com.communityhub.chatservice.security;

import com.communityhub.chatservice.entity.AppUser;
import org.springframework.security.core.AuthenticatedPrincipal;

import java.util.UUID;

/**
 * 已通过身份校验的用户（握手或 REST 请求）。
 * getName() 返回 userId，STOMP 的 /user 目的地按它路由。
 */
public record AuthenticatedUser(
        String userId,
        String username,
        String displayName,
        AppUser.Role role
) implements AuthenticatedPrincipal {

    public static AuthenticatedUser of(AppUser user) {
        return new AuthenticatedUser(
                user.getId().toString(),
                user.getUsername(),
                user.resolveDisplayName(),
                user.getRole());
    }

    @Override
    public String getName() {
        return userId;
    }

    public UUID id() {
        return UUID.fromString(userId);
    }

    public boolean isAdmin() {
        return role == AppUser.Role.ADMIN;
    }
}
