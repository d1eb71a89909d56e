package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.security.AuthenticatedUser;

/**
 * 发送者最小投影（不下发完整用户记录）
 */
public record SenderView(String id, String username, String displayName) {

    public static SenderView of(AuthenticatedUser user) {
        return new SenderView(user.userId(), user.username(), user.displayName());
    }

    public static SenderView of(AppUser user) {
        return new SenderView(user.getId().toString(), user.getUsername(), user.resolveDisplayName());
    }

    public static SenderView unknown(Object userId) {
        String id = String.valueOf(userId);
        return new SenderView(id, id, id);
    }
}
