package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.security.AuthenticatedUser;

/**
 * 客服会话事件中的参与者信息（带角色，区分用户与客服）
 */
public record ParticipantView(String id, String username, String displayName, String role) {

    public static ParticipantView of(AuthenticatedUser user) {
        return new ParticipantView(user.userId(), user.username(), user.displayName(),
                user.role().name().toLowerCase());
    }
}
