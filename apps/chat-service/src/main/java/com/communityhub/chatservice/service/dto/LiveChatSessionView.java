package com.communityhub.chatservice.service.dto;

import com.communityhub.chatservice.entity.LiveChatSession;

import java.time.OffsetDateTime;

/**
 * 客服会话下发视图，phase 区分待接入 / 已接入
 */
public record LiveChatSessionView(
        String id,
        String userId,
        String adminId,
        String status,
        String phase,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        String notes,
        SenderView user,
        SenderView admin
) {

    public static LiveChatSessionView of(LiveChatSession session, SenderView user, SenderView admin) {
        return new LiveChatSessionView(
                session.getId().toString(),
                session.getUserId().toString(),
                session.getAdminId() == null ? null : session.getAdminId().toString(),
                session.getStatus().name().toLowerCase(),
                session.phase().name().toLowerCase(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getNotes(),
                user,
                admin);
    }
}
