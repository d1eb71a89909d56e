package com.communityhub.web.common;

/**
 * 当前用户信息 DTO
 * 从 JWT token 中提取的用户信息，统一封装
 */
public record CurrentUserInfo(
    /** 用户ID（优先 userId / id claim，其次 subject） */
    String userId,

    /** 用户名（username / preferred_username，可能为 null） */
    String username,

    /** 角色（role claim，可能为 null，以用户表为准） */
    String role
) {
    /**
     * 获取显示名称（用于日志或兜底展示）
     * 优先级：username > userId
     */
    public String getDisplayName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }
}
