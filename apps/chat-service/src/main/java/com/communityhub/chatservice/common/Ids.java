package com.communityhub.chatservice.common;

import com.communityhub.chatservice.common.exception.NotFoundException;

import java.util.UUID;

/**
 * 客户端传入 ID 的解析。格式非法等同于不存在。
 */
public final class Ids {

    private Ids() {
    }

    public static UUID parse(String raw, String notFoundMessage) {
        if (raw == null || raw.isBlank()) {
            throw new NotFoundException(notFoundMessage);
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new NotFoundException(notFoundMessage);
        }
    }
}
