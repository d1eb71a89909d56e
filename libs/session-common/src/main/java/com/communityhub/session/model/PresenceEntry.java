package com.communityhub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 在线状态条目。
 *
 * 每个在线用户一条（后连接覆盖前连接），写入共享缓存后多实例可见。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceEntry {

    /**
     * 用户 ID。
     */
    private String userId;

    /**
     * 持有该在线状态的连接 ID（STOMP sessionId）。
     */
    private String connectionId;

    /**
     * 产生该连接的服务名（例如 chat-service）。
     */
    private String service;

    /**
     * 最近一次上线/心跳时间（毫秒时间戳）。
     */
    private Long lastSeenAt;

    /**
     * 以 ISO-8601 字符串返回最近在线时间，便于展示。
     */
    public String getLastSeenAtIso() {
        if (lastSeenAt == null) {
            return "";
        }
        return Instant.ofEpochMilli(lastSeenAt).toString();
    }
}
