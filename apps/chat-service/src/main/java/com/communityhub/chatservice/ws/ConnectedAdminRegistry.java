package com.communityhub.chatservice.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线管理员连接表：adminUserId → 连接集合。
 *
 * 与普通在线状态分开维护，客服排队事件直接推给这里的连接，不经过房间。
 * 管理员连接建立、接入会话时登记，连接断开时注销。
 */
@Slf4j
@Component
public class ConnectedAdminRegistry {

    private final Map<String, Set<Connection>> admins = new ConcurrentHashMap<>();

    public void register(Connection connection) {
        if (!connection.isAdmin() || !connection.isLive()) {
            return;
        }
        admins.compute(connection.getUserId(), (key, set) -> {
            Set<Connection> members = set != null ? set : ConcurrentHashMap.newKeySet();
            members.add(connection);
            return members;
        });
    }

    public void unregister(Connection connection) {
        admins.computeIfPresent(connection.getUserId(), (key, set) -> {
            set.remove(connection);
            return set.isEmpty() ? null : set;
        });
    }

    public boolean isConnected(String adminId) {
        return admins.containsKey(adminId);
    }

    /**
     * 当前在线管理员的连接快照，可选排除某个管理员
     */
    public List<Connection> connections(String excludeAdminId) {
        List<Connection> result = new ArrayList<>();
        admins.forEach((adminId, set) -> {
            if (adminId.equals(excludeAdminId)) {
                return;
            }
            for (Connection c : set) {
                if (c.isLive()) {
                    result.add(c);
                }
            }
        });
        return result;
    }

    public int adminCount() {
        return admins.size();
    }
}
