package com.communityhub.chatservice.ws;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房间路由：房间 ID → 订阅连接集合。
 *
 * 索引：
 * - connectionId -> Connection
 * - roomId       -> Set<connectionId>
 * 每条成员关系同时记在所属 Connection 上，断开时按连接自己的房间列表清理。
 *
 * 投递是尽力而为、每次最多一次：已断开的订阅者收不到，也不重试。
 * join 不做权限校验，由调用方（聊天/客服流程）先校验。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomRouter {

    private final EventEmitter emitter;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public void register(Connection connection) {
        connections.put(connection.getId(), connection);
    }

    public Optional<Connection> find(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * 加入房间，已加入则无操作
     *
     * @return true 表示新加入
     */
    public boolean join(Connection connection, String roomId) {
        if (!connection.isLive()) {
            return false;
        }
        boolean added = connection.addRoom(roomId);
        rooms.compute(roomId, (key, members) -> {
            Set<String> set = members != null ? members : ConcurrentHashMap.newKeySet();
            set.add(connection.getId());
            return set;
        });
        // 与断开清理并发时，不留下悬挂的成员关系
        if (!connection.isLive()) {
            leave(connection, roomId);
            return false;
        }
        return added;
    }

    /**
     * 离开房间，未加入则无操作
     */
    public boolean leave(Connection connection, String roomId) {
        boolean removed = connection.removeRoom(roomId);
        detach(connection.getId(), roomId);
        return removed;
    }

    /**
     * 向房间内所有订阅者投递，可排除一个连接（通常是发送者）。
     *
     * @return 实际投递的连接数
     */
    public int broadcast(String roomId, String event, Object payload, String excludeConnectionId) {
        Set<String> members = rooms.get(roomId);
        if (members == null || members.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (String connectionId : members) {
            if (connectionId.equals(excludeConnectionId)) {
                continue;
            }
            Connection target = connections.get(connectionId);
            if (target == null || !target.isLive()) {
                continue;
            }
            if (send(target, event, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int broadcast(String roomId, String event, Object payload) {
        return broadcast(roomId, event, payload, null);
    }

    /**
     * 投递到用户私有房间（不依赖聊天成员关系）
     */
    public int emitToUser(String userId, String event, Object payload) {
        return broadcast(RoomKeys.user(userId), event, payload, null);
    }

    /**
     * 单连接投递，失败只记录日志
     */
    public boolean send(Connection target, String event, Object payload) {
        try {
            emitter.emit(target, event, payload);
            return true;
        } catch (Exception e) {
            log.warn("deliver failed: event={}, connection={}", event, target.getId(), e);
            return false;
        }
    }

    /**
     * 移除连接及其全部房间成员关系。
     *
     * @return 该连接离开的房间
     */
    public List<String> removeConnection(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return List.of();
        }
        List<String> left = new ArrayList<>(connection.getRooms());
        for (String roomId : left) {
            connection.removeRoom(roomId);
            detach(connectionId, roomId);
        }
        return left;
    }

    public Set<String> subscribers(String roomId) {
        Set<String> members = rooms.get(roomId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public boolean isSubscribed(String connectionId, String roomId) {
        Set<String> members = rooms.get(roomId);
        return members != null && members.contains(connectionId);
    }

    /**
     * 用户当前的所有存活连接
     */
    public List<Connection> connectionsOf(String userId) {
        List<Connection> result = new ArrayList<>();
        for (String connectionId : subscribers(RoomKeys.user(userId))) {
            Connection c = connections.get(connectionId);
            if (c != null && c.isLive()) {
                result.add(c);
            }
        }
        return result;
    }

    public int connectionCount() {
        return connections.size();
    }

    public int roomCount() {
        return rooms.size();
    }

    private void detach(String connectionId, String roomId) {
        rooms.computeIfPresent(roomId, (key, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }
}
