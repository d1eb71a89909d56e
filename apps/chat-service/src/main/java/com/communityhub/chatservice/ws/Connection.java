package com.communityhub.chatservice.ws;

import com.communityhub.chatservice.security.AuthenticatedUser;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一条已认证的实时连接（一个 STOMP session）。
 *
 * 只在握手认证成功后创建，断开后失效；生命周期内由 {@link RoomRouter} 持有。
 * 连接自己记录加入过的房间，断开时据此一次性清理。
 */
public class Connection {

    private final String id;
    private final AuthenticatedUser user;
    private final Instant connectedAt;
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean live = new AtomicBoolean(true);

    public Connection(String id, AuthenticatedUser user, Instant connectedAt) {
        this.id = id;
        this.user = user;
        this.connectedAt = connectedAt;
    }

    public String getId() {
        return id;
    }

    public AuthenticatedUser getUser() {
        return user;
    }

    public String getUserId() {
        return user.userId();
    }

    public boolean isAdmin() {
        return user.isAdmin();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isLive() {
        return live.get();
    }

    /**
     * 切换到断开状态，只有第一次调用返回 true
     */
    public boolean markDisconnected() {
        return live.compareAndSet(true, false);
    }

    public Set<String> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    boolean addRoom(String roomId) {
        return rooms.add(roomId);
    }

    boolean removeRoom(String roomId) {
        return rooms.remove(roomId);
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", userId=" + user.userId() + ", role=" + user.role() + "}";
    }
}
