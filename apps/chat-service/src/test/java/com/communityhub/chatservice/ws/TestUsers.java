package com.communityhub.chatservice.ws;

import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.security.AuthenticatedUser;

import java.time.Instant;
import java.util.UUID;

/**
 * 测试用户与连接
 */
public final class TestUsers {

    private TestUsers() {
    }

    public static AuthenticatedUser user(String name) {
        return new AuthenticatedUser(UUID.randomUUID().toString(), name, name.toUpperCase(), AppUser.Role.USER);
    }

    public static AuthenticatedUser admin(String name) {
        return new AuthenticatedUser(UUID.randomUUID().toString(), name, name.toUpperCase(), AppUser.Role.ADMIN);
    }

    public static Connection connect(RoomRouter router, AuthenticatedUser user, String connectionId) {
        Connection connection = new Connection(connectionId, user, Instant.now());
        router.register(connection);
        router.join(connection, RoomKeys.user(user.userId()));
        return connection;
    }
}
