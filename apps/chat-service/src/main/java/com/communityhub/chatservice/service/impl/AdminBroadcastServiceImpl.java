package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.service.AdminBroadcastService;
import com.communityhub.chatservice.ws.ConnectedAdminRegistry;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminBroadcastServiceImpl implements AdminBroadcastService {

    private final ConnectedAdminRegistry adminRegistry;
    private final RoomRouter router;

    @Override
    public int notifyAllAdmins(String event, Object payload, String excludeAdminId) {
        int delivered = 0;
        for (Connection connection : adminRegistry.connections(excludeAdminId)) {
            if (router.send(connection, event, payload)) {
                delivered++;
            }
        }
        log.debug("admin broadcast: event={}, admins={}, delivered={}", event, adminRegistry.adminCount(), delivered);
        return delivered;
    }
}
