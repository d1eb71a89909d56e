package com.communityhub.chatservice.ws;

import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 用户目的地的投递：/user/queue/{event}。
 * 带上 sessionId 头，只投递到该连接，不会发给同一用户的其他连接。
 */
@Component
@RequiredArgsConstructor
public class StompEventEmitter implements EventEmitter {

    static final String QUEUE_PREFIX = "/queue/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void emit(Connection target, String event, Object payload) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(target.getId());
        headerAccessor.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(
                target.getUserId(),
                QUEUE_PREFIX + event,
                payload,
                headerAccessor.getMessageHeaders());
    }
}
