package com.communityhub.chatservice.infrastructure.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PushNotificationClientFallback implements PushNotificationClient {
    @Override
    public void dispatch(PushRequest request) {
        log.warn("push-service unavailable, drop push, userId={}", request.userId());
    }
}
