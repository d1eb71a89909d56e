package com.communityhub.chatservice.infrastructure.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.Map;

/**
 * 调用推送服务，给离线参与者发送新消息提醒（投递本身由推送服务负责）。
 */
@FeignClient(name = "push-service", url = "${chat.push-service-url}", fallback = PushNotificationClientFallback.class)
public interface PushNotificationClient {

    @PostMapping("/api/push/dispatch")
    @CircuitBreaker(name = "pushClient")
    void dispatch(@RequestBody PushRequest request);

    record PushRequest(String userId, String title, String body, Map<String, Object> data) {}
}
