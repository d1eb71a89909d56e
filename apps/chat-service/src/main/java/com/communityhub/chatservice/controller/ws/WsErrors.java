package com.communityhub.chatservice.controller.ws;

import com.communityhub.chatservice.common.exception.ChatServiceException;
import lombok.extern.slf4j.Slf4j;

/**
 * WS 处理异常 → 下发给客户端的错误文案
 */
@Slf4j
final class WsErrors {

    static final String SERVER_ERROR = "Server error";

    private WsErrors() {
    }

    static String messageOf(Throwable e, String event, String sessionId) {
        if (e instanceof ChatServiceException ex) {
            if (ex.getStatus().is5xxServerError()) {
                log.error("WS {} failed: session={}", event, sessionId, ex);
            } else {
                log.warn("WS {} rejected: session={}, reason={}", event, sessionId, ex.getMessage());
            }
            return ex.getMessage();
        }
        if (e instanceof IllegalArgumentException) {
            log.warn("WS {} rejected: session={}, reason={}", event, sessionId, e.getMessage());
            return e.getMessage();
        }
        log.error("WS {} failed: session={}", event, sessionId, e);
        return SERVER_ERROR;
    }
}
