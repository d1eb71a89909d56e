package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 聊天服务业务异常基类。
 * message 直接展示给客户端（REST 的 message 字段 / WS 的 error 事件）。
 */
public abstract class ChatServiceException extends RuntimeException {

    private final HttpStatus status;

    protected ChatServiceException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ChatServiceException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
