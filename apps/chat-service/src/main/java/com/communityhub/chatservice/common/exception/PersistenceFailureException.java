package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 存储不可用，操作已中止（不自动重试）
 */
public class PersistenceFailureException extends ChatServiceException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
