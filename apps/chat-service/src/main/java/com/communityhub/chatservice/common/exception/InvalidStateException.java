package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 会话状态不允许当前操作
 */
public class InvalidStateException extends ChatServiceException {

    public InvalidStateException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
