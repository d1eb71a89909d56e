package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 用户已有进行中的客服会话
 */
public class DuplicateSessionException extends ChatServiceException {

    public static final String MESSAGE = "You already have an active chat session";

    public DuplicateSessionException() {
        super(HttpStatus.BAD_REQUEST, MESSAGE);
    }
}
