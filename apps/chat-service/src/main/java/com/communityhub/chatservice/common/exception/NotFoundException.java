package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 引用的聊天/会话/消息不存在
 */
public class NotFoundException extends ChatServiceException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
