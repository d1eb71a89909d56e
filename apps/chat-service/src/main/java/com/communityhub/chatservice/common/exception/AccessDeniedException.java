package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 成员或角色校验未通过
 */
public class AccessDeniedException extends ChatServiceException {

    public AccessDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
