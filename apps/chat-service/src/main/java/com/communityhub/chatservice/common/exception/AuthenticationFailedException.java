package com.communityhub.chatservice.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 身份校验失败（缺少/无效 token、用户不存在或被封禁）
 */
public class AuthenticationFailedException extends ChatServiceException {

    public AuthenticationFailedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
