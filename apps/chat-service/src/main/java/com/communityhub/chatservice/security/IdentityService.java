package com.communityhub.chatservice.security;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * 身份查询：token / JWT → 用户。
 */
public interface IdentityService {

    /**
     * 校验原始 bearer token 并加载用户
     *
     * @throws com.communityhub.chatservice.common.exception.AuthenticationFailedException 缺少/无效 token、用户不存在或账号不可用
     */
    AuthenticatedUser verify(String token);

    /**
     * 由资源服务器已校验的 JWT 加载用户
     */
    AuthenticatedUser resolve(Jwt jwt);
}
