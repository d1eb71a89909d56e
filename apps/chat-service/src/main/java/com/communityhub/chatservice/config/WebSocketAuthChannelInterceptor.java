package com.communityhub.chatservice.config;

import com.communityhub.chatservice.common.exception.AuthenticationFailedException;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.security.IdentityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 在 CONNECT 阶段从 STOMP header 提取 token 并校验身份。
 *
 * 校验失败直接抛出异常：Spring 回 ERROR 帧并关闭连接，不会创建任何连接状态。
 * 之后的帧沿用 CONNECT 时设置的用户。
 */
@Component
@Slf4j
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final IdentityService identityService;

    public WebSocketAuthChannelInterceptor(IdentityService identityService) {
        this.identityService = identityService;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        if (!StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String sessionId = accessor.getSessionId();
        String token = extractToken(accessor);
        try {
            AuthenticatedUser user = identityService.verify(token);
            UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                    user, null, List.of(new SimpleGrantedAuthority("ROLE_" + user.role().name())));
            accessor.setUser(authentication);
            log.info("WS CONNECT auth ok, user={}, role={}, sessionId={}", user.userId(), user.role(), sessionId);
            return message;
        } catch (AuthenticationFailedException e) {
            log.warn("WS CONNECT rejected, sessionId={}, reason={}", sessionId, e.getMessage());
            throw e;
        }
    }

    /**
     * 依次尝试 Authorization: Bearer xxx、access_token、token
     */
    static String extractToken(StompHeaderAccessor accessor) {
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) {
            auth = firstHeader(accessor, "authorization");
        }
        if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = auth.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        for (String key : List.of("access_token", "token")) {
            String value = firstHeader(accessor, key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
