package com.communityhub.chatservice.security;

import com.communityhub.chatservice.common.exception.AuthenticationFailedException;
import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.repository.UserRepository;
import com.communityhub.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityServiceImpl implements IdentityService {

    private final JwtDecoder jwtDecoder;
    private final UserRepository userRepository;

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("Authentication error: no token provided");
        }
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.warn("token rejected: {}", e.getMessage());
            throw new AuthenticationFailedException("Authentication error: invalid token");
        }
        return resolve(jwt);
    }

    @Override
    public AuthenticatedUser resolve(Jwt jwt) {
        String rawId = CurrentUserHelper.getUserId(jwt);
        if (rawId == null) {
            throw new AuthenticationFailedException("Authentication error: token has no user id");
        }
        UUID userId;
        try {
            userId = UUID.fromString(rawId);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailedException("Authentication error: invalid user id");
        }
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationFailedException("Authentication error: user not found"));
        if (user.getStatus() != AppUser.Status.ACTIVE) {
            log.warn("inactive account rejected: userId={}, status={}", userId, user.getStatus());
            throw new AuthenticationFailedException("Authentication error: account is " + user.getStatus().name().toLowerCase());
        }
        return AuthenticatedUser.of(user);
    }
}
