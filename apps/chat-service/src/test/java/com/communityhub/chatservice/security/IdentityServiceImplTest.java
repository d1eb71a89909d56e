package com.communityhub.chatservice.security;

import com.communityhub.chatservice.common.exception.AuthenticationFailedException;
import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdentityServiceImpl")
class IdentityServiceImplTest {

    @Mock
    private JwtDecoder jwtDecoder;

    @Mock
    private UserRepository userRepository;

    private IdentityServiceImpl identityService;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        identityService = new IdentityServiceImpl(jwtDecoder, userRepository);
    }

    @Test
    @DisplayName("a valid token for an active account resolves the user")
    void verifiesToken() {
        // given
        when(jwtDecoder.decode("t")).thenReturn(jwt(userId.toString()));
        when(userRepository.findById(userId)).thenReturn(Optional.of(user(AppUser.Status.ACTIVE)));

        // when
        AuthenticatedUser result = identityService.verify("t");

        // then
        assertThat(result.userId()).isEqualTo(userId.toString());
        assertThat(result.displayName()).isEqualTo("Alice");
        assertThat(result.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("missing token is rejected before decoding")
    void missingToken() {
        assertThatThrownBy(() -> identityService.verify(" "))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("no token");
        verifyNoInteractions(jwtDecoder);
    }

    @Test
    @DisplayName("undecodable token is rejected")
    void invalidToken() {
        when(jwtDecoder.decode("bad")).thenThrow(new BadJwtException("signature mismatch"));

        assertThatThrownBy(() -> identityService.verify("bad"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("invalid token");
    }

    @Test
    @DisplayName("unknown users and banned accounts are rejected")
    void unknownOrBanned() {
        UUID other = UUID.randomUUID();
        when(userRepository.findById(other)).thenReturn(Optional.empty());
        when(userRepository.findById(userId)).thenReturn(Optional.of(user(AppUser.Status.BANNED)));

        assertThatThrownBy(() -> identityService.resolve(jwt(other.toString())))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("user not found");
        assertThatThrownBy(() -> identityService.resolve(jwt(userId.toString())))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("banned");
    }

    @Test
    @DisplayName("a non-UUID subject is rejected")
    void badSubject() {
        assertThatThrownBy(() -> identityService.resolve(jwt("not-a-uuid")))
                .isInstanceOf(AuthenticationFailedException.class);
        verifyNoInteractions(userRepository);
    }

    private static Jwt jwt(String userId) {
        return Jwt.withTokenValue("t")
                .header("alg", "HS256")
                .claim("userId", userId)
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(600))
                .build();
    }

    private AppUser user(AppUser.Status status) {
        return AppUser.builder()
                .id(userId)
                .username("alice")
                .displayName("Alice")
                .role(AppUser.Role.USER)
                .status(status)
                .build();
    }
}
