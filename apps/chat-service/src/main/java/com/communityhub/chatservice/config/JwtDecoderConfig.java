package com.communityhub.chatservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * JWT 解码器：社区平台登录服务使用 HS256 共享密钥签发 token。
 * REST（资源服务器）与 STOMP CONNECT 共用同一个解码器。
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class JwtDecoderConfig {

    private final ChatProperties chatProperties;

    @Bean
    public JwtDecoder jwtDecoder() {
        String secret = chatProperties.getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("chat.jwt-secret must be at least 32 bytes");
        }
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        log.info("JWT decoder initialised (HS256)");
        return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }
}
