package com.communityhub.chatservice.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * 启用 Feign 客户端（推送服务）
 */
@Configuration
@EnableFeignClients(basePackages = "com.communityhub.chatservice.infrastructure.client")
public class FeignConfig {
}
