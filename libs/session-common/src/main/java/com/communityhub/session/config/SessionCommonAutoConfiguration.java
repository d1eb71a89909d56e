package com.communityhub.session.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Import;

/**
 * session-common 自动配置入口。
 *
 * 只有配置了 session.redis.host 才启用共享在线状态缓存；
 * 未配置时使用方拿不到 PresenceCache，自行降级为单实例内存。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "session.redis", name = "host")
@Import(SessionRedisConfig.class)
public class SessionCommonAutoConfiguration {
}
