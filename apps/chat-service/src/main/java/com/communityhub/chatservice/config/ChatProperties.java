package com.communityhub.chatservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 聊天服务配置（前缀 chat）。
 *
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Component
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /**
     * HS256 签名密钥，与社区平台登录服务签发 token 时一致（至少 32 字节）
     */
    private String jwtSecret;

    /**
     * WebSocket 允许的来源
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * 单条消息文本最大长度
     */
    private int messageMaxLength = 5000;

    /**
     * 聊天历史默认每页条数
     */
    private int historyPageSize = 50;

    /**
     * 客服会话列表默认每页条数
     */
    private int liveChatPageSize = 20;

    /**
     * 共享缓存中在线状态的存活时间
     */
    private Duration presenceTtl = Duration.ofHours(24);

    /**
     * STOMP 心跳间隔（毫秒）
     */
    private long heartbeatMillis = 10000;

    /**
     * 离线推送服务地址
     */
    private String pushServiceUrl = "http://localhost:8090";
}
