package com.communityhub.chatservice.controller.ws.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.Map;

/**
 * send_message 命令。content 可以是字符串或对象，入口处统一归一化。
 * 客户端传入的 senderId 等字段一律忽略。
 */
@Data
public class SendChatMessage {
    private String chatId;
    private JsonNode content;
    private String type;                  // text / image / video / audio / file / location / contact
    private Map<String, Object> media;
    private Map<String, Object> location;
    private String replyToId;
}
