package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.ChatMessage.MessageType;
import com.communityhub.chatservice.entity.MessageContent;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 客户端消息内容归一化：入口处解析一次，之后只处理 {@link MessageContent}。
 *
 * - 字符串 → Text
 * - 对象 → 按消息类型解析为 Media / Location / Contact，其余取 text 字段为 Text
 * - 其他（null、数字、数组等）→ 空 Text
 */
public final class MessageContents {

    private MessageContents() {
    }

    public static MessageContent normalize(JsonNode raw, MessageType type) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return new MessageContent.Text("");
        }
        if (raw.isTextual()) {
            return new MessageContent.Text(raw.asText());
        }
        if (!raw.isObject()) {
            return new MessageContent.Text("");
        }
        String text = text(raw, "text");
        if (type.isMedia()) {
            return new MessageContent.Media(text, text(raw, "url"), text(raw, "mimeType"),
                    text(raw, "fileName"), longValue(raw, "size"));
        }
        return switch (type) {
            case LOCATION -> new MessageContent.Location(text, doubleValue(raw, "latitude"),
                    doubleValue(raw, "longitude"), text(raw, "address"));
            case CONTACT -> new MessageContent.Contact(text, text(raw, "name"), text(raw, "phone"),
                    text(raw, "email"));
            default -> new MessageContent.Text(text == null ? "" : text);
        };
    }

    /**
     * 文本长度（用于长度校验），text 为空按 0 计
     */
    public static int textLength(MessageContent content) {
        return content.text() == null ? 0 : content.text().length();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Double doubleValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static Long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToLong() ? value.asLong() : null;
    }
}
