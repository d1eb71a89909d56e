package com.communityhub.chatservice.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 消息内容。入口处一次性归一为以下四种之一，之后不再做形状判断。
 * 序列化时带 kind 字段，text 字段所有变体都有（媒体等为说明文字）。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = MessageContent.Text.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = MessageContent.Text.class, name = "text"),
    @JsonSubTypes.Type(value = MessageContent.Media.class, name = "media"),
    @JsonSubTypes.Type(value = MessageContent.Location.class, name = "location"),
    @JsonSubTypes.Type(value = MessageContent.Contact.class, name = "contact")
})
public sealed interface MessageContent {

    String text();

    record Text(String text) implements MessageContent {
    }

    record Media(String text, String url, String mimeType, String fileName, Long size) implements MessageContent {
    }

    record Location(String text, Double latitude, Double longitude, String address) implements MessageContent {
    }

    record Contact(String text, String name, String phone, String email) implements MessageContent {
    }
}
