package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.ChatMessage.MessageType;
import com.communityhub.chatservice.entity.MessageContent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MessageContents")
class MessageContentsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("a plain string becomes text")
    void stringToText() {
        MessageContent content = MessageContents.normalize(TextNode.valueOf("hi"), MessageType.TEXT);

        assertThat(content).isEqualTo(new MessageContent.Text("hi"));
    }

    @Test
    @DisplayName("an object for a media type becomes media")
    void objectToMedia() throws Exception {
        JsonNode raw = mapper.readTree("{\"text\":\"look\",\"url\":\"https://cdn/x.png\",\"mimeType\":\"image/png\",\"size\":1024}");

        MessageContent content = MessageContents.normalize(raw, MessageType.IMAGE);

        assertThat(content).isInstanceOf(MessageContent.Media.class);
        MessageContent.Media media = (MessageContent.Media) content;
        assertThat(media.url()).isEqualTo("https://cdn/x.png");
        assertThat(media.size()).isEqualTo(1024L);
        assertThat(media.text()).isEqualTo("look");
    }

    @Test
    @DisplayName("location and contact objects resolve by message type")
    void locationAndContact() throws Exception {
        MessageContent location = MessageContents.normalize(
                mapper.readTree("{\"latitude\":51.5,\"longitude\":-0.12,\"address\":\"London\"}"), MessageType.LOCATION);
        MessageContent contact = MessageContents.normalize(
                mapper.readTree("{\"name\":\"Ann\",\"phone\":\"123\"}"), MessageType.CONTACT);

        assertThat(location).isEqualTo(new MessageContent.Location(null, 51.5, -0.12, "London"));
        assertThat(contact).isEqualTo(new MessageContent.Contact(null, "Ann", "123", null));
    }

    @Test
    @DisplayName("an object for a text message uses its text field")
    void objectToText() throws Exception {
        MessageContent content = MessageContents.normalize(mapper.readTree("{\"text\":\"hello\"}"), MessageType.TEXT);

        assertThat(content.text()).isEqualTo("hello");
    }

    @Test
    @DisplayName("null, numbers and arrays become empty text")
    void otherShapes() throws Exception {
        assertThat(MessageContents.normalize(null, MessageType.TEXT)).isEqualTo(new MessageContent.Text(""));
        assertThat(MessageContents.normalize(NullNode.getInstance(), MessageType.TEXT).text()).isEmpty();
        assertThat(MessageContents.normalize(IntNode.valueOf(42), MessageType.TEXT).text()).isEmpty();
        assertThat(MessageContents.normalize(mapper.readTree("[1,2]"), MessageType.IMAGE).text()).isEmpty();
    }

    @Test
    @DisplayName("text length counts missing text as zero")
    void textLength() {
        assertThat(MessageContents.textLength(new MessageContent.Text("abc"))).isEqualTo(3);
        assertThat(MessageContents.textLength(new MessageContent.Contact(null, "Ann", null, null))).isZero();
    }

    @Test
    @DisplayName("unknown message types parse as text")
    void parseType() {
        assertThat(MessageType.parse("image")).isEqualTo(MessageType.IMAGE);
        assertThat(MessageType.parse("sticker")).isEqualTo(MessageType.TEXT);
        assertThat(MessageType.parse(null)).isEqualTo(MessageType.TEXT);
    }
}
