package com.communityhub.chatservice.controller.ws;

import com.communityhub.chatservice.common.exception.NotFoundException;
import com.communityhub.chatservice.controller.ws.dto.ChatRef;
import com.communityhub.chatservice.controller.ws.dto.SendChatMessage;
import com.communityhub.chatservice.service.ChatMessagingService;
import com.communityhub.chatservice.service.dto.ChatEvents;
import com.communityhub.chatservice.service.dto.ErrorPayload;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RecordingEventEmitter;
import com.communityhub.chatservice.ws.RoomRouter;
import com.communityhub.chatservice.ws.TestUsers;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatWsController")
class ChatWsControllerTest {

    @Mock
    private ChatMessagingService chatMessagingService;

    private RecordingEventEmitter emitter;
    private RoomRouter router;
    private ChatWsController controller;
    private Connection alice;

    @BeforeEach
    void setUp() {
        emitter = new RecordingEventEmitter();
        router = new RoomRouter(emitter);
        controller = new ChatWsController(chatMessagingService, router);
        alice = TestUsers.connect(router, TestUsers.user("alice"), "c-alice");
    }

    @Test
    @DisplayName("send_message forwards the parsed chat id and raw content")
    void sendMessage() {
        // given
        UUID chatId = UUID.randomUUID();
        SendChatMessage cmd = new SendChatMessage();
        cmd.setChatId(chatId.toString());
        cmd.setContent(TextNode.valueOf("hi"));
        cmd.setType("text");

        // when
        controller.sendMessage(cmd, headers("c-alice"));

        // then
        verify(chatMessagingService).sendMessage(eq(alice), eq(chatId), eq(TextNode.valueOf("hi")), eq("text"),
                isNull(), isNull(), isNull());
    }

    @Test
    @DisplayName("a malformed chat id is reported as error: Chat not found")
    void malformedChatId() {
        ChatRef cmd = new ChatRef();
        cmd.setChatId("nope");
        SimpMessageHeaderAccessor sha = headers("c-alice");

        NotFoundException thrown = catchThrowableOfType(() -> controller.joinChat(cmd, sha), NotFoundException.class);
        controller.handleException(thrown, sha);

        assertThat(emitter.to("c-alice")).hasSize(1);
        assertThat(emitter.to("c-alice").get(0).event()).isEqualTo(ChatEvents.ERROR);
        assertThat(emitter.to("c-alice").get(0).payload()).isEqualTo(new ErrorPayload("Chat not found"));
        verifyNoInteractions(chatMessagingService);
    }

    private static SimpMessageHeaderAccessor headers(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create();
        accessor.setSessionId(sessionId);
        accessor.setDestination("/app/test");
        return accessor;
    }
}
