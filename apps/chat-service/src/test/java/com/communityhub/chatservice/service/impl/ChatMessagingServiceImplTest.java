package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.common.exception.AccessDeniedException;
import com.communityhub.chatservice.common.exception.NotFoundException;
import com.communityhub.chatservice.common.exception.PersistenceFailureException;
import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.infrastructure.client.PushNotificationClient;
import com.communityhub.chatservice.presence.PresenceRegistry;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.ChatService;
import com.communityhub.chatservice.service.dto.ChatEvents;
import com.communityhub.chatservice.ws.Connection;
import com.communityhub.chatservice.ws.RecordingEventEmitter;
import com.communityhub.chatservice.ws.RoomKeys;
import com.communityhub.chatservice.ws.RoomRouter;
import com.communityhub.chatservice.ws.TestUsers;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatMessagingServiceImpl")
class ChatMessagingServiceImplTest {

    @Mock
    private ChatService chatService;

    @Mock
    private PresenceRegistry presenceRegistry;

    @Mock
    private PushNotificationClient pushNotificationClient;

    private RecordingEventEmitter emitter;
    private RoomRouter router;
    private ChatMessagingServiceImpl service;

    private final UUID chatId = UUID.randomUUID();
    private AuthenticatedUser alice;
    private AuthenticatedUser bob;
    private Connection aliceConn;
    private Connection bobConn;

    @BeforeEach
    void setUp() {
        emitter = new RecordingEventEmitter();
        router = new RoomRouter(emitter);
        service = new ChatMessagingServiceImpl(chatService, router, presenceRegistry, pushNotificationClient,
                new ChatProperties());
        alice = TestUsers.user("alice");
        bob = TestUsers.user("bob");
        aliceConn = TestUsers.connect(router, alice, "c-alice");
        bobConn = TestUsers.connect(router, bob, "c-bob");
    }

    @Test
    @DisplayName("B receives new_message with the text content when A sends to their direct chat")
    void deliversToParticipants() {
        // given
        router.join(aliceConn, RoomKeys.chat(chatId));
        router.join(bobConn, RoomKeys.chat(chatId));
        stubAppend();
        when(chatService.otherParticipants(chatId, alice.id())).thenReturn(List.of(bob.id()));
        when(presenceRegistry.isOnline(bob.userId())).thenReturn(true);

        // when
        service.sendMessage(aliceConn, chatId, TextNode.valueOf("hi"), "text", null, null, null);

        // then
        List<RecordingEventEmitter.Delivery> toBob = emitter.to("c-bob");
        assertThat(toBob).hasSize(1);
        assertThat(toBob.get(0).event()).isEqualTo(ChatEvents.NEW_MESSAGE);
        ChatEvents.NewMessage payload = (ChatEvents.NewMessage) toBob.get(0).payload();
        assertThat(payload.message().content().text()).isEqualTo("hi");
        assertThat(payload.message().sender().id()).isEqualTo(alice.userId());
        assertThat(payload.message().sender().displayName()).isEqualTo("ALICE");
        verifyNoInteractions(pushNotificationClient);
    }

    @Test
    @DisplayName("the sender id always comes from the connection")
    void senderFromConnection() {
        // given
        stubAppend();
        when(chatService.otherParticipants(chatId, alice.id())).thenReturn(List.of());

        // when
        service.sendMessage(aliceConn, chatId, TextNode.valueOf("hi"), null, null, null, null);

        // then
        ArgumentCaptor<UUID> sender = ArgumentCaptor.forClass(UUID.class);
        verify(chatService).appendMessage(eq(chatId), sender.capture(), eq(ChatMessage.MessageType.TEXT),
                any(MessageContent.class), isNull(), isNull(), isNull());
        assertThat(sender.getValue()).isEqualTo(alice.id());
    }

    @Test
    @DisplayName("a non-participant is rejected: nothing saved, nothing broadcast")
    void nonParticipantRejected() {
        // given
        router.join(bobConn, RoomKeys.chat(chatId));
        doThrow(new AccessDeniedException("Access denied to this chat"))
                .when(chatService).requireParticipant(chatId, alice.id());

        // when / then
        assertThatThrownBy(() -> service.sendMessage(aliceConn, chatId, TextNode.valueOf("hi"), "text",
                null, null, null))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage("Access denied to this chat");
        verify(chatService, never()).appendMessage(any(), any(), any(), any(), any(), any(), any());
        assertThat(emitter.all()).isEmpty();
    }

    @Test
    @DisplayName("an unknown chat is reported as not found")
    void unknownChat() {
        doThrow(new NotFoundException("Chat not found")).when(chatService).requireParticipant(chatId, alice.id());

        assertThatThrownBy(() -> service.sendMessage(aliceConn, chatId, TextNode.valueOf("hi"), "text",
                null, null, null))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Chat not found");
    }

    @Test
    @DisplayName("a storage failure aborts the send without any broadcast")
    void persistenceFailure() {
        // given
        router.join(bobConn, RoomKeys.chat(chatId));
        when(chatService.appendMessage(any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // when / then
        assertThatThrownBy(() -> service.sendMessage(aliceConn, chatId, TextNode.valueOf("hi"), "text",
                null, null, null))
                .isInstanceOf(PersistenceFailureException.class)
                .hasMessage("Failed to send message");
        assertThat(emitter.all()).isEmpty();
    }

    @Test
    @DisplayName("text longer than the configured maximum is rejected")
    void tooLong() {
        String text = "x".repeat(5001);

        assertThatThrownBy(() -> service.sendMessage(aliceConn, chatId, TextNode.valueOf(text), "text",
                null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(chatService, never()).appendMessage(any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("offline participants get a push notification")
    void pushesToOffline() {
        // given
        stubAppend();
        when(chatService.otherParticipants(chatId, alice.id())).thenReturn(List.of(bob.id()));
        when(presenceRegistry.isOnline(bob.userId())).thenReturn(false);

        // when
        service.sendMessage(aliceConn, chatId, TextNode.valueOf("are you there?"), "text", null, null, null);

        // then
        ArgumentCaptor<PushNotificationClient.PushRequest> request =
                ArgumentCaptor.forClass(PushNotificationClient.PushRequest.class);
        verify(pushNotificationClient).dispatch(request.capture());
        assertThat(request.getValue().userId()).isEqualTo(bob.userId());
        assertThat(request.getValue().body()).isEqualTo("are you there?");
        assertThat(request.getValue().data()).containsEntry("chatId", chatId.toString());
    }

    @Test
    @DisplayName("a failing push does not fail the send")
    void pushFailureIgnored() {
        stubAppend();
        when(chatService.otherParticipants(chatId, alice.id())).thenReturn(List.of(bob.id()));
        doThrow(new IllegalStateException("push down")).when(pushNotificationClient).dispatch(any());

        service.sendMessage(aliceConn, chatId, JsonNodeFactory.instance.objectNode().put("text", "hi"), "text",
                null, null, null);

        verify(pushNotificationClient).dispatch(any());
    }

    @Test
    @DisplayName("typing is relayed to the room except the typist")
    void typingRelayed() {
        // given
        router.join(aliceConn, RoomKeys.chat(chatId));
        router.join(bobConn, RoomKeys.chat(chatId));

        // when
        service.typing(aliceConn, chatId, true);
        service.typing(aliceConn, chatId, false);

        // then
        assertThat(emitter.to("c-alice")).isEmpty();
        assertThat(emitter.to("c-bob")).extracting(RecordingEventEmitter.Delivery::event)
                .containsExactly(ChatEvents.USER_TYPING, ChatEvents.USER_STOP_TYPING);
        ChatEvents.Typing typing = (ChatEvents.Typing) emitter.to("c-bob").get(0).payload();
        assertThat(typing.username()).isEqualTo("alice");
        assertThat(typing.userId()).isEqualTo(alice.userId());
    }

    @Test
    @DisplayName("typing from a connection outside the room is dropped")
    void typingOutsideRoom() {
        router.join(bobConn, RoomKeys.chat(chatId));

        service.typing(aliceConn, chatId, true);

        assertThat(emitter.all()).isEmpty();
    }

    @Test
    @DisplayName("joinChat subscribes only after the participant check")
    void joinChat() {
        doNothing().when(chatService).requireParticipant(chatId, alice.id());
        doThrow(new AccessDeniedException("Access denied to this chat"))
                .when(chatService).requireParticipant(chatId, bob.id());

        service.joinChat(aliceConn, chatId);
        assertThatThrownBy(() -> service.joinChat(bobConn, chatId)).isInstanceOf(AccessDeniedException.class);

        assertThat(router.isSubscribed("c-alice", RoomKeys.chat(chatId))).isTrue();
        assertThat(router.isSubscribed("c-bob", RoomKeys.chat(chatId))).isFalse();
    }

    @Test
    @DisplayName("markRead broadcasts the requested ids to the whole room, reader included")
    void markRead() {
        // given
        router.join(aliceConn, RoomKeys.chat(chatId));
        router.join(bobConn, RoomKeys.chat(chatId));
        UUID found = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        when(chatService.markRead(chatId, bob.id(), List.of(found, missing))).thenReturn(List.of(found));

        // when
        service.markRead(bobConn, chatId, List.of(found, missing));

        // then
        assertThat(emitter.ofEvent(ChatEvents.MESSAGES_READ))
                .extracting(RecordingEventEmitter.Delivery::connectionId)
                .containsExactlyInAnyOrder("c-alice", "c-bob");
        ChatEvents.MessagesRead payload = (ChatEvents.MessagesRead) emitter.to("c-alice").get(0).payload();
        assertThat(payload.userId()).isEqualTo(bob.userId());
        assertThat(payload.messageIds()).containsExactly(found.toString(), missing.toString());
    }

    @Test
    @DisplayName("markRead with no ids broadcasts nothing")
    void markReadEmpty() {
        router.join(aliceConn, RoomKeys.chat(chatId));
        when(chatService.markRead(chatId, bob.id(), List.of())).thenReturn(List.of());

        service.markRead(bobConn, chatId, List.of());

        assertThat(emitter.all()).isEmpty();
    }

    @Test
    @DisplayName("markRead storage failure broadcasts nothing")
    void markReadFailure() {
        router.join(aliceConn, RoomKeys.chat(chatId));
        when(chatService.markRead(eq(chatId), eq(bob.id()), anyList()))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.markRead(bobConn, chatId, List.of(UUID.randomUUID())))
                .isInstanceOf(PersistenceFailureException.class);
        assertThat(emitter.all()).isEmpty();
    }

    @Test
    @DisplayName("online status is answered to the caller only")
    void onlineStatus() {
        when(presenceRegistry.onlineStatus(List.of(bob.userId()))).thenReturn(Map.of(bob.userId(), true));

        service.sendOnlineStatus(aliceConn, List.of(bob.userId()));

        assertThat(emitter.all()).hasSize(1);
        assertThat(emitter.to("c-alice").get(0).event()).isEqualTo(ChatEvents.ONLINE_STATUS_RESPONSE);
        assertThat(emitter.to("c-alice").get(0).payload()).isEqualTo(Map.of(bob.userId(), true));
    }

    private void stubAppend() {
        when(chatService.appendMessage(eq(chatId), any(), any(), any(), any(), any(), any()))
                .thenAnswer(invocation -> ChatMessage.builder()
                        .id(UUID.randomUUID())
                        .chatId(invocation.getArgument(0))
                        .senderId(invocation.getArgument(1))
                        .messageType(invocation.getArgument(2))
                        .content(invocation.getArgument(3))
                        .createdAt(OffsetDateTime.now())
                        .updatedAt(OffsetDateTime.now())
                        .build());
    }
}
