package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.entity.Chat;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.ChatParticipant;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.UserProfileService;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.service.impl.ChatServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 消息内容以 jsonb 存储后经 history() 读回
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("ChatMessageRepository on PostgreSQL")
class ChatMessageRepositoryTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    @Autowired
    private TestEntityManager em;

    @Autowired
    private ChatRepository chatRepository;

    @Autowired
    private ChatParticipantRepository participantRepository;

    @Autowired
    private ChatMessageRepository messageRepository;

    @Autowired
    private UserRepository userRepository;

    private ChatServiceImpl chatService;
    private AuthenticatedUser alice;
    private UUID chatId;

    @BeforeEach
    void setUp() {
        chatService = new ChatServiceImpl(chatRepository, participantRepository, messageRepository, userRepository,
                new UserProfileService(userRepository), new ChatProperties());
        AppUser stored = userRepository.save(AppUser.builder()
                .id(UUID.randomUUID())
                .username("alice")
                .displayName("Alice")
                .build());
        alice = AuthenticatedUser.of(stored);
        Chat chat = chatRepository.save(Chat.builder()
                .chatType(Chat.ChatType.GROUP)
                .name("Hikers")
                .createdBy(stored.getId())
                .build());
        chatId = chat.getId();
        participantRepository.save(ChatParticipant.builder()
                .chatId(chatId)
                .userId(stored.getId())
                .participantRole(ChatParticipant.ParticipantRole.ADMIN)
                .build());
        em.flush();
    }

    @Test
    @DisplayName("stored content reads back with the same variant, sender and type")
    void historyRoundTrip() {
        // given
        MessageContent.Text text = new MessageContent.Text("meet at the trailhead");
        MessageContent.Location spot = new MessageContent.Location("Trailhead", 46.55, 7.98, "Grindelwald");
        ChatMessage first = chatService.appendMessage(chatId, alice.id(), ChatMessage.MessageType.TEXT, text,
                null, null, null);
        ChatMessage second = chatService.appendMessage(chatId, alice.id(), ChatMessage.MessageType.LOCATION, spot,
                null, Map.of("latitude", 46.55, "longitude", 7.98), first.getId());
        em.flush();
        em.clear();

        // when
        Map<String, MessageView> history = chatService.history(alice, chatId, null, null).stream()
                .collect(Collectors.toMap(MessageView::id, Function.identity()));

        // then
        assertThat(history).hasSize(2);
        MessageView textView = history.get(first.getId().toString());
        assertThat(textView.content()).isEqualTo(text);
        assertThat(textView.senderId()).isEqualTo(alice.userId());
        assertThat(textView.type()).isEqualTo("text");
        assertThat(textView.sender().displayName()).isEqualTo("Alice");

        MessageView locationView = history.get(second.getId().toString());
        assertThat(locationView.content()).isInstanceOf(MessageContent.Location.class).isEqualTo(spot);
        assertThat(locationView.senderId()).isEqualTo(alice.userId());
        assertThat(locationView.type()).isEqualTo("location");
        assertThat(locationView.replyToId()).isEqualTo(first.getId().toString());
        assertThat(locationView.location()).containsEntry("latitude", 46.55);
    }

    @Test
    @DisplayName("a read receipt survives the jsonb round trip")
    void readReceiptStored() {
        ChatMessage message = chatService.appendMessage(chatId, alice.id(), ChatMessage.MessageType.TEXT,
                new MessageContent.Text("hi"), null, null, null);
        em.flush();

        chatService.markRead(chatId, alice.id(), List.of(message.getId()));
        em.flush();
        em.clear();

        ChatMessage stored = messageRepository.findById(message.getId()).orElseThrow();
        assertThat(stored.isReadBy(alice.id())).isTrue();
        assertThat(stored.getStatus()).isEqualTo(ChatMessage.DeliveryStatus.READ);
    }
}
