package com.communityhub.chatservice.ws;

import com.communityhub.chatservice.security.AuthenticatedUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("StompEventEmitter")
class StompEventEmitterTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @Test
    @DisplayName("sends to /queue/{event} of the user, pinned to the target session")
    @SuppressWarnings("unchecked")
    void emitToSession() {
        // given
        StompEventEmitter emitter = new StompEventEmitter(messagingTemplate);
        AuthenticatedUser alice = TestUsers.user("alice");
        Connection connection = new Connection("s-42", alice, Instant.now());

        // when
        emitter.emit(connection, "new_message", "payload");

        // then
        ArgumentCaptor<Map<String, Object>> headers = ArgumentCaptor.forClass(Map.class);
        verify(messagingTemplate).convertAndSendToUser(eq(alice.userId()), eq("/queue/new_message"), eq("payload"),
                headers.capture());
        assertThat(SimpMessageHeaderAccessor.getSessionId(headers.getValue())).isEqualTo("s-42");
    }
}
