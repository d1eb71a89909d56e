package com.communityhub.chatservice.controller.http;

import com.communityhub.chatservice.common.exception.AccessDeniedException;
import com.communityhub.chatservice.common.exception.DuplicateSessionException;
import com.communityhub.chatservice.config.SecurityConfig;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.security.IdentityService;
import com.communityhub.chatservice.service.LiveChatService;
import com.communityhub.chatservice.service.dto.LiveChatSessionView;
import com.communityhub.chatservice.service.dto.PageResult;
import com.communityhub.chatservice.ws.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LiveChatController.class)
@Import(SecurityConfig.class)
@DisplayName("LiveChatController")
class LiveChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LiveChatService liveChatService;

    @MockBean
    private IdentityService identityService;

    @MockBean
    private JwtDecoder jwtDecoder;

    private AuthenticatedUser user;
    private AuthenticatedUser admin;

    @BeforeEach
    void setUp() {
        user = TestUsers.user("alice");
        admin = TestUsers.admin("root");
    }

    @Test
    @DisplayName("POST /start creates a session (201)")
    void start() throws Exception {
        // given
        when(identityService.resolve(any(Jwt.class))).thenReturn(user);
        LiveChatSessionView view = new LiveChatSessionView(UUID.randomUUID().toString(), user.userId(), null,
                "active", "requested", OffsetDateTime.now(), null, null, null, null);
        when(liveChatService.start(user)).thenReturn(view);

        // when / then
        mockMvc.perform(post("/api/livechat/start").with(jwt()).with(csrf()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(view.id()))
                .andExpect(jsonPath("$.data.phase").value("requested"));
    }

    @Test
    @DisplayName("a duplicate start is a 400 with the duplicate message")
    void duplicateStart() throws Exception {
        when(identityService.resolve(any(Jwt.class))).thenReturn(user);
        when(liveChatService.start(user)).thenThrow(new DuplicateSessionException());

        mockMvc.perform(post("/api/livechat/start").with(jwt()).with(csrf()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("You already have an active chat session"));
    }

    @Test
    @DisplayName("losing the claim race is a 403")
    void claimLost() throws Exception {
        // given
        UUID id = UUID.randomUUID();
        when(identityService.resolve(any(Jwt.class))).thenReturn(admin);
        when(liveChatService.claim(eq(admin), eq(id), isNull()))
                .thenThrow(new AccessDeniedException("This chat session is already being handled by another admin"));

        // when / then
        mockMvc.perform(post("/api/livechat/sessions/{id}/join", id).with(jwt()).with(csrf()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("This chat session is already being handled by another admin"));
    }

    @Test
    @DisplayName("a blank live chat message is a 400")
    void blankMessage() throws Exception {
        mockMvc.perform(post("/api/livechat/sessions/{id}/messages", UUID.randomUUID())
                        .with(jwt()).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Message is required"));
        verify(liveChatService, never()).sendMessage(any(), any(), any(), any());
    }

    @Test
    @DisplayName("a malformed session id reads as not found")
    void malformedId() throws Exception {
        when(identityService.resolve(any(Jwt.class))).thenReturn(user);

        mockMvc.perform(get("/api/livechat/sessions/{id}", "not-a-uuid").with(jwt()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Chat session not found"));
    }

    @Test
    @DisplayName("session list uses defaults for paging")
    void listDefaults() throws Exception {
        when(identityService.resolve(any(Jwt.class))).thenReturn(admin);
        when(liveChatService.listSessions(admin, null, 1, 20)).thenReturn(new PageResult<>(List.of(), 0, 1, 0));

        mockMvc.perform(get("/api/livechat/sessions").with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(0));
    }

    @Test
    @DisplayName("requests without a token are rejected")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/livechat/available"))
                .andExpect(status().isUnauthorized());
    }
}
