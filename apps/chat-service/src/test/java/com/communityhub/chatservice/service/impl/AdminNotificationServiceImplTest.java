package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.entity.LiveChatSession;
import com.communityhub.chatservice.entity.Notification;
import com.communityhub.chatservice.repository.NotificationRepository;
import com.communityhub.chatservice.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminNotificationServiceImpl")
class AdminNotificationServiceImplTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationRepository notificationRepository;

    @InjectMocks
    private AdminNotificationServiceImpl service;

    private final LiveChatSession session = LiveChatSession.builder()
            .id(UUID.randomUUID())
            .userId(UUID.randomUUID())
            .build();

    @Test
    @DisplayName("one high priority notification per active admin")
    void onePerAdmin() {
        // given
        AppUser root = AppUser.builder().id(UUID.randomUUID()).username("root").role(AppUser.Role.ADMIN).build();
        AppUser ops = AppUser.builder().id(UUID.randomUUID()).username("ops").role(AppUser.Role.ADMIN).build();
        when(userRepository.findAllByRoleAndStatus(AppUser.Role.ADMIN, AppUser.Status.ACTIVE))
                .thenReturn(List.of(root, ops));

        // when
        int created = service.notifyNewLiveChat(session, "Alice");

        // then
        assertThat(created).isEqualTo(2);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Notification>> captor = ArgumentCaptor.forClass(List.class);
        verify(notificationRepository).saveAll(captor.capture());
        Notification first = captor.getValue().get(0);
        assertThat(first.getUserId()).isEqualTo(root.getId());
        assertThat(first.getTitle()).isEqualTo("New Live Chat Session");
        assertThat(first.getPriority()).isEqualTo("high");
        assertThat(first.getActionUrl()).isEqualTo("/admin/livechat/sessions/" + session.getId());
        assertThat(first.getData()).containsEntry("sessionId", session.getId().toString());
    }

    @Test
    @DisplayName("storage failure is logged and reported as zero")
    void failureSwallowed() {
        when(userRepository.findAllByRoleAndStatus(AppUser.Role.ADMIN, AppUser.Status.ACTIVE))
                .thenReturn(List.of(AppUser.builder().id(UUID.randomUUID()).username("root").build()));
        when(notificationRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(service.notifyNewLiveChat(session, "Alice")).isZero();
    }
}
