package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.entity.LiveChatSession;
import com.communityhub.chatservice.entity.Notification;
import com.communityhub.chatservice.repository.NotificationRepository;
import com.communityhub.chatservice.repository.UserRepository;
import com.communityhub.chatservice.service.AdminNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminNotificationServiceImpl implements AdminNotificationService {

    static final String TITLE = "New Live Chat Session";
    static final String TYPE = "live_chat";
    static final String PRIORITY = "high";
    static final String ACTION_TEXT = "View Chat";

    private final UserRepository userRepository;
    private final NotificationRepository notificationRepository;

    @Override
    public int notifyNewLiveChat(LiveChatSession session, String requesterName) {
        try {
            List<AppUser> admins = userRepository.findAllByRoleAndStatus(AppUser.Role.ADMIN, AppUser.Status.ACTIVE);
            if (admins.isEmpty()) {
                return 0;
            }
            String sessionId = session.getId().toString();
            List<Notification> notifications = admins.stream()
                    .map(admin -> Notification.builder()
                            .userId(admin.getId())
                            .title(TITLE)
                            .message(requesterName + " has started a live chat session and is waiting for support")
                            .type(TYPE)
                            .priority(PRIORITY)
                            .data(Map.of("sessionId", sessionId, "userId", session.getUserId().toString()))
                            .actionUrl("/admin/livechat/sessions/" + sessionId)
                            .actionText(ACTION_TEXT)
                            .build())
                    .toList();
            notificationRepository.saveAll(notifications);
            log.info("live chat notifications created: sessionId={}, admins={}", sessionId, notifications.size());
            return notifications.size();
        } catch (Exception e) {
            log.warn("create live chat notifications failed: sessionId={}", session.getId(), e);
            return 0;
        }
    }
}
