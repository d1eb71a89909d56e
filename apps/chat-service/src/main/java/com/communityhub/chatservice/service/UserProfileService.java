package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.AppUser;
import com.communityhub.chatservice.repository.UserRepository;
import com.communityhub.chatservice.service.dto.SenderView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 用户展示信息查询（发送者投影），查询失败时退化为只有 ID 的投影。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private final UserRepository userRepository;

    public SenderView profile(UUID userId) {
        if (userId == null) {
            return null;
        }
        try {
            return userRepository.findById(userId)
                    .map(SenderView::of)
                    .orElseGet(() -> SenderView.unknown(userId));
        } catch (Exception e) {
            log.warn("load user profile failed, userId={}", userId, e);
            return SenderView.unknown(userId);
        }
    }

    public Map<UUID, SenderView> profiles(Collection<UUID> userIds) {
        Map<UUID, SenderView> result = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return result;
        }
        try {
            for (AppUser user : userRepository.findAllById(userIds.stream().filter(Objects::nonNull).distinct().toList())) {
                result.put(user.getId(), SenderView.of(user));
            }
        } catch (Exception e) {
            log.warn("load user profiles failed, count={}", userIds.size(), e);
        }
        userIds.stream().filter(Objects::nonNull).forEach(id -> result.computeIfAbsent(id, SenderView::unknown));
        return result;
    }
}
