package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.common.exception.AccessDeniedException;
import com.communityhub.chatservice.common.exception.NotFoundException;
import com.communityhub.chatservice.common.exception.PersistenceFailureException;
import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.chatservice.entity.Chat;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.ChatParticipant;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.repository.ChatMessageRepository;
import com.communityhub.chatservice.repository.ChatParticipantRepository;
import com.communityhub.chatservice.repository.ChatRepository;
import com.communityhub.chatservice.repository.UserRepository;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.ChatService;
import com.communityhub.chatservice.service.UserProfileService;
import com.communityhub.chatservice.service.dto.ChatView;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.service.dto.SenderView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatServiceImpl implements ChatService {

    static final String CHAT_NOT_FOUND = "Chat not found";
    static final String CHAT_ACCESS_DENIED = "Access denied to this chat";
    private static final int MAX_HISTORY_LIMIT = 100;

    private final ChatRepository chatRepository;
    private final ChatParticipantRepository participantRepository;
    private final ChatMessageRepository messageRepository;
    private final UserRepository userRepository;
    private final UserProfileService userProfileService;
    private final ChatProperties chatProperties;

    @Override
    public void requireParticipant(UUID chatId, UUID userId) {
        if (!chatRepository.existsById(chatId)) {
            throw new NotFoundException(CHAT_NOT_FOUND);
        }
        if (!participantRepository.existsByChatIdAndUserIdAndActiveTrue(chatId, userId)) {
            throw new AccessDeniedException(CHAT_ACCESS_DENIED);
        }
    }

    @Override
    @Transactional
    public ChatMessage appendMessage(UUID chatId, UUID senderId, ChatMessage.MessageType type, MessageContent content,
                                     Map<String, Object> media, Map<String, Object> location, UUID replyToId) {
        ChatMessage message = ChatMessage.builder()
                .chatId(chatId)
                .senderId(senderId)
                .messageType(type)
                .content(content)
                .media(media)
                .location(location)
                .replyToId(replyToId)
                .build();
        ChatMessage saved = messageRepository.save(message);
        chatRepository.touchLastMessageAt(chatId, OffsetDateTime.now());
        return saved;
    }

    @Override
    @Transactional
    public List<UUID> markRead(UUID chatId, UUID userId, List<UUID> messageIds) {
        requireParticipant(chatId, userId);
        if (messageIds == null || messageIds.isEmpty()) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now();
        List<ChatMessage> messages = messageRepository.findByChatIdAndIdIn(chatId, messageIds);
        List<UUID> touched = new ArrayList<>();
        for (ChatMessage message : messages) {
            touched.add(message.getId());
            if (message.isReadBy(userId)) {
                continue;
            }
            List<ChatMessage.ReadReceipt> readBy = new ArrayList<>(
                    message.getReadBy() == null ? List.of() : message.getReadBy());
            readBy.add(new ChatMessage.ReadReceipt(userId.toString(), now));
            message.setReadBy(readBy);
            message.setStatus(ChatMessage.DeliveryStatus.READ);
        }
        messageRepository.saveAll(messages);
        participantRepository.updateLastReadAt(chatId, userId, now);
        return touched;
    }

    @Override
    public List<UUID> otherParticipants(UUID chatId, UUID userId) {
        return participantRepository.findByChatIdAndActiveTrue(chatId).stream()
                .map(ChatParticipant::getUserId)
                .filter(id -> !id.equals(userId))
                .toList();
    }

    @Override
    public List<ChatView> listChats(AuthenticatedUser user) {
        return chatRepository.findActiveChatsOfUser(user.id()).stream()
                .map(chat -> ChatView.of(chat, participantRepository.findByChatIdAndActiveTrue(chat.getId())))
                .toList();
    }

    @Override
    @Transactional
    public ChatView createChat(AuthenticatedUser user, String type, String name, List<String> participantIds) {
        Chat.ChatType chatType = parseType(type);
        UUID creator = user.id();
        Set<UUID> others = new LinkedHashSet<>();
        for (String raw : participantIds == null ? List.<String>of() : participantIds) {
            UUID id = parseUserId(raw);
            if (!id.equals(creator)) {
                others.add(id);
            }
        }
        if (others.isEmpty()) {
            throw new IllegalArgumentException("At least one other participant is required");
        }
        List<UUID> existing = userRepository.findAllById(others).stream().map(u -> u.getId()).toList();
        if (existing.size() != others.size()) {
            throw new NotFoundException("User not found");
        }

        if (chatType == Chat.ChatType.DIRECT) {
            if (others.size() != 1) {
                throw new IllegalArgumentException("Direct chats must have exactly one other participant");
            }
            return openDirectChat(creator, others.iterator().next());
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }
        Chat chat = chatRepository.save(Chat.builder()
                .chatType(Chat.ChatType.GROUP)
                .name(name.trim())
                .createdBy(creator)
                .build());
        List<ChatParticipant> participants = new ArrayList<>();
        participants.add(participant(chat.getId(), creator, ChatParticipant.ParticipantRole.ADMIN));
        others.forEach(id -> participants.add(participant(chat.getId(), id, ChatParticipant.ParticipantRole.MEMBER)));
        List<ChatParticipant> saved = participantRepository.saveAll(participants);
        log.info("group chat created: chatId={}, creator={}, members={}", chat.getId(), creator, saved.size());
        return ChatView.of(chat, saved);
    }

    /**
     * 私聊按 directKey 去重：已存在则重新激活双方并返回
     */
    private ChatView openDirectChat(UUID creator, UUID other) {
        String key = Chat.directKeyOf(creator, other);
        Chat chat = chatRepository.findByDirectKey(key).orElse(null);
        if (chat == null) {
            try {
                chat = chatRepository.saveAndFlush(Chat.builder()
                        .chatType(Chat.ChatType.DIRECT)
                        .directKey(key)
                        .createdBy(creator)
                        .build());
            } catch (DataIntegrityViolationException e) {
                chat = chatRepository.findByDirectKey(key)
                        .orElseThrow(() -> new PersistenceFailureException("Failed to create chat", e));
            }
        }
        UUID chatId = chat.getId();
        for (UUID id : List.of(creator, other)) {
            ChatParticipant p = participantRepository.findByChatIdAndUserId(chatId, id)
                    .orElseGet(() -> participant(chatId, id, ChatParticipant.ParticipantRole.MEMBER));
            p.setActive(true);
            p.setLeftAt(null);
            participantRepository.save(p);
        }
        return ChatView.of(chat, participantRepository.findByChatIdAndActiveTrue(chatId));
    }

    @Override
    public ChatView getChat(AuthenticatedUser user, UUID chatId) {
        requireParticipant(chatId, user.id());
        Chat chat = chatRepository.findById(chatId).orElseThrow(() -> new NotFoundException(CHAT_NOT_FOUND));
        return ChatView.of(chat, participantRepository.findByChatIdAndActiveTrue(chatId));
    }

    @Override
    public List<MessageView> history(AuthenticatedUser user, UUID chatId, Integer limit, OffsetDateTime before) {
        requireParticipant(chatId, user.id());
        int size = limit == null || limit <= 0 ? chatProperties.getHistoryPageSize() : Math.min(limit, MAX_HISTORY_LIMIT);
        PageRequest page = PageRequest.of(0, size);
        List<ChatMessage> newestFirst;
        try {
            newestFirst = before == null
                    ? messageRepository.findByChatIdOrderByCreatedAtDesc(chatId, page)
                    : messageRepository.findByChatIdAndCreatedAtBeforeOrderByCreatedAtDesc(chatId, before, page);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load messages", e);
        }
        List<ChatMessage> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        Map<UUID, SenderView> senders = userProfileService.profiles(
                ordered.stream().map(ChatMessage::getSenderId).toList());
        return ordered.stream()
                .map(m -> MessageView.of(m, senders.get(m.getSenderId())))
                .toList();
    }

    @Override
    @Transactional
    public void leaveChat(AuthenticatedUser user, UUID chatId) {
        requireParticipant(chatId, user.id());
        ChatParticipant p = participantRepository.findByChatIdAndUserId(chatId, user.id())
                .orElseThrow(() -> new AccessDeniedException(CHAT_ACCESS_DENIED));
        p.setActive(false);
        p.setLeftAt(OffsetDateTime.now());
        participantRepository.save(p);
        log.info("user left chat: chatId={}, userId={}", chatId, user.userId());
    }

    private static ChatParticipant participant(UUID chatId, UUID userId, ChatParticipant.ParticipantRole role) {
        return ChatParticipant.builder().chatId(chatId).userId(userId).participantRole(role).active(true).build();
    }

    private static Chat.ChatType parseType(String type) {
        if (type == null || type.isBlank()) {
            return Chat.ChatType.DIRECT;
        }
        try {
            return Chat.ChatType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid chat type: " + type);
        }
    }

    private static UUID parseUserId(String raw) {
        try {
            return UUID.fromString(raw == null ? "" : raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid participant id: " + raw);
        }
    }
}
