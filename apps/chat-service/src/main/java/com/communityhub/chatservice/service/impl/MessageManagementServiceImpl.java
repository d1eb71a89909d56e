package com.communityhub.chatservice.service.impl;

import com.communityhub.chatservice.common.exception.AccessDeniedException;
import com.communityhub.chatservice.common.exception.InvalidStateException;
import com.communityhub.chatservice.common.exception.NotFoundException;
import com.communityhub.chatservice.config.ChatProperties;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.repository.ChatMessageRepository;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.ChatService;
import com.communityhub.chatservice.service.MessageManagementService;
import com.communityhub.chatservice.service.UserProfileService;
import com.communityhub.chatservice.service.dto.ChatEvents;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.ws.RoomKeys;
import com.communityhub.chatservice.ws.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageManagementServiceImpl implements MessageManagementService {

    static final String MESSAGE_NOT_FOUND = "Message not found";

    private final ChatMessageRepository messageRepository;
    private final ChatService chatService;
    private final UserProfileService userProfileService;
    private final RoomRouter router;
    private final ChatProperties chatProperties;

    @Override
    @Transactional
    public MessageView edit(AuthenticatedUser user, UUID messageId, String text) {
        ChatMessage message = load(messageId);
        if (!message.getSenderId().equals(user.id())) {
            throw new AccessDeniedException("You can only edit your own messages");
        }
        if (message.getMessageType() != ChatMessage.MessageType.TEXT) {
            throw new InvalidStateException("Only text messages can be edited");
        }
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("Message is required");
        }
        String body = text.trim();
        if (body.length() > chatProperties.getMessageMaxLength()) {
            throw new IllegalArgumentException(
                    "Message exceeds " + chatProperties.getMessageMaxLength() + " characters");
        }

        List<ChatMessage.EditRecord> history = new ArrayList<>(
                message.getEditHistory() == null ? List.of() : message.getEditHistory());
        history.add(new ChatMessage.EditRecord(message.getContent(), OffsetDateTime.now()));
        message.setEditHistory(history);
        message.setContent(new MessageContent.Text(body));
        message.setEdited(true);
        ChatMessage saved = messageRepository.save(message);

        MessageView view = MessageView.of(saved, userProfileService.profile(saved.getSenderId()));
        router.broadcast(RoomKeys.chat(saved.getChatId()), ChatEvents.MESSAGE_EDITED, new ChatEvents.MessageEdited(view));
        return view;
    }

    @Override
    @Transactional
    public List<ChatMessage.Reaction> toggleReaction(AuthenticatedUser user, UUID messageId, String emoji) {
        if (!StringUtils.hasText(emoji)) {
            throw new IllegalArgumentException("Emoji is required");
        }
        ChatMessage message = load(messageId);
        chatService.requireParticipant(message.getChatId(), user.id());

        String reacted = emoji.trim();
        List<ChatMessage.Reaction> reactions = new ArrayList<>(
                message.getReactions() == null ? List.of() : message.getReactions());
        boolean removed = reactions.removeIf(r -> user.userId().equals(r.userId()) && reacted.equals(r.emoji()));
        if (!removed) {
            reactions.add(new ChatMessage.Reaction(user.userId(), reacted, OffsetDateTime.now()));
        }
        message.setReactions(reactions);
        messageRepository.save(message);

        router.broadcast(RoomKeys.chat(message.getChatId()), ChatEvents.MESSAGE_REACTION,
                new ChatEvents.MessageReaction(message.getChatId().toString(), messageId.toString(), List.copyOf(reactions)));
        return List.copyOf(reactions);
    }

    @Override
    @Transactional
    public void delete(AuthenticatedUser user, UUID messageId) {
        ChatMessage message = load(messageId);
        if (!message.getSenderId().equals(user.id())) {
            throw new AccessDeniedException("You can only delete your own messages");
        }
        messageRepository.delete(message);
        log.info("message deleted: messageId={}, chatId={}, user={}", messageId, message.getChatId(), user.userId());
        router.broadcast(RoomKeys.chat(message.getChatId()), ChatEvents.MESSAGE_DELETED,
                new ChatEvents.MessageDeleted(message.getChatId().toString(), messageId.toString()));
    }

    @Override
    public List<ChatMessage.EditRecord> editHistory(AuthenticatedUser user, UUID messageId) {
        ChatMessage message = load(messageId);
        chatService.requireParticipant(message.getChatId(), user.id());
        return message.getEditHistory() == null ? List.of() : List.copyOf(message.getEditHistory());
    }

    private ChatMessage load(UUID messageId) {
        return messageRepository.findById(messageId).orElseThrow(() -> new NotFoundException(MESSAGE_NOT_FOUND));
    }
}
