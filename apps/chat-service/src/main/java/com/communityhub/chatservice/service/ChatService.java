package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.entity.MessageContent;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.dto.ChatView;
import com.communityhub.chatservice.service.dto.MessageView;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 聊天与消息的持久化操作（事务边界在这里），以及聊天 REST 接口的查询
 */
public interface ChatService {

    /**
     * 校验聊天存在且用户为有效参与者
     *
     * @throws com.communityhub.chatservice.common.exception.NotFoundException     聊天不存在
     * @throws com.communityhub.chatservice.common.exception.AccessDeniedException 不是有效参与者
     */
    void requireParticipant(UUID chatId, UUID userId);

    /**
     * 同一事务内写入消息并刷新聊天的最后消息时间
     */
    ChatMessage appendMessage(UUID chatId, UUID senderId, ChatMessage.MessageType type, MessageContent content,
                              Map<String, Object> media, Map<String, Object> location, UUID replyToId);

    /**
     * 为用户追加已读记录，返回属于该聊天的消息ID
     */
    List<UUID> markRead(UUID chatId, UUID userId, List<UUID> messageIds);

    /**
     * 聊天中其他有效参与者
     */
    List<UUID> otherParticipants(UUID chatId, UUID userId);

    List<ChatView> listChats(AuthenticatedUser user);

    ChatView createChat(AuthenticatedUser user, String type, String name, List<String> participantIds);

    ChatView getChat(AuthenticatedUser user, UUID chatId);

    /**
     * 历史消息（时间正序），before 为空时取最新一页
     */
    List<MessageView> history(AuthenticatedUser user, UUID chatId, Integer limit, OffsetDateTime before);

    void leaveChat(AuthenticatedUser user, UUID chatId);
}
