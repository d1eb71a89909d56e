package com.communityhub.chatservice.service;

import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.ws.Connection;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 普通聊天的实时流程：进出聊天房间、发消息、输入状态、已读回执、在线查询。
 * 发送者身份一律取自连接，不信任客户端载荷里的 ID。
 */
public interface ChatMessagingService {

    void joinChat(Connection connection, UUID chatId);

    void leaveChat(Connection connection, UUID chatId);

    /**
     * 校验、持久化并广播 new_message
     *
     * @return 已保存的消息视图
     */
    MessageView sendMessage(Connection connection, UUID chatId, JsonNode content, String type,
                            Map<String, Object> media, Map<String, Object> location, UUID replyToId);

    void typing(Connection connection, UUID chatId, boolean started);

    void markRead(Connection connection, UUID chatId, List<UUID> messageIds);

    void sendOnlineStatus(Connection connection, Collection<String> userIds);
}
