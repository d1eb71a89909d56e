package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.dto.MessageView;

import java.util.List;
import java.util.UUID;

/**
 * 已发送消息的编辑、表情回应与删除（REST 入口，结果实时广播到聊天房间）
 */
public interface MessageManagementService {

    /**
     * 编辑文本消息，仅发送者本人；旧内容进入编辑历史
     */
    MessageView edit(AuthenticatedUser user, UUID messageId, String text);

    /**
     * 切换表情回应：同一用户同一表情再次提交即取消
     *
     * @return 最新的回应列表
     */
    List<ChatMessage.Reaction> toggleReaction(AuthenticatedUser user, UUID messageId, String emoji);

    /**
     * 删除消息，仅发送者本人
     */
    void delete(AuthenticatedUser user, UUID messageId);

    List<ChatMessage.EditRecord> editHistory(AuthenticatedUser user, UUID messageId);
}
