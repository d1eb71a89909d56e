package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * 聊天消息 Repository
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    /**
     * 查询聊天最新的消息（按时间倒序）
     *
     * @param chatId   聊天ID
     * @param pageable 分页参数
     * @return 消息列表
     */
    List<ChatMessage> findByChatIdOrderByCreatedAtDesc(UUID chatId, Pageable pageable);

    /**
     * 查询指定时间之前的消息（向上翻页）
     */
    List<ChatMessage> findByChatIdAndCreatedAtBeforeOrderByCreatedAtDesc(UUID chatId,
                                                                        OffsetDateTime before,
                                                                        Pageable pageable);

    /**
     * 按ID批量查询，且必须属于指定聊天（防止越权标记其他聊天的消息）
     */
    List<ChatMessage> findByChatIdAndIdIn(UUID chatId, Collection<UUID> ids);
}
