package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.LiveChatMessage;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * 在线客服消息 Repository
 */
@Repository
public interface LiveChatMessageRepository extends JpaRepository<LiveChatMessage, UUID> {

    Page<LiveChatMessage> findBySessionIdOrderByCreatedAtAsc(UUID sessionId, Pageable pageable);

    /**
     * 最近的消息（倒序，调用方自行翻转）
     */
    List<LiveChatMessage> findBySessionIdOrderByCreatedAtDesc(UUID sessionId, Pageable pageable);

    @Modifying
    void deleteBySessionId(UUID sessionId);
}
