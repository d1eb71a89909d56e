package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.ChatParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 聊天参与者 Repository
 */
@Repository
public interface ChatParticipantRepository extends JpaRepository<ChatParticipant, UUID> {

    Optional<ChatParticipant> findByChatIdAndUserId(UUID chatId, UUID userId);

    /**
     * 是否为聊天的有效参与者
     */
    boolean existsByChatIdAndUserIdAndActiveTrue(UUID chatId, UUID userId);

    List<ChatParticipant> findByChatIdAndActiveTrue(UUID chatId);

    /**
     * 更新最后已读时间
     */
    @Modifying
    @Query("UPDATE ChatParticipant p SET p.lastReadAt = :at WHERE p.chatId = :chatId AND p.userId = :userId")
    int updateLastReadAt(@Param("chatId") UUID chatId, @Param("userId") UUID userId, @Param("at") OffsetDateTime at);
}
