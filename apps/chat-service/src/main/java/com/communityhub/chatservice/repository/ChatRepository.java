package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.Chat;
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
 * 聊天 Repository
 */
@Repository
public interface ChatRepository extends JpaRepository<Chat, UUID> {

    Optional<Chat> findByDirectKey(String directKey);

    /**
     * 查询用户仍在其中的聊天，按最后消息时间倒序
     */
    @Query("SELECT c FROM Chat c WHERE c.id IN " +
           "(SELECT p.chatId FROM ChatParticipant p WHERE p.userId = :userId AND p.active = true) " +
           "ORDER BY c.lastMessageAt DESC NULLS LAST, c.createdAt DESC")
    List<Chat> findActiveChatsOfUser(@Param("userId") UUID userId);

    /**
     * 刷新最后消息时间
     *
     * @return 影响行数
     */
    @Modifying
    @Query("UPDATE Chat c SET c.lastMessageAt = :at WHERE c.id = :chatId")
    int touchLastMessageAt(@Param("chatId") UUID chatId, @Param("at") OffsetDateTime at);
}
