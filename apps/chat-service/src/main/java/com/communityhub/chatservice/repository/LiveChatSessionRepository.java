package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.LiveChatSession;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 在线客服会话 Repository
 */
@Repository
public interface LiveChatSessionRepository extends JpaRepository<LiveChatSession, UUID> {

    boolean existsByUserIdAndStatus(UUID userId, LiveChatSession.Status status);

    /**
     * 待接入队列：进行中且无人接入，最早发起的排在前面
     */
    List<LiveChatSession> findByStatusAndAdminIdIsNullOrderByStartedAtAsc(LiveChatSession.Status status);

    Page<LiveChatSession> findByStatus(LiveChatSession.Status status, Pageable pageable);

    Page<LiveChatSession> findByUserIdOrderByStartedAtDesc(UUID userId, Pageable pageable);

    Page<LiveChatSession> findByUserIdAndStatusOrderByStartedAtDesc(UUID userId,
                                                                  LiveChatSession.Status status,
                                                                  Pageable pageable);

    /**
     * 接入会话（CAS）：仅当会话进行中且尚无管理员时写入 adminId，已接入（含本人）一律失败
     *
     * @return 1 表示接入成功，0 表示已被他人接入或会话已结束
     */
    default int claim(UUID id, UUID adminId) {
        return assignIfUnclaimed(id, adminId, LiveChatSession.Status.ACTIVE);
    }

    /**
     * 退出接入：仅当当前接入人是该管理员时清空 adminId
     *
     * @return 1 表示成功，0 表示并非该管理员接入
     */
    default int unclaim(UUID id, UUID adminId) {
        return releaseIfAssigned(id, adminId, LiveChatSession.Status.ACTIVE);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LiveChatSession s SET s.adminId = :adminId " +
           "WHERE s.id = :id AND s.status = :status AND s.adminId IS NULL")
    int assignIfUnclaimed(@Param("id") UUID id,
                          @Param("adminId") UUID adminId,
                          @Param("status") LiveChatSession.Status status);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LiveChatSession s SET s.adminId = NULL " +
           "WHERE s.id = :id AND s.status = :status AND s.adminId = :adminId")
    int releaseIfAssigned(@Param("id") UUID id,
                          @Param("adminId") UUID adminId,
                          @Param("status") LiveChatSession.Status status);

    /**
     * 结束/取消会话（CAS）：仅当会话仍进行中时写入终态、结束时间与备注，并释放 active_user_key
     *
     * @return 1 表示成功，0 表示会话已不在进行中
     */
    default int terminate(UUID id, LiveChatSession.Status terminal, String notes) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        return terminateIfActive(id, terminal, notes, OffsetDateTime.now(), LiveChatSession.Status.ACTIVE);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LiveChatSession s SET s.status = :terminal, s.endedAt = :at, s.updatedAt = :at, " +
           "s.notes = :notes, s.activeUserKey = NULL " +
           "WHERE s.id = :id AND s.status = :active")
    int terminateIfActive(@Param("id") UUID id,
                          @Param("terminal") LiveChatSession.Status terminal,
                          @Param("notes") String notes,
                          @Param("at") OffsetDateTime at,
                          @Param("active") LiveChatSession.Status active);
}
