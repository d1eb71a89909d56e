package com.communityhub.chatservice.repository;

import com.communityhub.chatservice.entity.AppUser;
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
 * 用户 Repository（只读为主，仅更新在线标记）
 */
@Repository
public interface UserRepository extends JpaRepository<AppUser, UUID> {

    /**
     * 查询指定角色、指定账号状态的用户（如：所有正常状态的管理员）
     */
    List<AppUser> findAllByRoleAndStatus(AppUser.Role role, AppUser.Status status);

    /**
     * 更新在线标记与最后活跃时间
     *
     * @return 影响行数
     */
    @Modifying
    @Transactional
    @Query("UPDATE AppUser u SET u.isOnline = :online, u.lastActive = :lastActive WHERE u.id = :id")
    int updatePresence(@Param("id") UUID id,
                       @Param("online") boolean online,
                       @Param("lastActive") OffsetDateTime lastActive);
}
