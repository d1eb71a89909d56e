package com.communityhub.chatservice.service;

import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.service.dto.LiveChatMessageView;
import com.communityhub.chatservice.service.dto.LiveChatSessionDetail;
import com.communityhub.chatservice.service.dto.LiveChatSessionView;
import com.communityhub.chatservice.service.dto.PageResult;
import com.communityhub.chatservice.ws.Connection;

import java.util.List;
import java.util.UUID;

/**
 * 在线客服会话：用户发起 → 管理员接入/退出 → 结束或取消。
 *
 * 状态流转：
 * <pre>
 * REQUESTED --claim--> CLAIMED --unclaim--> REQUESTED
 * REQUESTED/CLAIMED --end--> ENDED
 * REQUESTED/CLAIMED --cancel--> CANCELLED
 * </pre>
 * connection 参数可为空（REST 调用），为空时不做房间操作。
 */
public interface LiveChatService {

    /**
     * 发起会话，每个用户同时最多一个进行中的会话
     *
     * @throws com.communityhub.chatservice.common.exception.DuplicateSessionException 已有进行中的会话
     */
    LiveChatSessionView start(AuthenticatedUser user);

    /**
     * 管理员接入（CAS，只有一个管理员能成功）
     */
    LiveChatSessionView claim(AuthenticatedUser admin, UUID sessionId, Connection connection);

    /**
     * 管理员退出接入，会话回到待接入
     */
    void unclaim(AuthenticatedUser admin, UUID sessionId, Connection connection);

    /**
     * 订阅会话房间，并把会话信息和最近消息发给加入者
     */
    void join(Connection connection, UUID sessionId);

    void leave(Connection connection, UUID sessionId);

    LiveChatMessageView sendMessage(AuthenticatedUser sender, UUID sessionId, String text, Connection connection);

    void typing(Connection connection, UUID sessionId, boolean started);

    LiveChatSessionView end(AuthenticatedUser user, UUID sessionId, String reason);

    LiveChatSessionView cancel(AuthenticatedUser admin, UUID sessionId, String notes);

    /**
     * 通知其他在线管理员有新会话排队
     */
    void announce(AuthenticatedUser admin, UUID sessionId);

    /**
     * 待接入队列（最早发起的在前）
     */
    List<LiveChatSessionView> availableSessions(AuthenticatedUser admin);

    PageResult<LiveChatSessionView> listSessions(AuthenticatedUser admin, String status, int page, int limit);

    LiveChatSessionDetail getSession(AuthenticatedUser user, UUID sessionId);

    PageResult<LiveChatSessionView> userSessions(AuthenticatedUser user, String status, int page, int limit);

    PageResult<LiveChatMessageView> messages(AuthenticatedUser user, UUID sessionId, int page, int limit);

    void delete(AuthenticatedUser admin, UUID sessionId);
}
