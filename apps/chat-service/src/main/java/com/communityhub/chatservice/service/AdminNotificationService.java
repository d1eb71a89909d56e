package com.communityhub.chatservice.service;

import com.communityhub.chatservice.entity.LiveChatSession;

/**
 * 为管理员账号写入通知中心记录
 */
public interface AdminNotificationService {

    /**
     * 新客服会话排队提醒，每个正常状态的管理员一条；失败只记录日志
     *
     * @return 写入条数
     */
    int notifyNewLiveChat(LiveChatSession session, String requesterName);
}
