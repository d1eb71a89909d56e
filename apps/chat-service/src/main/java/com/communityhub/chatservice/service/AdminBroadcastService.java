package com.communityhub.chatservice.service;

/**
 * 向所有在线管理员连接直接推送事件（不经过房间）
 */
public interface AdminBroadcastService {

    /**
     * @param excludeAdminId 不推送的管理员，可为空
     * @return 实际投递的连接数
     */
    int notifyAllAdmins(String event, Object payload, String excludeAdminId);

    default int notifyAllAdmins(String event, Object payload) {
        return notifyAllAdmins(event, payload, null);
    }
}
