package com.communityhub.chatservice.service.dto;

import java.util.List;

/**
 * 会话详情：会话本身 + 最近消息（时间正序）
 */
public record LiveChatSessionDetail(LiveChatSessionView session, List<LiveChatMessageView> messages) {
}
