package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

/**
 * 只携带客服会话ID的命令
 */
@Data
public class LiveChatRef {
    private String sessionId;
}
