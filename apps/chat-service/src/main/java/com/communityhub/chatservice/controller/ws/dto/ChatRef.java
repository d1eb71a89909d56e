package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

/**
 * 只携带聊天ID的命令（join_chat / leave_chat / typing_start / typing_stop）
 */
@Data
public class ChatRef {
    private String chatId;
}
