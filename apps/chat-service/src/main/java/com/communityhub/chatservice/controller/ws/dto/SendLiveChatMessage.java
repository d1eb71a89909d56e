package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

@Data
public class SendLiveChatMessage {
    private String sessionId;
    private String message;
}
