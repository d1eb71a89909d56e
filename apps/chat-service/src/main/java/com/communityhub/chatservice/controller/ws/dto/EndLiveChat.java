package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

@Data
public class EndLiveChat {
    private String sessionId;
    private String reason;      // 可选，缺省为 "Session ended"
}
