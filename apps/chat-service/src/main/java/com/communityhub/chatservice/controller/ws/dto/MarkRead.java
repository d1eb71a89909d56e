package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

import java.util.List;

@Data
public class MarkRead {
    private String chatId;
    private List<String> messageIds;
}
