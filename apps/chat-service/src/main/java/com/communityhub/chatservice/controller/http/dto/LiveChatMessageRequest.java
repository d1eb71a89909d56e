package com.communityhub.chatservice.controller.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LiveChatMessageRequest {
    @NotBlank(message = "Message is required")
    private String message;
}
