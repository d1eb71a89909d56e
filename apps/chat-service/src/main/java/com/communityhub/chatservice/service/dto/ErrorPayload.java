package com.communityhub.chatservice.service.dto;

/**
 * error / live_chat_error 事件载荷
 */
public record ErrorPayload(String message) {
}
