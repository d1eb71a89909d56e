package com.communityhub.chatservice.controller.http.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 结束/取消会话的备注（可选）
 */
@Data
public class NotesRequest {
    @Size(max = 1000, message = "notes must be at most 1000 characters")
    private String notes;
}
