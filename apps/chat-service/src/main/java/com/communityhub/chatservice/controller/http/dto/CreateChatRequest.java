package com.communityhub.chatservice.controller.http.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 创建聊天请求体
 */
@Data
public class CreateChatRequest {
    /**
     * direct（默认）/ group
     */
    private String type;

    /**
     * 群名称，群聊必填
     */
    private String name;

    /**
     * 其他参与者的用户ID（不含自己）
     */
    @NotEmpty(message = "participantIds is required")
    private List<String> participantIds;
}
