package com.communityhub.chatservice.controller.ws.dto;

import lombok.Data;

import java.util.List;

@Data
public class OnlineStatusQuery {
    private List<String> userIds;
}
