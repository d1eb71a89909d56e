package com.communityhub.chatservice.controller.http;

import com.communityhub.chatservice.common.Ids;
import com.communityhub.chatservice.controller.http.dto.CreateChatRequest;
import com.communityhub.chatservice.service.ChatService;
import com.communityhub.chatservice.service.dto.ChatView;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.chatservice.security.IdentityService;
import com.communityhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 聊天 HTTP 接口：聊天列表、创建、历史消息
 */
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatController {

    private static final String CHAT_NOT_FOUND = "Chat not found";

    private final ChatService chatService;
    private final IdentityService identityService;

    @GetMapping
    public ApiResponse<List<ChatView>> list(@AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(chatService.listChats(identityService.resolve(jwt)));
    }

    /**
     * 创建聊天，私聊已存在时直接返回已有聊天
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ChatView>> create(@Valid @RequestBody CreateChatRequest body,
                                                        @AuthenticationPrincipal Jwt jwt) {
        ChatView chat = chatService.createChat(identityService.resolve(jwt),
                body.getType(), body.getName(), body.getParticipantIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(chat));
    }

    @GetMapping("/{id}")
    public ApiResponse<ChatView> get(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(chatService.getChat(identityService.resolve(jwt), Ids.parse(id, CHAT_NOT_FOUND)));
    }

    /**
     * 历史消息，时间正序；before 用于向上翻页
     */
    @GetMapping("/{id}/messages")
    public ApiResponse<List<MessageView>> history(
            @PathVariable("id") String id,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime before,
            @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(chatService.history(identityService.resolve(jwt),
                Ids.parse(id, CHAT_NOT_FOUND), limit, before));
    }

    @PostMapping("/{id}/leave")
    public ApiResponse<Void> leave(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        chatService.leaveChat(identityService.resolve(jwt), Ids.parse(id, CHAT_NOT_FOUND));
        return ApiResponse.ok("Left chat", null);
    }
}
