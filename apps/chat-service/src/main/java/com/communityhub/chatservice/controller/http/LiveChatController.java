package com.communityhub.chatservice.controller.http;

import com.communityhub.chatservice.common.Ids;
import com.communityhub.chatservice.controller.http.dto.LiveChatMessageRequest;
import com.communityhub.chatservice.controller.http.dto.NotesRequest;
import com.communityhub.chatservice.security.AuthenticatedUser;
import com.communityhub.chatservice.security.IdentityService;
import com.communityhub.chatservice.service.LiveChatService;
import com.communityhub.chatservice.service.dto.LiveChatMessageView;
import com.communityhub.chatservice.service.dto.LiveChatSessionDetail;
import com.communityhub.chatservice.service.dto.LiveChatSessionView;
import com.communityhub.chatservice.service.dto.PageResult;
import com.communityhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * 在线客服 HTTP 接口
 * 实时事件与 WS 入口共用同一套服务逻辑
 */
@Slf4j
@RestController
@RequestMapping("/api/livechat")
@RequiredArgsConstructor
public class LiveChatController {

    private static final String SESSION_NOT_FOUND = "Chat session not found";

    private final LiveChatService liveChatService;
    private final IdentityService identityService;

    /**
     * 发起客服会话
     */
    @PostMapping("/start")
    public ResponseEntity<ApiResponse<LiveChatSessionView>> start(@AuthenticationPrincipal Jwt jwt) {
        LiveChatSessionView session = liveChatService.start(identityService.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Live chat session started", session));
    }

    /**
     * 管理员接入会话
     */
    @PostMapping("/sessions/{id}/join")
    public ApiResponse<LiveChatSessionView> join(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        AuthenticatedUser admin = identityService.resolve(jwt);
        return ApiResponse.ok("Successfully joined chat session", liveChatService.claim(admin, sessionId(id), null));
    }

    @GetMapping("/sessions")
    public ApiResponse<PageResult<LiveChatSessionView>> listSessions(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "${chat.live-chat-page-size:20}") int limit,
            @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(liveChatService.listSessions(identityService.resolve(jwt), status, page, limit));
    }

    @GetMapping("/sessions/{id}")
    public ApiResponse<LiveChatSessionDetail> getSession(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(liveChatService.getSession(identityService.resolve(jwt), sessionId(id)));
    }

    @PutMapping("/sessions/{id}/end")
    public ApiResponse<LiveChatSessionView> end(@PathVariable("id") String id,
                                                @Valid @RequestBody(required = false) NotesRequest body,
                                                @AuthenticationPrincipal Jwt jwt) {
        String notes = body == null ? null : body.getNotes();
        return ApiResponse.ok("Live chat session ended",
                liveChatService.end(identityService.resolve(jwt), sessionId(id), notes));
    }

    @PutMapping("/sessions/{id}/cancel")
    public ApiResponse<LiveChatSessionView> cancel(@PathVariable("id") String id,
                                                   @Valid @RequestBody(required = false) NotesRequest body,
                                                   @AuthenticationPrincipal Jwt jwt) {
        String notes = body == null ? null : body.getNotes();
        return ApiResponse.ok("Live chat session cancelled",
                liveChatService.cancel(identityService.resolve(jwt), sessionId(id), notes));
    }

    /**
     * 当前用户自己的会话（最新在前）
     */
    @GetMapping("/user-sessions")
    public ApiResponse<PageResult<LiveChatSessionView>> userSessions(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(liveChatService.userSessions(identityService.resolve(jwt), status, page, limit));
    }

    @GetMapping("/sessions/{id}/messages")
    public ApiResponse<PageResult<LiveChatMessageView>> messages(
            @PathVariable("id") String id,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(liveChatService.messages(identityService.resolve(jwt), sessionId(id), page, limit));
    }

    @PostMapping("/sessions/{id}/messages")
    public ResponseEntity<ApiResponse<LiveChatMessageView>> sendMessage(@PathVariable("id") String id,
                                                                       @Valid @RequestBody LiveChatMessageRequest body,
                                                                       @AuthenticationPrincipal Jwt jwt) {
        LiveChatMessageView message = liveChatService.sendMessage(
                identityService.resolve(jwt), sessionId(id), body.getMessage(), null);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Message sent successfully", message));
    }

    @DeleteMapping("/sessions/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        liveChatService.delete(identityService.resolve(jwt), sessionId(id));
        return ApiResponse.ok("Live chat session deleted successfully", null);
    }

    /**
     * 待接入队列
     */
    @GetMapping("/available")
    public ApiResponse<List<LiveChatSessionView>> available(@AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(liveChatService.availableSessions(identityService.resolve(jwt)));
    }

    private static UUID sessionId(String raw) {
        return Ids.parse(raw, SESSION_NOT_FOUND);
    }
}
