package com.communityhub.chatservice.controller.http;

import com.communityhub.chatservice.common.Ids;
import com.communityhub.chatservice.controller.http.dto.EditMessageRequest;
import com.communityhub.chatservice.controller.http.dto.ReactionRequest;
import com.communityhub.chatservice.entity.ChatMessage;
import com.communityhub.chatservice.security.IdentityService;
import com.communityhub.chatservice.service.MessageManagementService;
import com.communityhub.chatservice.service.dto.MessageView;
import com.communityhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 消息编辑、表情回应、删除
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private static final String MESSAGE_NOT_FOUND = "Message not found";

    private final MessageManagementService messageManagementService;
    private final IdentityService identityService;

    @PutMapping("/{id}")
    public ApiResponse<MessageView> edit(@PathVariable("id") String id,
                                         @Valid @RequestBody EditMessageRequest body,
                                         @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(messageManagementService.edit(identityService.resolve(jwt),
                Ids.parse(id, MESSAGE_NOT_FOUND), body.getContent()));
    }

    @PostMapping("/{id}/reactions")
    public ApiResponse<List<ChatMessage.Reaction>> react(@PathVariable("id") String id,
                                                         @Valid @RequestBody ReactionRequest body,
                                                         @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(messageManagementService.toggleReaction(identityService.resolve(jwt),
                Ids.parse(id, MESSAGE_NOT_FOUND), body.getEmoji()));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String id, @AuthenticationPrincipal Jwt jwt) {
        messageManagementService.delete(identityService.resolve(jwt), Ids.parse(id, MESSAGE_NOT_FOUND));
        return ApiResponse.ok("Message deleted", null);
    }

    @GetMapping("/{id}/edit-history")
    public ApiResponse<List<ChatMessage.EditRecord>> editHistory(@PathVariable("id") String id,
                                                                 @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(messageManagementService.editHistory(identityService.resolve(jwt),
                Ids.parse(id, MESSAGE_NOT_FOUND)));
    }
}
