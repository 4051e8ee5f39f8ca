package com.followchat.social.chat.api;

import com.followchat.social.auth.service.AuthService;
import com.followchat.social.chat.service.ConversationService;
import com.followchat.social.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ConversationController {

    private final AuthService authService;
    private final ConversationService conversationService;

    public ConversationController(AuthService authService, ConversationService conversationService) {
        this.authService = authService;
        this.conversationService = conversationService;
    }

    @GetMapping("/conversations")
    public ApiResponse<List<ConversationSummary>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.listConversations(me));
    }

    @PostMapping("/conversations/start")
    public ResponseEntity<ApiResponse<StartConversationResponse>> start(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @Valid @RequestBody StartConversationRequest req
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        var result = conversationService.start(me, req.username().trim());
        var status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ApiResponse.ok(result.response()));
    }

    @GetMapping("/conversations/{id}")
    public ApiResponse<ConversationDetailResponse> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @PathVariable("id") String conversationId
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.detail(me, conversationId));
    }

    @GetMapping("/conversations/{id}/messages")
    public ApiResponse<MessagePage> messages(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @PathVariable("id") String conversationId,
            @RequestParam(value = "before", required = false) String before,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.page(me, conversationId, before, limit));
    }

    @PatchMapping("/conversations/{id}/read")
    public ApiResponse<MarkReadResponse> markRead(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @PathVariable("id") String conversationId
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.markRead(me, conversationId));
    }

    @PostMapping("/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<SendMessageResponse> send(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken,
            @Valid @RequestBody SendMessageRequest req
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.send(me, req.receiver_username().trim(), req.content()));
    }

    @GetMapping("/messages/unread-count")
    public ApiResponse<UnreadCountResponse> unreadCount(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @CookieValue(value = "${app.ws.access-cookie-name:access_token}", required = false) String cookieToken
    ) {
        var me = authService.requireUsername(authorization, cookieToken);
        return ApiResponse.ok(conversationService.unreadCount(me));
    }
}
