package com.dropline.orderservice.controller;

import com.dropline.orderservice.dto.ChatMessageRequest;
import com.dropline.orderservice.dto.ChatMessageResponse;
import com.dropline.orderservice.security.ActorResolver;
import com.dropline.orderservice.service.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final ActorResolver actorResolver;

    @GetMapping("/orders/{orderId}/chats")
    public ResponseEntity<List<ChatMessageResponse>> getChatHistory(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(chatService.getChatHistory(orderId, actorResolver.resolve(jwt)));
    }

    @PostMapping("/orders/{orderId}/chats")
    public ResponseEntity<ChatMessageResponse> sendChatMessage(
            @PathVariable UUID orderId,
            @Valid @RequestBody ChatMessageRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        ChatMessageResponse response = chatService.sendChatMessage(orderId, request, actorResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/chats/{chatId}/read")
    public ResponseEntity<ChatMessageResponse> markAsRead(
            @PathVariable UUID chatId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(chatService.markAsRead(chatId, actorResolver.resolve(jwt)));
    }
}
