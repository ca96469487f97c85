package com.dropline.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ChatMessageResponse {
    private UUID id;
    private UUID orderId;
    private UUID senderId;
    private UUID receiverId;
    private String message;
    private boolean read;
    private Instant createdAt;
}
