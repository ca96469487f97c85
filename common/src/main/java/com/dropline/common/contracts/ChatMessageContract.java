package com.dropline.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageContract {
    private UUID id;
    private UUID orderId;
    private UUID senderId;
    private String senderRole;
    private UUID receiverId;
    private String message;
    private boolean read;
    private Instant createdAt;
}
