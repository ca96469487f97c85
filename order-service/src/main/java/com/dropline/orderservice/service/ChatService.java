package com.dropline.orderservice.service;

import com.dropline.orderservice.dto.ChatMessageRequest;
import com.dropline.orderservice.dto.ChatMessageResponse;
import com.dropline.orderservice.security.Actor;

import java.util.List;
import java.util.UUID;

public interface ChatService {

    ChatMessageResponse sendChatMessage(UUID orderId, ChatMessageRequest request, Actor actor);

    /**
     * Messages of the order, oldest first. Participants only.
     */
    List<ChatMessageResponse> getChatHistory(UUID orderId, Actor actor);

    /**
     * Marks a message read. Only its receiver may do this; repeating it changes nothing.
     */
    ChatMessageResponse markAsRead(UUID chatId, Actor actor);
}
