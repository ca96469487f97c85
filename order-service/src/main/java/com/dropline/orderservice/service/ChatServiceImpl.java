package com.dropline.orderservice.service;

import com.dropline.common.contracts.ChatMessageContract;
import com.dropline.common.exception.AccessDeniedException;
import com.dropline.common.exception.ResourceNotFoundException;
import com.dropline.orderservice.config.AmqpConfig;
import com.dropline.orderservice.dto.ChatMessageRequest;
import com.dropline.orderservice.dto.ChatMessageResponse;
import com.dropline.orderservice.event.OrderEventRecorder;
import com.dropline.orderservice.event.OrderEventType;
import com.dropline.orderservice.mapper.ChatMessageMapper;
import com.dropline.orderservice.model.ChatMessage;
import com.dropline.orderservice.model.Order;
import com.dropline.orderservice.policy.AuthorizationGuard;
import com.dropline.orderservice.repository.ChatMessageRepository;
import com.dropline.orderservice.repository.OrderRepository;
import com.dropline.orderservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

    private final OrderRepository orderRepository;
    private final ChatMessageRepository chatMessageRepository;
    private final ChatMessageMapper chatMessageMapper;
    private final AuthorizationGuard authorizationGuard;
    private final OrderEventRecorder eventRecorder;

    @Override
    @Transactional
    public ChatMessageResponse sendChatMessage(UUID orderId, ChatMessageRequest request, Actor actor) {
        Order order = findOrder(orderId);

        if (!authorizationGuard.canSend(order, actor)) {
            log.warn("Access denied: {} {} attempted to message on order {}", actor.getRole(), actor.getUserId(), orderId);
            throw new AccessDeniedException("Access Denied: You are not a participant of this order");
        }

        UUID receiverId = authorizationGuard.resolveReceiver(order, actor, request.getReceiverId());

        ChatMessage chatMessage = new ChatMessage();
        chatMessage.setOrderId(orderId);
        chatMessage.setSenderId(actor.chatIdentity());
        chatMessage.setReceiverId(receiverId);
        chatMessage.setMessage(request.getMessage());
        chatMessage.setRead(false);

        ChatMessage saved = chatMessageRepository.save(chatMessage);
        log.info("Chat message saved: chatId={}, orderId={}, senderId={}, receiverId={}",
                saved.getId(), orderId, saved.getSenderId(), receiverId);

        ChatMessageContract contract = ChatMessageContract.builder()
                .id(saved.getId())
                .orderId(orderId)
                .senderId(saved.getSenderId())
                .senderRole(actor.getRole().name())
                .receiverId(receiverId)
                .message(saved.getMessage())
                .read(false)
                .createdAt(saved.getCreatedAt() != null ? saved.getCreatedAt() : Instant.now())
                .build();
        eventRecorder.record(OrderEventType.CHAT_MESSAGE, AmqpConfig.ROUTING_KEY_CHAT_MESSAGE, orderId, actor, contract);

        return chatMessageMapper.toResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessageResponse> getChatHistory(UUID orderId, Actor actor) {
        Order order = findOrder(orderId);

        if (!authorizationGuard.isParticipant(order, actor)) {
            log.warn("Access denied: {} {} attempted to read chat of order {}", actor.getRole(), actor.getUserId(), orderId);
            throw new AccessDeniedException("Access Denied: You are not a participant of this order");
        }

        return chatMessageMapper.toResponses(chatMessageRepository.findByOrderIdOrderByCreatedAtAsc(orderId));
    }

    @Override
    @Transactional
    public ChatMessageResponse markAsRead(UUID chatId, Actor actor) {
        ChatMessage chatMessage = chatMessageRepository.findById(chatId)
                .orElseThrow(() -> {
                    log.warn("Chat message not found: chatId={}", chatId);
                    return new ResourceNotFoundException("Chat message not found with id: " + chatId);
                });

        if (!chatMessage.getReceiverId().equals(actor.chatIdentity())) {
            log.warn("Access denied: {} {} attempted to mark message {} as read", actor.getRole(), actor.getUserId(), chatId);
            throw new AccessDeniedException("Access Denied: Only the receiver can mark a message as read");
        }

        if (!chatMessage.isRead()) {
            chatMessage.setRead(true);
            chatMessage = chatMessageRepository.save(chatMessage);
            log.info("Chat message marked as read: chatId={}", chatId);
        }

        return chatMessageMapper.toResponse(chatMessage);
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }
}
