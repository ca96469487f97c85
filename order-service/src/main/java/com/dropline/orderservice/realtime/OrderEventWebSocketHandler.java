package com.dropline.orderservice.realtime;

import com.dropline.common.exception.AccessDeniedException;
import com.dropline.common.exception.ResourceNotFoundException;
import com.dropline.common.stream.FrameTypes;
import com.dropline.common.stream.JoinedPayload;
import com.dropline.common.stream.StreamError;
import com.dropline.common.stream.SubscriptionCommand;
import com.dropline.orderservice.config.RealtimeProperties;
import com.dropline.orderservice.config.WebSocketAuthInterceptor;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.security.Actor;
import com.dropline.orderservice.service.OrderService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Order event stream endpoint.
 *
 * <p>The channel is read-only for clients: the only accepted frames are {@code join_order}
 * and {@code leave_order}. Anything else gets an {@code error} frame and the session stays open.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventWebSocketHandler extends TextWebSocketHandler {

    private final SubscriptionRegistry subscriptionRegistry;
    private final EventDistributor eventDistributor;
    private final OrderService orderService;
    private final RealtimeProperties realtimeProperties;
    private final ObjectMapper objectMapper;

    private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object actor = session.getAttributes().get(WebSocketAuthInterceptor.ACTOR_ATTRIBUTE);
        if (!(actor instanceof Actor authenticated)) {
            log.warn("Stream connection without an authenticated actor: sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) realtimeProperties.getSendTimeLimit().toMillis(),
                realtimeProperties.getSendBufferSizeLimit(),
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);

        ConnectionSession connection = new ConnectionSession(concurrentSession, authenticated);
        sessions.put(session.getId(), connection);
        connection.open();
        log.info("Stream session opened: sessionId={}, userId={}, role={}",
                session.getId(), authenticated.getUserId(), authenticated.getRole());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionSession connection = sessions.get(session.getId());
        if (connection == null || !connection.isOpen()) {
            log.debug("Ignoring frame on inactive session: sessionId={}", session.getId());
            return;
        }

        SubscriptionCommand command;
        try {
            command = objectMapper.readValue(message.getPayload(), SubscriptionCommand.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed stream frame: sessionId={}, error={}", session.getId(), e.getOriginalMessage());
            sendError(connection, StreamError.MALFORMED_FRAME, "Frame is not valid JSON");
            return;
        }
        if (command == null) {
            sendError(connection, StreamError.MALFORMED_FRAME, "Frame must be a JSON object");
            return;
        }

        String action = command.effectiveAction();
        if (FrameTypes.JOIN_ORDER.equals(action)) {
            parseOrderId(connection, command).ifPresent(orderId -> join(connection, orderId));
        } else if (FrameTypes.LEAVE_ORDER.equals(action)) {
            parseOrderId(connection, command).ifPresent(orderId -> subscriptionRegistry.unsubscribe(connection, orderId));
        } else {
            log.debug("Unsupported stream action: sessionId={}, action={}", session.getId(), action);
            sendError(connection, StreamError.UNKNOWN_ACTION, "Unsupported action: " + action);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Stream transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
        ConnectionSession connection = sessions.get(session.getId());
        if (connection != null) {
            connection.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionSession connection = sessions.remove(session.getId());
        if (connection == null) {
            return;
        }
        connection.markClosed();
        int removed = subscriptionRegistry.removeSession(connection);
        log.info("Stream session closed: sessionId={}, status={}, subscriptionsRemoved={}",
                session.getId(), status.getCode(), removed);
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private void join(ConnectionSession connection, UUID orderId) {
        OrderResponse order;
        try {
            order = orderService.getOrderById(orderId, connection.getActor());
        } catch (ResourceNotFoundException e) {
            sendError(connection, StreamError.RESOURCE_NOT_FOUND, e.getMessage());
            return;
        } catch (AccessDeniedException e) {
            sendError(connection, StreamError.ACCESS_DENIED, e.getMessage());
            return;
        }

        if (!subscriptionRegistry.subscribe(connection, orderId) && !connection.isOpen()) {
            log.debug("Session closed during join: sessionId={}, orderId={}", connection.getId(), orderId);
            return;
        }
        eventDistributor.sendTo(connection, FrameTypes.JOINED,
                new JoinedPayload(orderId, order.getStatus().getValue()));
    }

    private Optional<UUID> parseOrderId(ConnectionSession connection, SubscriptionCommand command) {
        String raw = command.effectiveOrderId();
        if (raw == null) {
            sendError(connection, StreamError.MALFORMED_FRAME, "orderId is required");
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException e) {
            sendError(connection, StreamError.MALFORMED_FRAME, "orderId is not a valid id: " + raw);
            return Optional.empty();
        }
    }

    private void sendError(ConnectionSession connection, String code, String message) {
        eventDistributor.sendTo(connection, FrameTypes.ERROR, new StreamError(code, message));
    }
}
