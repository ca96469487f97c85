package com.dropline.orderservice.realtime;

import com.dropline.common.exception.EventDeliveryException;
import com.dropline.common.stream.StreamFrame;
import com.dropline.orderservice.event.OrderEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.Set;

/**
 * Fans an order event out to the sessions subscribed to that order.
 * Best effort: a session that fails to take the frame is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDistributor {

    private final SubscriptionRegistry subscriptionRegistry;
    private final ObjectMapper objectMapper;

    /**
     * @return number of sessions the frame was written to
     */
    public int publish(OrderEvent event) {
        Set<ConnectionSession> targets = subscriptionRegistry.subscribersOf(event.getOrderId());
        if (targets.isEmpty()) {
            log.debug("No subscribers for order event: orderId={}, type={}", event.getOrderId(), event.getType());
            return 0;
        }

        TextMessage frame;
        try {
            frame = toTextMessage(StreamFrame.of(event.getType().getFrameType(), event.getPayload()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize order event: eventId={}, orderId={}", event.getEventId(), event.getOrderId(), e);
            return 0;
        }

        int delivered = 0;
        for (ConnectionSession session : targets) {
            if (deliver(session, frame)) {
                delivered++;
            }
        }
        log.debug("Order event delivered: orderId={}, type={}, delivered={}, subscribers={}",
                event.getOrderId(), event.getType(), delivered, targets.size());
        return delivered;
    }

    /**
     * Sends a control reply (joined, error) to a single session.
     */
    public boolean sendTo(ConnectionSession session, String type, Object data) {
        try {
            return deliver(session, toTextMessage(StreamFrame.of(type, data)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize '{}' frame: sessionId={}", type, session.getId(), e);
            return false;
        }
    }

    private boolean deliver(ConnectionSession session, TextMessage frame) {
        try {
            return session.deliver(frame);
        } catch (EventDeliveryException e) {
            log.warn("Frame delivery failed: sessionId={}, error={}", session.getId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        }
    }

    private TextMessage toTextMessage(StreamFrame frame) throws JsonProcessingException {
        return new TextMessage(objectMapper.writeValueAsString(frame));
    }
}
