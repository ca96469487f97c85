package com.dropline.orderservice.event;

import com.dropline.orderservice.model.OutboxEvent;
import com.dropline.orderservice.repository.OutboxRepository;
import com.dropline.orderservice.security.Actor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records an order change twice: as an outbox row in the current transaction and as an
 * {@link OrderEvent} that the relay pushes to live subscribers once the transaction commits.
 * Must be called from inside the transaction that made the change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventRecorder {

    private static final String AGGREGATE_TYPE = "ORDER";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    public OrderEvent record(OrderEventType type, String routingKey, UUID orderId, Actor actor, Object payload) {
        saveOutboxEvent(orderId.toString(), routingKey, payload);

        OrderEvent event = OrderEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .orderId(orderId)
                .actorId(actor != null ? actor.getUserId() : null)
                .actorRole(actor != null ? actor.getRole() : null)
                .payload(payload)
                .occurredAt(Instant.now())
                .build();
        eventPublisher.publishEvent(event);

        log.info("'{}' event saved to Outbox. orderId={}, eventId={}", routingKey, orderId, event.getEventId());
        return event;
    }

    private void saveOutboxEvent(String aggregateId, String routingKey, Object payloadObj) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payloadObj);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event. aggregateId={}, type={}", aggregateId, routingKey, e);
            throw new IllegalStateException("Failed to serialize outbox event", e);
        }

        OutboxEvent event = OutboxEvent.builder()
                .aggregateType(AGGREGATE_TYPE)
                .aggregateId(aggregateId)
                .type(routingKey)
                .payload(payload)
                .createdAt(LocalDateTime.now())
                .processed(false)
                .build();
        outboxRepository.save(event);
    }
}
