package com.dropline.orderservice.event;

import com.dropline.orderservice.model.ActorRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One accepted change on an order. Raised inside the transaction that made the change
 * and handed to the stream after commit by {@link OrderEventRelay}.
 */
@Value
@Builder
public class OrderEvent {
    UUID eventId;
    OrderEventType type;
    UUID orderId;
    UUID actorId;
    ActorRole actorRole;
    // contract object from com.dropline.common.contracts
    Object payload;
    Instant occurredAt;
}
