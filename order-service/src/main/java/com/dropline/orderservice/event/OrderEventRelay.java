package com.dropline.orderservice.event;

import com.dropline.orderservice.realtime.EventDistributor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes order events to stream subscribers after the database transaction commits.
 * A rolled back change never reaches a subscriber, and a delivery problem never
 * reaches the caller whose change already committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventRelay {

    private final EventDistributor eventDistributor;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderEvent(OrderEvent event) {
        try {
            int delivered = eventDistributor.publish(event);
            log.debug("Order event relayed: eventId={}, type={}, orderId={}, sessions={}",
                    event.getEventId(), event.getType(), event.getOrderId(), delivered);
        } catch (RuntimeException e) {
            log.error("Failed to relay order event: eventId={}, orderId={}", event.getEventId(), event.getOrderId(), e);
        }
    }
}
