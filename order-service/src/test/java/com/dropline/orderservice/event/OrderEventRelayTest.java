package com.dropline.orderservice.event;

import com.dropline.orderservice.realtime.EventDistributor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderEventRelayTest {

    @Mock
    private EventDistributor eventDistributor;

    @InjectMocks
    private OrderEventRelay relay;

    private final OrderEvent event = OrderEvent.builder()
            .eventId(UUID.randomUUID())
            .type(OrderEventType.STATUS_CHANGED)
            .orderId(UUID.randomUUID())
            .build();

    @Test
    void forwardsCommittedEventToDistributor() {
        when(eventDistributor.publish(event)).thenReturn(2);

        relay.onOrderEvent(event);

        verify(eventDistributor).publish(event);
    }

    @Test
    void distributionFailureDoesNotPropagate() {
        when(eventDistributor.publish(event)).thenThrow(new IllegalStateException("registry unavailable"));

        assertThatCode(() -> relay.onOrderEvent(event)).doesNotThrowAnyException();
    }
}
