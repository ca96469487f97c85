package com.dropline.orderservice.job;

import com.dropline.orderservice.config.OutboxProperties;
import com.dropline.orderservice.model.OutboxEvent;
import com.dropline.orderservice.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxRepository outboxRepository;
    @Mock
    private RabbitTemplate rabbitTemplate;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxRepository, rabbitTemplate, new OutboxProperties());
    }

    private OutboxEvent row(String type, String payload) {
        return OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType("ORDER")
                .aggregateId(UUID.randomUUID().toString())
                .type(type)
                .payload(payload)
                .createdAt(LocalDateTime.now())
                .processed(false)
                .build();
    }

    @Test
    void publishesRowsWithTypeAsRoutingKey() {
        OutboxEvent created = row("order.created", "{\"status\":\"pending\"}");
        when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of(created));

        publisher.publishOutboxEvents();

        ArgumentCaptor<Message> message = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq("order_events_exchange"), eq("order.created"), message.capture());
        assertThat(new String(message.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"status\":\"pending\"}");
        assertThat(message.getValue().getMessageProperties().getMessageId()).isEqualTo(created.getId().toString());
        assertThat((String) message.getValue().getMessageProperties().getHeader(OutboxPublisher.HEADER_ORDER_ID))
                .isEqualTo(created.getAggregateId());
        assertThat(created.isProcessed()).isTrue();
        verify(outboxRepository).save(created);
    }

    @Test
    void failedRowStaysPendingAndOthersContinue() {
        OutboxEvent first = row("order.status_changed", "{}");
        OutboxEvent second = row("order.chat_message", "{}");
        when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of(first, second));
        doThrow(new AmqpException("broker down"))
                .when(rabbitTemplate).send(any(String.class), eq("order.status_changed"), any(Message.class));

        publisher.publishOutboxEvents();

        assertThat(first.isProcessed()).isFalse();
        assertThat(second.isProcessed()).isTrue();
        verify(outboxRepository, never()).save(first);
    }

    @Test
    void cleanupDeletesInBatches() {
        List<OutboxEvent> batch = List.of(row("order.created", "{}"));
        when(outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(any()))
                .thenReturn(batch, List.of());

        publisher.cleanupProcessedEvents();

        verify(outboxRepository).deleteAll(batch);
    }
}
