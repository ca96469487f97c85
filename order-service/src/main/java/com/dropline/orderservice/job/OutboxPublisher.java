package com.dropline.orderservice.job;

import com.dropline.orderservice.config.OutboxProperties;
import com.dropline.orderservice.model.OutboxEvent;
import com.dropline.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays the order event log to RabbitMQ, oldest first, with the row type as routing key.
 * A row that fails to publish stays unprocessed and is retried on the next run, so consumers
 * must tolerate duplicates (the message id is the row id).
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "dropline.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    static final String HEADER_ORDER_ID = "x-order-id";

    private final OutboxRepository outboxRepository;
    private final RabbitTemplate rabbitTemplate;
    private final OutboxProperties outboxProperties;

    @Scheduled(fixedDelayString = "${dropline.outbox.publish-delay-ms:2000}")
    @Transactional
    public void publishOutboxEvents() {
        List<OutboxEvent> pending = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();
        if (pending.isEmpty()) {
            return;
        }

        int published = 0;
        for (OutboxEvent event : pending) {
            if (relay(event)) {
                published++;
            }
        }
        log.debug("Outbox run finished: published={}, pending={}", published, pending.size() - published);
    }

    private boolean relay(OutboxEvent event) {
        Message message = MessageBuilder
                .withBody(event.getPayload().getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding(StandardCharsets.UTF_8.name())
                .setMessageId(event.getId().toString())
                .setHeader(HEADER_ORDER_ID, event.getAggregateId())
                .build();
        try {
            rabbitTemplate.send(outboxProperties.getExchange(), event.getType(), message);
        } catch (AmqpException e) {
            log.error("Failed to publish order event: id={}, type={}, orderId={}",
                    event.getId(), event.getType(), event.getAggregateId(), e);
            return false;
        }

        event.setProcessed(true);
        outboxRepository.save(event);
        log.info("Published order event: id={}, type={}, orderId={}", event.getId(), event.getType(), event.getAggregateId());
        return true;
    }

    @Scheduled(cron = "${dropline.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public void cleanupProcessedEvents() {
        LocalDateTime cutoff = LocalDateTime.now().minus(outboxProperties.getRetention());

        int deleted = 0;
        List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
        while (!batch.isEmpty()) {
            outboxRepository.deleteAll(batch);
            deleted += batch.size();
            batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
        }

        if (deleted > 0) {
            log.info("Purged {} processed order events older than {}", deleted, cutoff);
        }
    }
}
