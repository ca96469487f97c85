package com.dropline.streamclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Callbacks of {@link OrderEventStreamClient}. Invoked on transport or scheduler threads;
 * implementations must not block.
 */
public interface OrderEventListener {

    /**
     * An order event: {@code chat_message}, {@code status_changed} or {@code agent_assigned}.
     */
    default void onEvent(String type, JsonNode data) {
    }

    /**
     * The server accepted a join. {@code status} is the order status at subscribe time.
     */
    default void onJoined(UUID orderId, String status) {
    }

    default void onError(String code, String message) {
    }

    default void onStateChange(ConnectionState state) {
    }
}
