package com.dropline.streamclient;

import lombok.Getter;
import lombok.Setter;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings of {@link OrderEventStreamClient}.
 * Reconnect delay is {@code min(initialReconnectDelay * 2^(attempt-1), maxReconnectDelay)}.
 */
@Getter
@Setter
public class StreamClientProperties {

    private URI endpoint = URI.create("ws://localhost:8082/ws");

    private Duration initialReconnectDelay = Duration.ofSeconds(1);

    private Duration maxReconnectDelay = Duration.ofSeconds(30);

    private int maxReconnectAttempts = 5;
}
