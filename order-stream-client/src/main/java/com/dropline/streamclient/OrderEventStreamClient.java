package com.dropline.streamclient;

import com.dropline.common.config.JacksonConfig;
import com.dropline.common.stream.FrameTypes;
import com.dropline.common.stream.SubscriptionCommand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Client of the order event stream.
 *
 * <p>The set of joined orders is kept on the client and replayed after every (re)connect, since
 * the server treats each connection as new. Lost connections are retried with exponential
 * backoff: 1s initial, doubling up to 30s, at most 5 attempts by default. Once attempts are
 * exhausted the client moves to {@link ConnectionState#FAILED} and stops retrying until
 * {@link #connect()} is called again. {@link #close()} is final and cancels a pending retry.
 */
@Slf4j
public class OrderEventStreamClient {

    private final WebSocketClient webSocketClient;
    private final StreamClientProperties properties;
    private final Supplier<String> tokenSupplier;
    private final OrderEventListener listener;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;

    private final Set<UUID> joinedOrders = ConcurrentHashMap.newKeySet();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private WebSocketSession session;
    private ScheduledFuture<?> pendingReconnect;
    private int reconnectAttempts;

    public OrderEventStreamClient(WebSocketClient webSocketClient,
                                  StreamClientProperties properties,
                                  Supplier<String> tokenSupplier,
                                  OrderEventListener listener,
                                  ScheduledExecutorService scheduler) {
        this(webSocketClient, properties, tokenSupplier, listener, scheduler, JacksonConfig.newObjectMapper());
    }

    public OrderEventStreamClient(WebSocketClient webSocketClient,
                                  StreamClientProperties properties,
                                  Supplier<String> tokenSupplier,
                                  OrderEventListener listener,
                                  ScheduledExecutorService scheduler,
                                  ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.properties = properties;
        this.tokenSupplier = tokenSupplier;
        this.listener = listener;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
    }

    public synchronized void connect() {
        if (state == ConnectionState.CLOSED) {
            throw new IllegalStateException("Client has been closed");
        }
        if (state == ConnectionState.OPEN || state == ConnectionState.CONNECTING) {
            return;
        }
        cancelPendingReconnect();
        reconnectAttempts = 0;
        transitionTo(ConnectionState.CONNECTING);
        openConnection();
    }

    /**
     * Subscribes to an order. Remembered across reconnects.
     */
    public void join(UUID orderId) {
        if (joinedOrders.add(orderId)) {
            sendIfOpen(SubscriptionCommand.join(orderId));
        }
    }

    public void leave(UUID orderId) {
        if (joinedOrders.remove(orderId)) {
            sendIfOpen(SubscriptionCommand.leave(orderId));
        }
    }

    public Set<UUID> getJoinedOrders() {
        return Set.copyOf(joinedOrders);
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public void close() {
        WebSocketSession current;
        synchronized (this) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            cancelPendingReconnect();
            transitionTo(ConnectionState.CLOSED);
            current = session;
            session = null;
        }
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Error while closing order stream: {}", e.getMessage());
            }
        }
    }

    /**
     * Exponential backoff: 1s, 2s, 4s, ... capped at the configured maximum.
     */
    long computeReconnectDelay(int attempt) {
        long initial = properties.getInitialReconnectDelay().toMillis();
        long max = properties.getMaxReconnectDelay().toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        return Math.min(initial * (1L << shift), max);
    }

    int getReconnectAttempts() {
        return reconnectAttempts;
    }

    private void openConnection() {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        String token = tokenSupplier.get();
        if (token != null) {
            headers.add(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }

        log.info("Connecting to order stream: endpoint={}", properties.getEndpoint());
        try {
            webSocketClient.execute(new StreamHandler(), headers, properties.getEndpoint())
                    .whenComplete((connected, failure) -> {
                        if (failure != null) {
                            log.warn("Order stream connection failed: {}", failure.getMessage());
                            onConnectionLost(null);
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Order stream connection could not be started: {}", e.getMessage());
            onConnectionLost(null);
        }
    }

    private synchronized void onOpened(WebSocketSession newSession) throws IOException {
        if (state == ConnectionState.CLOSED) {
            newSession.close(CloseStatus.NORMAL);
            return;
        }
        session = newSession;
        reconnectAttempts = 0;
        transitionTo(ConnectionState.OPEN);
        for (UUID orderId : joinedOrders) {
            send(newSession, SubscriptionCommand.join(orderId));
        }
        log.info("Order stream open: sessionId={}, rejoined={}", newSession.getId(), joinedOrders.size());
    }

    private synchronized void onConnectionLost(WebSocketSession lost) {
        if (lost != null && session != null && lost != session) {
            // a stale connection closing after a newer one opened
            return;
        }
        session = null;
        if (state == ConnectionState.CLOSED || state == ConnectionState.FAILED || state == ConnectionState.DISCONNECTED) {
            return;
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        int attempt = ++reconnectAttempts;
        if (attempt > properties.getMaxReconnectAttempts()) {
            log.error("Order stream failed to reconnect after {} attempts. Giving up.", attempt - 1);
            transitionTo(ConnectionState.FAILED);
            return;
        }

        long delay = computeReconnectDelay(attempt);
        log.info("Reconnection attempt {}/{}, next retry in {}ms", attempt, properties.getMaxReconnectAttempts(), delay);
        transitionTo(ConnectionState.RECONNECTING);
        pendingReconnect = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        pendingReconnect = null;
        if (state != ConnectionState.RECONNECTING) {
            return;
        }
        openConnection();
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void transitionTo(ConnectionState next) {
        if (state == next) {
            return;
        }
        log.debug("Order stream state: {} -> {}", state, next);
        state = next;
        listener.onStateChange(next);
    }

    private void sendIfOpen(SubscriptionCommand command) {
        WebSocketSession current;
        synchronized (this) {
            current = state == ConnectionState.OPEN ? session : null;
        }
        if (current != null) {
            send(current, command);
        }
    }

    private void send(WebSocketSession target, SubscriptionCommand command) {
        try {
            synchronized (target) {
                target.sendMessage(new TextMessage(objectMapper.writeValueAsString(command)));
            }
        } catch (IOException e) {
            // the close callback schedules the reconnect, which replays the join
            log.warn("Failed to send '{}' for order {}: {}", command.getAction(), command.getOrderId(), e.getMessage());
        }
    }

    private void dispatch(String payload) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable stream frame: {}", e.getOriginalMessage());
            return;
        }

        String type = frame.path("type").asText(null);
        JsonNode data = frame.path("data");
        if (FrameTypes.JOINED.equals(type)) {
            try {
                listener.onJoined(UUID.fromString(data.path("orderId").asText()), data.path("status").asText(null));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring joined frame with invalid orderId: {}", data.path("orderId").asText());
            }
        } else if (FrameTypes.ERROR.equals(type)) {
            listener.onError(data.path("code").asText(null), data.path("message").asText(null));
        } else if (type != null) {
            listener.onEvent(type, data);
        } else {
            log.debug("Ignoring stream frame without type");
        }
    }

    private class StreamHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession session) throws Exception {
            onOpened(session);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            dispatch(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("Order stream transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            log.info("Order stream closed: sessionId={}, status={}", session.getId(), status.getCode());
            onConnectionLost(session);
        }
    }
}
