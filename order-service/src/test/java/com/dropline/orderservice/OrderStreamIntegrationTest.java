package com.dropline.orderservice;

import com.dropline.common.model.Address;
import com.dropline.orderservice.config.TestJwtDecoderConfig;
import com.dropline.orderservice.dto.ChatMessageRequest;
import com.dropline.orderservice.dto.OrderItemRequest;
import com.dropline.orderservice.dto.OrderRequest;
import com.dropline.orderservice.model.ActorRole;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.realtime.OrderEventWebSocketHandler;
import com.dropline.orderservice.realtime.SubscriptionRegistry;
import com.dropline.orderservice.repository.ChatMessageRepository;
import com.dropline.orderservice.repository.OrderRepository;
import com.dropline.orderservice.repository.OutboxRepository;
import com.dropline.orderservice.security.Actor;
import com.dropline.orderservice.service.ChatService;
import com.dropline.orderservice.service.OrderService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End to end over a real WebSocket: JJWT-signed bearer token on the upgrade request,
 * join frames from the client, events pushed after the service commits.
 */
class OrderStreamIntegrationTest extends AbstractIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ChatService chatService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private SubscriptionRegistry subscriptionRegistry;

    @Autowired
    private OrderEventWebSocketHandler webSocketHandler;

    @Autowired
    private ObjectMapper objectMapper;

    private final List<WebSocketSession> openSessions = new ArrayList<>();

    private UUID customerId;
    private UUID vendorId;
    private Actor customer;
    private Actor vendor;

    @BeforeEach
    void setUp() {
        customerId = UUID.randomUUID();
        vendorId = UUID.randomUUID();
        customer = Actor.builder().userId(customerId).role(ActorRole.CUSTOMER).build();
        vendor = Actor.builder().userId(UUID.randomUUID()).role(ActorRole.VENDOR).vendorId(vendorId).build();
    }

    @AfterEach
    void cleanup() throws Exception {
        for (WebSocketSession session : openSessions) {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        }
        chatMessageRepository.deleteAll();
        orderRepository.deleteAll();
        outboxRepository.deleteAll();
    }

    private UUID placeOrder() {
        OrderRequest request = OrderRequest.builder()
                .vendorId(vendorId)
                .deliveryAddress(Address.builder().street("5 Elm St").city("Springfield").build())
                .items(new ArrayList<>(List.of(OrderItemRequest.builder()
                        .productId(UUID.randomUUID())
                        .productName("Salad")
                        .quantity(1)
                        .unitPrice(new BigDecimal("7.00"))
                        .build())))
                .build();
        return orderService.createOrder(request, customer).getId();
    }

    private StreamClient connect(String token) throws Exception {
        StreamClient client = new StreamClient();
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        if (token != null) {
            headers.setBearerAuth(token);
        }
        WebSocketSession session = new StandardWebSocketClient()
                .execute(client, headers, URI.create("ws://localhost:" + port + "/ws"))
                .get(10, TimeUnit.SECONDS);
        openSessions.add(session);
        client.session = session;
        return client;
    }

    @Test
    void should_push_status_changes_to_joined_customer() throws Exception {
        UUID orderId = placeOrder();
        StreamClient client = connect(TestJwtDecoderConfig.token(customerId, "CUSTOMER"));

        client.send("{\"action\":\"join_order\",\"orderId\":\"" + orderId + "\"}");
        JsonNode joined = client.next();
        assertThat(joined.get("type").asText()).isEqualTo("joined");
        assertThat(joined.get("data").get("status").asText()).isEqualTo("pending");

        orderService.updateOrderStatus(orderId, OrderStatus.CONFIRMED, vendor);
        orderService.updateOrderStatus(orderId, OrderStatus.PREPARING, vendor);

        JsonNode first = client.next();
        JsonNode second = client.next();
        assertThat(first.get("type").asText()).isEqualTo("status_changed");
        assertThat(first.get("data").get("previousStatus").asText()).isEqualTo("pending");
        assertThat(first.get("data").get("status").asText()).isEqualTo("confirmed");
        assertThat(second.get("data").get("status").asText()).isEqualTo("preparing");
    }

    @Test
    void should_push_agent_chat_to_every_session_on_that_order_only() throws Exception {
        UUID watched = placeOrder();
        UUID other = placeOrder();
        UUID agentId = UUID.randomUUID();
        orderService.assignDeliveryAgent(watched, agentId, Actor.dispatcher());

        StreamClient customerClient = connect(TestJwtDecoderConfig.token(customerId, "CUSTOMER"));
        StreamClient vendorClient = connect(TestJwtDecoderConfig.token(vendor.getUserId(), "VENDOR", vendorId));
        StreamClient otherOrderClient = connect(TestJwtDecoderConfig.token(customerId, "CUSTOMER"));
        customerClient.send("{\"action\":\"join_order\",\"orderId\":\"" + watched + "\"}");
        vendorClient.send("{\"action\":\"join_order\",\"orderId\":\"" + watched + "\"}");
        otherOrderClient.send("{\"action\":\"join_order\",\"orderId\":\"" + other + "\"}");
        assertThat(customerClient.next().get("type").asText()).isEqualTo("joined");
        assertThat(vendorClient.next().get("type").asText()).isEqualTo("joined");
        assertThat(otherOrderClient.next().get("type").asText()).isEqualTo("joined");

        Actor agent = Actor.builder().userId(agentId).role(ActorRole.DELIVERY_AGENT).build();
        chatService.sendChatMessage(watched, ChatMessageRequest.builder().message("10 more minutes").build(), agent);

        for (StreamClient participant : List.of(customerClient, vendorClient)) {
            JsonNode frame = participant.next();
            assertThat(frame.get("type").asText()).isEqualTo("chat_message");
            assertThat(frame.get("data").get("orderId").asText()).isEqualTo(watched.toString());
            assertThat(frame.get("data").get("senderId").asText()).isEqualTo(agentId.toString());
            assertThat(frame.get("data").get("message").asText()).isEqualTo("10 more minutes");
        }
        assertThat(otherOrderClient.poll(500)).isNull();
    }

    @Test
    void should_refuse_joining_someone_elses_order() throws Exception {
        UUID orderId = placeOrder();
        StreamClient intruder = connect(TestJwtDecoderConfig.token(UUID.randomUUID(), "CUSTOMER"));

        intruder.send("{\"action\":\"join_order\",\"orderId\":\"" + orderId + "\"}");

        JsonNode error = intruder.next();
        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(error.get("data").get("code").asText()).isEqualTo("ACCESS_DENIED");
        assertThat(intruder.session.isOpen()).isTrue();
        assertThat(subscriptionRegistry.subscribersOf(orderId)).isEmpty();
    }

    @Test
    void should_reject_upgrade_without_token() {
        assertThatThrownBy(() -> connect(null))
                .isInstanceOf(ExecutionException.class);
    }

    @Test
    void should_drop_subscriptions_when_client_disconnects() throws Exception {
        UUID orderId = placeOrder();
        StreamClient client = connect(TestJwtDecoderConfig.token(customerId, "CUSTOMER"));
        client.send("{\"action\":\"join_order\",\"orderId\":\"" + orderId + "\"}");
        client.next();
        assertThat(subscriptionRegistry.subscribersOf(orderId)).hasSize(1);

        client.session.close(CloseStatus.NORMAL);

        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(subscriptionRegistry.subscribersOf(orderId)).isEmpty());
        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(webSocketHandler.activeSessionCount()).isZero());
    }

    private class StreamClient extends TextWebSocketHandler {

        private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            frames.add(message.getPayload());
        }

        void send(String payload) throws Exception {
            session.sendMessage(new TextMessage(payload));
        }

        JsonNode next() throws Exception {
            String frame = frames.poll(10, TimeUnit.SECONDS);
            assertThat(frame).as("expected a frame within 10s").isNotNull();
            return objectMapper.readTree(frame);
        }

        JsonNode poll(long millis) throws Exception {
            String frame = frames.poll(millis, TimeUnit.MILLISECONDS);
            return frame == null ? null : objectMapper.readTree(frame);
        }
    }
}
