package com.dropline.orderservice;

import com.dropline.common.exception.InvalidTransitionException;
import com.dropline.common.model.Address;
import com.dropline.orderservice.dto.OrderItemRequest;
import com.dropline.orderservice.dto.OrderRequest;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.model.ActorRole;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.model.OutboxEvent;
import com.dropline.orderservice.repository.ChatMessageRepository;
import com.dropline.orderservice.repository.OrderRepository;
import com.dropline.orderservice.repository.OutboxRepository;
import com.dropline.orderservice.security.Actor;
import com.dropline.orderservice.service.OrderService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class OrderLifecycleIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    private UUID customerId;
    private UUID vendorUserId;
    private UUID vendorId;
    private UUID agentId;

    private Actor customer;
    private Actor vendor;

    @BeforeEach
    void setUp() {
        customerId = UUID.randomUUID();
        vendorUserId = UUID.randomUUID();
        vendorId = UUID.randomUUID();
        agentId = UUID.randomUUID();
        customer = Actor.builder().userId(customerId).role(ActorRole.CUSTOMER).build();
        vendor = Actor.builder().userId(vendorUserId).role(ActorRole.VENDOR).vendorId(vendorId).build();
    }

    @AfterEach
    void cleanup() {
        chatMessageRepository.deleteAll();
        orderRepository.deleteAll();
        outboxRepository.deleteAll();
    }

    private JwtRequestPostProcessor as(UUID subject, String role, Map<String, Object> extraClaims) {
        return jwt().jwt(builder -> {
            builder.subject(subject.toString())
                    .claim("resource_access", Map.of("dropline-backend", Map.of("roles", List.of(role))));
            extraClaims.forEach(builder::claim);
        });
    }

    private JwtRequestPostProcessor asVendor() {
        return as(vendorUserId, "VENDOR", Map.of("vendor_id", vendorId.toString()));
    }

    private JwtRequestPostProcessor asAgent() {
        return as(agentId, "DELIVERY_AGENT", Map.of());
    }

    private OrderResponse placeOrder() {
        OrderRequest request = OrderRequest.builder()
                .vendorId(vendorId)
                .deliveryAddress(Address.builder().street("1 Main St").city("Springfield").country("US").build())
                .deliveryFee(new BigDecimal("3.00"))
                .items(new ArrayList<>(List.of(OrderItemRequest.builder()
                        .productId(UUID.randomUUID())
                        .productName("Pizza")
                        .quantity(2)
                        .unitPrice(new BigDecimal("8.50"))
                        .build())))
                .build();
        return orderService.createOrder(request, customer);
    }

    private void patchStatus(UUID orderId, JwtRequestPostProcessor who, String status, int expectedStatus) throws Exception {
        mockMvc.perform(patch("/api/v1/orders/" + orderId + "/status")
                        .with(who)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"" + status + "\"}"))
                .andExpect(status().is(expectedStatus));
    }

    @Test
    void should_walk_an_order_to_delivered() throws Exception {
        OrderResponse created = placeOrder();
        UUID orderId = created.getId();
        assertThat(created.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(created.getTotalAmount()).isEqualByComparingTo("20.00");

        patchStatus(orderId, asVendor(), "confirmed", 200);
        patchStatus(orderId, asVendor(), "preparing", 200);
        patchStatus(orderId, asVendor(), "ready", 200);

        mockMvc.perform(put("/api/v1/orders/" + orderId + "/delivery-agent")
                        .with(as(UUID.randomUUID(), "ADMIN", Map.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\":\"" + agentId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deliveryPersonId").value(agentId.toString()));

        // the vendor's part ends at ready
        patchStatus(orderId, asVendor(), "picked_up", 403);

        patchStatus(orderId, asAgent(), "picked_up", 200);
        patchStatus(orderId, asAgent(), "in_transit", 200);
        patchStatus(orderId, asAgent(), "delivered", 200);

        mockMvc.perform(get("/api/v1/orders/" + orderId).with(as(customerId, "CUSTOMER", Map.of())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("delivered"))
                .andExpect(jsonPath("$.actualDeliveryTime").isNotEmpty());

        patchStatus(orderId, as(UUID.randomUUID(), "ADMIN", Map.of()), "cancelled", 409);

        List<String> routingKeys = outboxRepository.findByAggregateIdOrderByCreatedAtAsc(orderId.toString()).stream()
                .map(OutboxEvent::getType)
                .toList();
        assertThat(routingKeys).containsExactly(
                "order.created",
                "order.status_changed",
                "order.status_changed",
                "order.status_changed",
                "order.agent_assigned",
                "order.status_changed",
                "order.status_changed",
                "order.status_changed");
    }

    @Test
    void should_reject_skipping_steps() throws Exception {
        UUID orderId = placeOrder().getId();

        patchStatus(orderId, asVendor(), "ready", 409);

        assertThat(orderRepository.findById(orderId)).get()
                .extracting(o -> o.getStatus())
                .isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void should_let_only_one_of_two_concurrent_updates_win() throws Exception {
        UUID orderId = placeOrder().getId();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<OrderResponse> confirm = () -> orderService.updateOrderStatus(orderId, OrderStatus.CONFIRMED, vendor);
            List<Future<OrderResponse>> results = List.of(pool.submit(confirm), pool.submit(confirm));

            int succeeded = 0;
            for (Future<OrderResponse> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InvalidTransitionException.class);
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(orderRepository.findById(orderId)).get()
                    .extracting(o -> o.getStatus())
                    .isEqualTo(OrderStatus.CONFIRMED);
            assertThat(outboxRepository.findByAggregateIdOrderByCreatedAtAsc(orderId.toString()))
                    .extracting(OutboxEvent::getType)
                    .containsExactly("order.created", "order.status_changed");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void should_keep_chat_between_participants() throws Exception {
        UUID orderId = placeOrder().getId();

        mockMvc.perform(post("/api/v1/orders/" + orderId + "/chats")
                        .with(as(customerId, "CUSTOMER", Map.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"extra napkins please\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.receiverId").value(vendorId.toString()));

        mockMvc.perform(get("/api/v1/orders/" + orderId + "/chats").with(asVendor()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].message").value("extra napkins please"));

        mockMvc.perform(get("/api/v1/orders/" + orderId + "/chats").with(as(UUID.randomUUID(), "CUSTOMER", Map.of())))
                .andExpect(status().isForbidden());
    }
}
