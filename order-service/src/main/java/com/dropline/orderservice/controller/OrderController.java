package com.dropline.orderservice.controller;

import com.dropline.orderservice.dto.AgentAssignmentRequest;
import com.dropline.orderservice.dto.OrderRequest;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.dto.StatusUpdateRequest;
import com.dropline.orderservice.security.ActorResolver;
import com.dropline.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final ActorResolver actorResolver;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(orderRequest, actorResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getMyOrders(actorResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrderById(orderId, actorResolver.resolve(jwt)));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody StatusUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.updateOrderStatus(orderId, request.getStatus(), actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{orderId}/delivery-agent")
    public ResponseEntity<OrderResponse> assignDeliveryAgent(
            @PathVariable UUID orderId,
            @Valid @RequestBody AgentAssignmentRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.assignDeliveryAgent(orderId, request.getAgentId(), actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }
}
