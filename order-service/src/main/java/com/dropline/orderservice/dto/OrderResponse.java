package com.dropline.orderservice.dto;

import com.dropline.common.model.Address;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.model.OrderType;
import com.dropline.orderservice.model.PaymentStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID userId;
    private UUID vendorId;
    private UUID deliveryPersonId;
    private List<OrderItemResponse> items;
    private BigDecimal subtotal;
    private BigDecimal deliveryFee;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private OrderType orderType;
    private Address deliveryAddress;
    private Address pickupAddress;
    private String specialInstructions;
    private Instant estimatedDeliveryTime;
    private Instant actualDeliveryTime;
    private Instant createdAt;
    private Instant updatedAt;
}
