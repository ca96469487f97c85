package com.dropline.common.contracts;

import com.dropline.common.model.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payload of order.created and order.status_changed.
 * {@code previousStatus} is null for order.created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedContract {
    private UUID orderId;
    private String orderNumber;
    private UUID userId;
    private UUID vendorId;
    private UUID deliveryPersonId;
    private String previousStatus;
    private String status;
    private UUID changedBy;
    private String changedByRole;
    private BigDecimal totalAmount;
    private Address deliveryAddress;
    private Address pickupAddress;
    private Instant actualDeliveryTime;
    private Instant occurredAt;
}
