package com.dropline.orderservice.dto;

import com.dropline.common.model.Address;
import com.dropline.orderservice.model.OrderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {
    @NotNull(message = "Vendor ID cannot be null")
    private UUID vendorId;

    @NotNull(message = "Delivery address cannot be null")
    @Valid
    private Address deliveryAddress;

    // required for point-to-point orders
    @Valid
    private Address pickupAddress;

    // catalog orders need at least one item, checked in the service
    @Valid
    @Builder.Default
    private List<OrderItemRequest> items = new ArrayList<>();

    @DecimalMin(value = "0.0", message = "Delivery fee cannot be negative")
    private BigDecimal deliveryFee;

    private OrderType orderType;

    @Size(max = 1000, message = "Special instructions cannot exceed 1000 characters")
    private String specialInstructions;

    private Instant estimatedDeliveryTime;
}
