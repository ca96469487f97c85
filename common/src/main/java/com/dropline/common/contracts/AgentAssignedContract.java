package com.dropline.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of order.agent_assigned, published by order-service once the delivery agent is fixed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentAssignedContract {
    private UUID orderId;
    private UUID userId;
    private UUID vendorId;
    private UUID deliveryPersonId;
    private String status;
    private UUID assignedBy;
    private String assignedByRole;
    private Instant occurredAt;
}
