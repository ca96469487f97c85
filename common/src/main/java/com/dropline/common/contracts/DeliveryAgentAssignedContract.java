package com.dropline.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Sent by the dispatcher when it has picked a delivery agent for an order.
 * May be redelivered; order-service treats a repeat of the same pair as a no-op.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAgentAssignedContract {
    private UUID orderId;
    private UUID agentId;
}
