package com.dropline.orderservice.subscriber;

import com.dropline.common.contracts.DeliveryAgentAssignedContract;
import com.dropline.common.exception.InvalidTransitionException;
import com.dropline.common.exception.ResourceNotFoundException;
import com.dropline.orderservice.config.AmqpConfig;
import com.dropline.orderservice.security.Actor;
import com.dropline.orderservice.service.OrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Applies the dispatcher's agent choice through the same path as the REST endpoint.
 * Replays of an applied assignment are no-ops; assignments that can no longer apply
 * (unknown order, different agent already set, order past pickup) are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryAgentAssignedSubscriber {

    private final OrderService orderService;

    @RabbitListener(queues = AmqpConfig.Q_AGENT_ASSIGNED)
    public void handleAgentAssigned(DeliveryAgentAssignedContract contract) {
        log.info("Received '{}' event. orderId={}, agentId={}",
                AmqpConfig.ROUTING_KEY_DISPATCH_AGENT_ASSIGNED, contract.getOrderId(), contract.getAgentId());

        if (contract.getOrderId() == null || contract.getAgentId() == null) {
            log.warn("Dropping incomplete agent assignment: {}", contract);
            return;
        }

        try {
            orderService.assignDeliveryAgent(contract.getOrderId(), contract.getAgentId(), Actor.dispatcher());
        } catch (ResourceNotFoundException e) {
            log.warn("Dropping agent assignment for unknown order. orderId={}", contract.getOrderId());
        } catch (InvalidTransitionException e) {
            log.warn("Dropping agent assignment that no longer applies. orderId={}, agentId={}, reason={}",
                    contract.getOrderId(), contract.getAgentId(), e.getMessage());
        }
    }
}
