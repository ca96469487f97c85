package com.dropline.orderservice.service;

import com.dropline.orderservice.dto.OrderRequest;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.security.Actor;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    OrderResponse createOrder(OrderRequest orderRequest, Actor actor);

    /**
     * Orders visible to the actor, newest first: all of them for admins, the vendor's orders,
     * the agent's deliveries, or the customer's own orders.
     */
    List<OrderResponse> getMyOrders(Actor actor);

    OrderResponse getOrderById(UUID orderId, Actor actor);

    /**
     * The only way an order's status changes.
     *
     * @throws com.dropline.common.exception.ResourceNotFoundException   unknown order
     * @throws com.dropline.common.exception.InvalidTransitionException  not a lifecycle step, or lost a concurrent update
     * @throws com.dropline.common.exception.AccessDeniedException       role or ownership does not allow it
     */
    OrderResponse updateOrderStatus(UUID orderId, OrderStatus requestedStatus, Actor actor);

    OrderResponse assignDeliveryAgent(UUID orderId, UUID agentId, Actor actor);
}
