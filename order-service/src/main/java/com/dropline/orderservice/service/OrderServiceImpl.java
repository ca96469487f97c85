package com.dropline.orderservice.service;

import com.dropline.common.contracts.AgentAssignedContract;
import com.dropline.common.contracts.OrderStatusChangedContract;
import com.dropline.common.exception.AccessDeniedException;
import com.dropline.common.exception.InvalidTransitionException;
import com.dropline.common.exception.ResourceNotFoundException;
import com.dropline.orderservice.config.AmqpConfig;
import com.dropline.orderservice.dto.OrderItemRequest;
import com.dropline.orderservice.dto.OrderRequest;
import com.dropline.orderservice.dto.OrderResponse;
import com.dropline.orderservice.event.OrderEventRecorder;
import com.dropline.orderservice.event.OrderEventType;
import com.dropline.orderservice.mapper.OrderMapper;
import com.dropline.orderservice.model.ActorRole;
import com.dropline.orderservice.model.Order;
import com.dropline.orderservice.model.OrderItem;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.model.OrderType;
import com.dropline.orderservice.model.PaymentStatus;
import com.dropline.orderservice.policy.AuthorizationGuard;
import com.dropline.orderservice.repository.OrderRepository;
import com.dropline.orderservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private static final String ORDER_NUMBER_PREFIX = "ORD-";

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final AuthorizationGuard authorizationGuard;
    private final OrderEventRecorder eventRecorder;

    @Override
    @Transactional
    public OrderResponse createOrder(OrderRequest orderRequest, Actor actor) {
        log.info("Order creation process started. vendorId={}, userId={}", orderRequest.getVendorId(), actor.getUserId());

        if (!actor.hasRole(ActorRole.CUSTOMER)) {
            log.warn("Access denied: {} {} attempted to place an order", actor.getRole(), actor.getUserId());
            throw new AccessDeniedException("Access Denied: Only customers can place orders");
        }

        OrderType orderType = orderRequest.getOrderType() != null ? orderRequest.getOrderType() : OrderType.CATALOG;
        List<OrderItemRequest> requestedItems = orderRequest.getItems() != null ? orderRequest.getItems() : List.of();

        if (orderType == OrderType.CATALOG && requestedItems.isEmpty()) {
            throw new IllegalArgumentException("Catalog order must contain at least one item");
        }
        if (orderType == OrderType.POINT_TO_POINT && orderRequest.getPickupAddress() == null) {
            throw new IllegalArgumentException("Point-to-point order requires a pickup address");
        }

        Order order = new Order();
        BigDecimal subtotal = BigDecimal.ZERO;
        List<OrderItem> orderItems = new ArrayList<>();
        for (OrderItemRequest reqItem : requestedItems) {
            OrderItem item = new OrderItem();
            item.setProductId(reqItem.getProductId());
            item.setProductName(reqItem.getProductName());
            item.setQuantity(reqItem.getQuantity());
            item.setUnitPrice(reqItem.getUnitPrice());
            item.setOrder(order);
            orderItems.add(item);
            subtotal = subtotal.add(reqItem.getUnitPrice().multiply(BigDecimal.valueOf(reqItem.getQuantity())));
        }

        BigDecimal deliveryFee = orderRequest.getDeliveryFee() != null ? orderRequest.getDeliveryFee() : BigDecimal.ZERO;

        order.setOrderNumber(generateOrderNumber());
        order.setUserId(actor.getUserId());
        order.setVendorId(orderRequest.getVendorId());
        order.setItems(orderItems);
        order.setSubtotal(subtotal);
        order.setDeliveryFee(deliveryFee);
        order.setTotalAmount(subtotal.add(deliveryFee));
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(PaymentStatus.PENDING);
        order.setOrderType(orderType);
        order.setDeliveryAddress(orderRequest.getDeliveryAddress());
        order.setPickupAddress(orderRequest.getPickupAddress());
        order.setSpecialInstructions(orderRequest.getSpecialInstructions());
        order.setEstimatedDeliveryTime(orderRequest.getEstimatedDeliveryTime());

        Order savedOrder = orderRepository.save(order);
        log.info("Order saved to database. orderId={}, orderNumber={}, totalAmount={}",
                savedOrder.getId(), savedOrder.getOrderNumber(), savedOrder.getTotalAmount());

        eventRecorder.record(OrderEventType.STATUS_CHANGED, AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                savedOrder.getId(), actor, toStatusContract(savedOrder, null, actor));

        return orderMapper.toOrderResponse(savedOrder);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getMyOrders(Actor actor) {
        List<Order> orders = switch (actor.getRole()) {
            case ADMIN -> orderRepository.findAllByOrderByCreatedAtDesc();
            case VENDOR -> actor.getVendorId() == null
                    ? List.of()
                    : orderRepository.findByVendorIdOrderByCreatedAtDesc(actor.getVendorId());
            case DELIVERY_AGENT -> orderRepository.findByDeliveryPersonIdOrderByCreatedAtDesc(actor.getUserId());
            case CUSTOMER -> orderRepository.findByUserIdOrderByCreatedAtDesc(actor.getUserId());
            case DISPATCHER -> throw new AccessDeniedException("Access Denied: Dispatcher has no orders of its own");
        };

        return orders.stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId, Actor actor) {
        Order order = findOrder(orderId);

        if (!authorizationGuard.isParticipant(order, actor)) {
            log.warn("Access denied: {} {} attempted to read order {}", actor.getRole(), actor.getUserId(), orderId);
            throw new AccessDeniedException("Access Denied: You are not a participant of this order");
        }

        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional
    public OrderResponse updateOrderStatus(UUID orderId, OrderStatus requestedStatus, Actor actor) {
        if (requestedStatus == null) {
            throw new IllegalArgumentException("Requested status is required");
        }
        log.info("Status update requested: orderId={}, to={}, by={} ({})",
                orderId, requestedStatus, actor.getUserId(), actor.getRole());

        Order order = findOrder(orderId);
        OrderStatus currentStatus = order.getStatus();

        if (!currentStatus.canTransitionTo(requestedStatus)) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, requestedStatus={}",
                    orderId, currentStatus, requestedStatus);
            throw new InvalidTransitionException(orderId, currentStatus.getValue(), requestedStatus.getValue());
        }

        if (!authorizationGuard.canTransition(order, actor, requestedStatus)) {
            log.warn("Access denied: {} {} attempted to move order {} from {} to {}",
                    actor.getRole(), actor.getUserId(), orderId, currentStatus, requestedStatus);
            throw new AccessDeniedException("Access Denied: You cannot move this order to " + requestedStatus.getValue());
        }

        Instant now = Instant.now();
        Instant actualDeliveryTime = requestedStatus == OrderStatus.DELIVERED ? now : null;
        int updated = orderRepository.compareAndSetStatus(orderId, currentStatus, requestedStatus, actualDeliveryTime, now);
        if (updated == 0) {
            log.warn("Concurrent status update lost: orderId={}, expected={}, requested={}",
                    orderId, currentStatus, requestedStatus);
            throw new InvalidTransitionException(orderId, currentStatus.getValue(), requestedStatus.getValue(),
                    "Order " + orderId + " was changed by another request and is no longer " + currentStatus.getValue());
        }

        Order updatedOrder = findOrder(orderId);
        log.info("Order status updated: orderId={}, from={}, to={}, by={}",
                orderId, currentStatus, requestedStatus, actor.getUserId());

        eventRecorder.record(OrderEventType.STATUS_CHANGED, AmqpConfig.ROUTING_KEY_STATUS_CHANGED,
                orderId, actor, toStatusContract(updatedOrder, currentStatus, actor));

        return orderMapper.toOrderResponse(updatedOrder);
    }

    @Override
    @Transactional
    public OrderResponse assignDeliveryAgent(UUID orderId, UUID agentId, Actor actor) {
        if (agentId == null) {
            throw new IllegalArgumentException("Agent ID is required");
        }
        log.info("Assigning delivery agent: orderId={}, agentId={}, by={}", orderId, agentId, actor.getRole());

        Order order = findOrder(orderId);

        if (!authorizationGuard.canAssignAgent(actor)) {
            log.warn("Access denied: {} {} attempted to assign a delivery agent to order {}",
                    actor.getRole(), actor.getUserId(), orderId);
            throw new AccessDeniedException("Access Denied: Only administrators or the dispatcher can assign agents");
        }

        if (order.getDeliveryPersonId() != null) {
            return alreadyAssigned(order, agentId);
        }

        if (!order.getStatus().acceptsAgentAssignment()) {
            log.warn("Agent assignment rejected: orderId={}, status={}", orderId, order.getStatus());
            throw new InvalidTransitionException(orderId, order.getStatus().getValue(), "agent_assigned",
                    "Cannot assign a delivery agent to an order in status " + order.getStatus().getValue());
        }

        int updated = orderRepository.assignDeliveryPersonIfUnassigned(
                orderId, agentId, OrderStatus.AGENT_ASSIGNABLE, Instant.now());
        if (updated == 0) {
            // someone assigned or moved the order in between
            return alreadyAssigned(findOrder(orderId), agentId);
        }

        Order updatedOrder = findOrder(orderId);
        log.info("Delivery agent assigned: orderId={}, agentId={}", orderId, agentId);

        AgentAssignedContract contract = AgentAssignedContract.builder()
                .orderId(updatedOrder.getId())
                .userId(updatedOrder.getUserId())
                .vendorId(updatedOrder.getVendorId())
                .deliveryPersonId(agentId)
                .status(updatedOrder.getStatus().getValue())
                .assignedBy(actor.getUserId())
                .assignedByRole(actor.getRole().name())
                .occurredAt(Instant.now())
                .build();
        eventRecorder.record(OrderEventType.AGENT_ASSIGNED, AmqpConfig.ROUTING_KEY_AGENT_ASSIGNED,
                orderId, actor, contract);

        return orderMapper.toOrderResponse(updatedOrder);
    }

    private OrderResponse alreadyAssigned(Order order, UUID agentId) {
        if (agentId.equals(order.getDeliveryPersonId())) {
            log.info("Delivery agent already assigned (idempotent replay). orderId={}, agentId={}",
                    order.getId(), agentId);
            return orderMapper.toOrderResponse(order);
        }
        if (order.getDeliveryPersonId() != null) {
            log.warn("Order already has a different delivery agent. orderId={}, existingAgentId={}, newAgentId={}",
                    order.getId(), order.getDeliveryPersonId(), agentId);
            throw new InvalidTransitionException(order.getId(), order.getStatus().getValue(), "agent_assigned",
                    "Order " + order.getId() + " already has a delivery agent");
        }
        log.warn("Agent assignment rejected: orderId={}, status={}", order.getId(), order.getStatus());
        throw new InvalidTransitionException(order.getId(), order.getStatus().getValue(), "agent_assigned",
                "Cannot assign a delivery agent to an order in status " + order.getStatus().getValue());
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private OrderStatusChangedContract toStatusContract(Order order, OrderStatus previousStatus, Actor actor) {
        return OrderStatusChangedContract.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .vendorId(order.getVendorId())
                .deliveryPersonId(order.getDeliveryPersonId())
                .previousStatus(previousStatus != null ? previousStatus.getValue() : null)
                .status(order.getStatus().getValue())
                .changedBy(actor.getUserId())
                .changedByRole(actor.getRole().name())
                .totalAmount(order.getTotalAmount())
                .deliveryAddress(order.getDeliveryAddress())
                .pickupAddress(order.getPickupAddress())
                .actualDeliveryTime(order.getActualDeliveryTime())
                .occurredAt(Instant.now())
                .build();
    }

    // ORD-<epoch millis>-<3 base36 chars>
    private String generateOrderNumber() {
        String suffix = Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36), 36);
        return ORDER_NUMBER_PREFIX + System.currentTimeMillis() + "-"
                + String.format("%3s", suffix).replace(' ', '0').toUpperCase(Locale.ROOT);
    }
}
