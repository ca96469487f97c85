package com.dropline.orderservice.policy;

import com.dropline.common.exception.AccessDeniedException;
import com.dropline.orderservice.model.ActorRole;
import com.dropline.orderservice.model.Order;
import com.dropline.orderservice.model.OrderStatus;
import com.dropline.orderservice.security.Actor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * All role decisions about an order live here.
 *
 * <ul>
 *   <li>Admin: any transition the lifecycle allows, any chat on the order.</li>
 *   <li>Vendor of the order: into confirmed, preparing, ready.</li>
 *   <li>Assigned delivery agent: into picked_up, in_transit, delivered.</li>
 *   <li>Customer of the order: cancellation, while pending or confirmed.</li>
 * </ul>
 * Anyone else, dispatcher included, is refused status changes.
 * Graph validity is checked by the caller before the guard is consulted.
 */
@Component
public class AuthorizationGuard {

    private static final Set<OrderStatus> VENDOR_TARGETS =
            EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY);

    private static final Set<OrderStatus> DELIVERY_TARGETS =
            EnumSet.of(OrderStatus.PICKED_UP, OrderStatus.IN_TRANSIT, OrderStatus.DELIVERED);

    private static final Set<OrderStatus> CUSTOMER_CANCELLABLE =
            EnumSet.of(OrderStatus.PENDING, OrderStatus.CONFIRMED);

    public boolean canTransition(Order order, Actor actor, OrderStatus requested) {
        if (order == null || actor == null || actor.getRole() == null || requested == null) {
            return false;
        }
        return switch (actor.getRole()) {
            case ADMIN -> order.getStatus().canTransitionTo(requested);
            case VENDOR -> isOrderVendor(order, actor) && VENDOR_TARGETS.contains(requested);
            case DELIVERY_AGENT -> isAssignedAgent(order, actor) && DELIVERY_TARGETS.contains(requested);
            case CUSTOMER -> isOrderCustomer(order, actor)
                    && requested == OrderStatus.CANCELLED
                    && CUSTOMER_CANCELLABLE.contains(order.getStatus());
            case DISPATCHER -> false;
        };
    }

    /**
     * Customer, vendor of the order, its assigned agent, or an admin.
     */
    public boolean isParticipant(Order order, Actor actor) {
        if (order == null || actor == null || actor.getRole() == null) {
            return false;
        }
        return switch (actor.getRole()) {
            case ADMIN -> true;
            case VENDOR -> isOrderVendor(order, actor);
            case DELIVERY_AGENT -> isAssignedAgent(order, actor);
            case CUSTOMER -> isOrderCustomer(order, actor);
            case DISPATCHER -> false;
        };
    }

    public boolean canSend(Order order, Actor actor) {
        return isParticipant(order, actor);
    }

    public boolean canAssignAgent(Actor actor) {
        return actor != null && (actor.hasRole(ActorRole.ADMIN) || actor.hasRole(ActorRole.DISPATCHER));
    }

    /**
     * Picks the addressee of a chat message sent by {@code actor}.
     *
     * @param requestedReceiverId addressee chosen by the sender, may be null
     * @throws AccessDeniedException when the addressee is not someone the sender may write to
     */
    public UUID resolveReceiver(Order order, Actor actor, UUID requestedReceiverId) {
        if (!canSend(order, actor)) {
            throw new AccessDeniedException("Access Denied: You are not a participant of this order");
        }

        return switch (actor.getRole()) {
            case CUSTOMER -> {
                if (requestedReceiverId == null) {
                    yield order.getDeliveryPersonId() != null ? order.getDeliveryPersonId() : order.getVendorId();
                }
                if (requestedReceiverId.equals(order.getVendorId())
                        || requestedReceiverId.equals(order.getDeliveryPersonId())) {
                    yield requestedReceiverId;
                }
                throw new AccessDeniedException("Access Denied: Customers can only message the vendor or delivery agent");
            }
            case VENDOR, DELIVERY_AGENT -> {
                if (requestedReceiverId == null || requestedReceiverId.equals(order.getUserId())) {
                    yield order.getUserId();
                }
                throw new AccessDeniedException("Access Denied: Messages can only be addressed to the customer");
            }
            case ADMIN -> {
                if (requestedReceiverId == null) {
                    yield order.getUserId();
                }
                if (requestedReceiverId.equals(order.getUserId())
                        || requestedReceiverId.equals(order.getVendorId())
                        || requestedReceiverId.equals(order.getDeliveryPersonId())) {
                    yield requestedReceiverId;
                }
                throw new AccessDeniedException("Access Denied: Receiver is not a participant of this order");
            }
            case DISPATCHER -> throw new AccessDeniedException("Access Denied: Dispatcher cannot send messages");
        };
    }

    private boolean isOrderVendor(Order order, Actor actor) {
        return actor.getVendorId() != null && Objects.equals(actor.getVendorId(), order.getVendorId());
    }

    private boolean isAssignedAgent(Order order, Actor actor) {
        return order.getDeliveryPersonId() != null && Objects.equals(actor.getUserId(), order.getDeliveryPersonId());
    }

    private boolean isOrderCustomer(Order order, Actor actor) {
        return actor.getUserId() != null && Objects.equals(actor.getUserId(), order.getUserId());
    }
}
