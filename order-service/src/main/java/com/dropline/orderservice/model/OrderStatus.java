package com.dropline.orderservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Order lifecycle:
 * <pre>
 * pending -> confirmed -> preparing -> ready -> picked_up -> in_transit -> delivered
 *    \___________\____________\_________\__________\____________\-----> cancelled
 * </pre>
 * Every status moves only to its immediate successor, or to {@link #CANCELLED} while not terminal.
 */
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    PREPARING("preparing"),
    READY("ready"),
    PICKED_UP("picked_up"),
    IN_TRANSIT("in_transit"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    // a delivery agent can be attached until the order leaves the vendor
    public static final Set<OrderStatus> AGENT_ASSIGNABLE = EnumSet.of(PENDING, CONFIRMED, PREPARING, READY);

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * The forward step from this status, empty for terminal statuses.
     */
    public Optional<OrderStatus> next() {
        return switch (this) {
            case PENDING -> Optional.of(CONFIRMED);
            case CONFIRMED -> Optional.of(PREPARING);
            case PREPARING -> Optional.of(READY);
            case READY -> Optional.of(PICKED_UP);
            case PICKED_UP -> Optional.of(IN_TRANSIT);
            case IN_TRANSIT -> Optional.of(DELIVERED);
            case DELIVERED, CANCELLED -> Optional.empty();
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == CANCELLED) {
            return true;
        }
        return next().map(target::equals).orElse(false);
    }

    public boolean acceptsAgentAssignment() {
        return AGENT_ASSIGNABLE.contains(this);
    }

    /**
     * Accepts the wire value ({@code picked_up}) as well as the constant name ({@code PICKED_UP}).
     */
    @JsonCreator
    public static OrderStatus fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Order status is required");
        }
        String normalized = raw.trim();
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + raw);
    }
}
