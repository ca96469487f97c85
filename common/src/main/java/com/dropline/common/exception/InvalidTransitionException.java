package com.dropline.common.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a requested change is not allowed from the order's current state: a status that
 * is not the next step of the lifecycle, a terminal order, a concurrent writer that won the race,
 * or a second delivery agent.
 * HTTP Status: 409 Conflict (set in GlobalExceptionHandler)
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID orderId;
    private final String currentStatus;
    private final String requestedStatus;

    public InvalidTransitionException(UUID orderId, String currentStatus, String requestedStatus) {
        super(String.format("Order %s cannot move from %s to %s", orderId, currentStatus, requestedStatus));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public InvalidTransitionException(UUID orderId, String currentStatus, String requestedStatus, String message) {
        super(message);
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
