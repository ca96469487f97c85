package com.dropline.common.exception;

/**
 * Thrown when an actor may not perform an action on an order (wrong role, not a participant,
 * or an addressee outside the allowed set).
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
