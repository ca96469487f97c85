package com.dropline.common.exception;

/**
 * A frame could not be written to one stream session.
 * Always caught and logged by the distributor; never reaches the caller of a mutation.
 */
public class EventDeliveryException extends RuntimeException {

    public EventDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
