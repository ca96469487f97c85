package com.dropline.orderservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
