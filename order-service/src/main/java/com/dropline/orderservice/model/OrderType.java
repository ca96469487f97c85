package com.dropline.orderservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * CATALOG orders carry vendor items; POINT_TO_POINT orders move a parcel between two addresses.
 */
public enum OrderType {
    CATALOG,
    POINT_TO_POINT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OrderType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_');
        for (OrderType type : values()) {
            if (type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + raw);
    }
}
