package com.dropline.orderservice.security;

import com.dropline.orderservice.model.ActorRole;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Authenticated caller of an order operation.
 * {@code vendorId} is set only for vendors and names the store they act for.
 */
@Value
@Builder
public class Actor {
    UUID userId;
    ActorRole role;
    UUID vendorId;

    public static Actor dispatcher() {
        return Actor.builder().role(ActorRole.DISPATCHER).build();
    }

    public boolean hasRole(ActorRole expected) {
        return role == expected;
    }

    /**
     * Identity used as sender/receiver of chat messages.
     */
    public UUID chatIdentity() {
        return role == ActorRole.VENDOR ? vendorId : userId;
    }
}
