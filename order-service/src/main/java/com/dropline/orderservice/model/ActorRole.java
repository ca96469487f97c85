package com.dropline.orderservice.model;

public enum ActorRole {
    CUSTOMER,
    VENDOR,
    DELIVERY_AGENT,
    ADMIN,
    // service account of the dispatcher, may only attach delivery agents
    DISPATCHER
}
