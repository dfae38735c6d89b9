package com.baladi.order.entity;

/** Who is acting on an order. */
public enum ActorRole {
    CUSTOMER,
    SHOP,
    RIDER,
    ADMIN
}
