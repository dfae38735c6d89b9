package com.baladi.order.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Hop in the physical cash chain: customer -> rider -> shop -> platform. */
@Getter
@RequiredArgsConstructor
public enum CashTransactionType {
    CUSTOMER_TO_RIDER("customer_to_rider"),
    RIDER_TO_SHOP("rider_to_shop"),
    SHOP_TO_ADMIN("shop_to_admin");

    @JsonValue
    private final String value;
}
