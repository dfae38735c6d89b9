package com.baladi.order.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PlaceOrderRequest(
        @NotNull Long customerId,
        @NotNull Long shopId,
        @NotNull @Size(min = 1, max = 50) @Valid List<Item> items,
        @PositiveOrZero int pointsToRedeem,
        boolean freeDelivery,
        String deliveryAddress
) {
    public record Item(
            @NotNull Long productId,
            @Positive int quantity
    ) {
    }
}
