package com.baladi.order.entity;

import java.math.BigDecimal;

/**
 * Financial snapshot of an order, computed once at placement.
 *
 * <p>{@code platformCommission} may be negative (points and free delivery can
 * exceed the shop commission); it is kept as-is for weekly netting.</p>
 */
public record OrderPricing(
        BigDecimal subtotal,
        BigDecimal deliveryFee,
        boolean freeDelivery,
        int pointsUsed,
        BigDecimal pointsDiscount,
        BigDecimal total,
        BigDecimal shopCommission,
        BigDecimal platformCommission,
        BigDecimal riderEarnings,
        int pointsEarned
) {
}
