package com.baladi.order.entity;

/**
 * Order lifecycle.
 *
 * <pre>
 * PENDING -> ACCEPTED -> PREPARING -> PICKED_UP -> SHOP_PAID -> COMPLETED
 *    |          |
 *    +----------+--> CANCELLED
 * </pre>
 *
 * <ul>
 *   <li>PENDING: placed, waiting for the shop</li>
 *   <li>ACCEPTED: shop accepted</li>
 *   <li>PREPARING: shop is preparing</li>
 *   <li>PICKED_UP: rider left the shop with the order</li>
 *   <li>SHOP_PAID: rider delivered and handed the cash to the shop</li>
 *   <li>COMPLETED: shop confirmed the cash, terminal</li>
 *   <li>CANCELLED: terminal</li>
 * </ul>
 */
public enum OrderStatus {
    PENDING,
    ACCEPTED,
    PREPARING,
    PICKED_UP,
    SHOP_PAID,
    COMPLETED,
    CANCELLED;

    /** The single forward step from this status, or {@code null} for terminal ones. */
    public OrderStatus next() {
        return switch (this) {
            case PENDING -> ACCEPTED;
            case ACCEPTED -> PREPARING;
            case PREPARING -> PICKED_UP;
            case PICKED_UP -> SHOP_PAID;
            case SHOP_PAID -> COMPLETED;
            case COMPLETED, CANCELLED -> null;
        };
    }

    public boolean isCancellable() {
        return switch (this) {
            case PENDING, ACCEPTED -> true;
            case PREPARING, PICKED_UP, SHOP_PAID, COMPLETED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
