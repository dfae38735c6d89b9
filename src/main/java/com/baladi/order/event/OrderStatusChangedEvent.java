package com.baladi.order.event;

import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.OrderStatus;

import java.time.Instant;

/** Published after every status transition, inside the order's transaction. */
public record OrderStatusChangedEvent(
        Long orderId,
        Long customerId,
        Long shopId,
        Long riderId,
        OrderStatus from,
        OrderStatus to,
        ActorRole actorRole,
        Instant changedAt
) {
}
