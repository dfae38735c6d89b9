package com.baladi.order.dto;

import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.OrderStatus;
import com.baladi.order.entity.OrderStatusHistory;

import java.time.Instant;

public record StatusHistoryResponse(
        OrderStatus fromStatus,
        OrderStatus toStatus,
        Long actorId,
        ActorRole actorRole,
        String note,
        Instant changedAt
) {
    public static StatusHistoryResponse from(OrderStatusHistory h) {
        return new StatusHistoryResponse(h.getFromStatus(), h.getToStatus(), h.getActorId(),
                h.getActorRole(), h.getNote(), h.getChangedAt());
    }
}
