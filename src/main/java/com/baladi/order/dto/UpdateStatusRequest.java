package com.baladi.order.dto;

import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateStatusRequest(
        @NotNull OrderStatus status,
        @NotNull Long actorId,
        @NotNull ActorRole actorRole,
        String note
) {
}
