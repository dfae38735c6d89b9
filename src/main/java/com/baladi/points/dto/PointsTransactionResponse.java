package com.baladi.points.dto;

import com.baladi.points.entity.PointsTransaction;
import com.baladi.points.entity.PointsTransactionType;

import java.time.Instant;

public record PointsTransactionResponse(
        Long id,
        Long orderId,
        PointsTransactionType type,
        int points,
        int balanceAfter,
        String description,
        Instant createdAt
) {
    public static PointsTransactionResponse from(PointsTransaction tx) {
        return new PointsTransactionResponse(tx.getId(), tx.getOrderId(), tx.getType(), tx.getPoints(),
                tx.getBalanceAfter(), tx.getDescription(), tx.getCreatedAt());
    }
}
