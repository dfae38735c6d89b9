package com.baladi.order.dto;

import com.baladi.order.entity.CashTransaction;
import com.baladi.order.entity.CashTransactionType;

import java.math.BigDecimal;
import java.time.Instant;

public record CashTransactionResponse(
        Long id,
        Long orderId,
        Long periodId,
        CashTransactionType type,
        BigDecimal amount,
        Long fromPartyId,
        Long toPartyId,
        Instant confirmedAt,
        Instant createdAt
) {
    public static CashTransactionResponse from(CashTransaction tx) {
        return new CashTransactionResponse(tx.getId(), tx.getOrderId(), tx.getPeriodId(), tx.getType(),
                tx.getAmount(), tx.getFromPartyId(), tx.getToPartyId(), tx.getConfirmedAt(), tx.getCreatedAt());
    }
}
