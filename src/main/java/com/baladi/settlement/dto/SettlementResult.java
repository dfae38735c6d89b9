package com.baladi.settlement.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of a weekly close, for reporting and notifications.
 *
 * @param storePointsCredits points discount credited back to each shop, keyed by shop id
 */
public record SettlementResult(
        Long periodId,
        int ordersProcessed,
        int shopsSettled,
        int ridersSettled,
        BigDecimal totalPointsRedeemedValue,
        Map<Long, BigDecimal> storePointsCredits,
        BigDecimal adminNetCommission
) {
}
