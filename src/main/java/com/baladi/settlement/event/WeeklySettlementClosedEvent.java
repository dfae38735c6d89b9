package com.baladi.settlement.event;

import java.time.Instant;

public record WeeklySettlementClosedEvent(
        Long periodId,
        Long closedBy,
        int ordersProcessed,
        int shopsSettled,
        int ridersSettled,
        Instant closedAt
) {
}
