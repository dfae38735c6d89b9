package com.baladi.settlement.dto;

import com.baladi.settlement.entity.SettlementStatus;
import jakarta.validation.constraints.NotNull;

public record ReviewSettlementRequest(
        @NotNull SettlementStatus status,
        @NotNull Long adminId,
        String note
) {
}
