package com.baladi.settlement.dto;

import jakarta.validation.constraints.NotNull;

public record CloseWeekRequest(
        @NotNull Long adminId,
        String note
) {
}
