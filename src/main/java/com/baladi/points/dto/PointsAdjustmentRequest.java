package com.baladi.points.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PointsAdjustmentRequest(
        @NotNull Integer delta,
        @NotBlank String reason
) {
}
