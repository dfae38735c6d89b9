package com.baladi.referral.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ApplyReferralRequest(
        @NotNull Long customerId,
        @NotBlank String code
) {
}
