package com.baladi.referral.controller;

import com.baladi.common.dto.ApiResponse;
import com.baladi.referral.dto.ApplyReferralRequest;
import com.baladi.referral.dto.ReferralResponse;
import com.baladi.referral.service.ReferralBonusEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/referrals")
@RequiredArgsConstructor
public class ReferralController {

    private final ReferralBonusEngine referralBonusEngine;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ReferralResponse> apply(@Valid @RequestBody ApplyReferralRequest request) {
        return ApiResponse.ok(referralBonusEngine.applyReferralCode(request.customerId(), request.code())
                .map(ReferralResponse::from)
                .getOrThrow());
    }

    @PostMapping("/{referralId}/expire")
    public ApiResponse<ReferralResponse> expire(@PathVariable Long referralId) {
        return ApiResponse.ok(referralBonusEngine.expireReferral(referralId)
                .map(ReferralResponse::from)
                .getOrThrow());
    }

    @GetMapping("/referrer/{referrerId}")
    public ApiResponse<List<ReferralResponse>> getByReferrer(@PathVariable Long referrerId) {
        return ApiResponse.ok(referralBonusEngine.getReferralsBy(referrerId).stream()
                .map(ReferralResponse::from)
                .toList());
    }
}
