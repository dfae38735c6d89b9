package com.baladi.referral.dto;

import com.baladi.referral.entity.Referral;
import com.baladi.referral.entity.ReferralStatus;

import java.time.Instant;

public record ReferralResponse(
        Long id,
        Long referrerId,
        Long referredId,
        Long firstOrderId,
        boolean pointsAwarded,
        ReferralStatus status,
        Instant createdAt,
        Instant completedAt
) {
    public static ReferralResponse from(Referral referral) {
        return new ReferralResponse(referral.getId(), referral.getReferrerId(), referral.getReferredId(),
                referral.getFirstOrderId(), referral.isPointsAwarded(), referral.getStatus(),
                referral.getCreatedAt(), referral.getCompletedAt());
    }
}
