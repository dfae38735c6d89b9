package com.baladi.points.dto;

import com.baladi.points.entity.PointsAccount;

public record PointsBalanceResponse(Long customerId, int balance, String referralCode) {

    public static PointsBalanceResponse from(PointsAccount account) {
        return new PointsBalanceResponse(account.getCustomerId(), account.getBalance(), account.getReferralCode());
    }
}
