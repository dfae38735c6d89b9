package com.baladi.points.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PointsTransactionType {
    EARNED("earned"),
    REDEEMED("redeemed"),
    REFERRAL_BONUS("referral_bonus"),
    ADJUSTMENT("adjustment");

    @JsonValue
    private final String value;
}
