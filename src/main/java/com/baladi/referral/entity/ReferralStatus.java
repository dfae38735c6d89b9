package com.baladi.referral.entity;

/**
 * PENDING -> COMPLETED (once, on the referred customer's first completed order)
 * or PENDING -> EXPIRED (admin). Both targets are terminal; an expired referral is never paid.
 */
public enum ReferralStatus {
    PENDING,
    COMPLETED,
    EXPIRED
}
