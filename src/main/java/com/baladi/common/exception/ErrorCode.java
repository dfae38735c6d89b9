package com.baladi.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every domain of the marketplace.
 *
 * <p>Each code pairs an HTTP status with the default message surfaced to
 * clients. Failures may override the message with a more specific one.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    CACHE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Local cache error"),
    ACTOR_NOT_ALLOWED(HttpStatus.FORBIDDEN, "Actor is not allowed to perform this action"),

    // Shop
    SHOP_NOT_FOUND(HttpStatus.NOT_FOUND, "Shop not found"),
    SHOP_CLOSED(HttpStatus.BAD_REQUEST, "Shop is currently closed"),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "Product not found"),
    PRODUCT_UNAVAILABLE(HttpStatus.BAD_REQUEST, "Product is not available"),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.CONFLICT, "Invalid order status transition"),
    STALE_ORDER_STATE(HttpStatus.CONFLICT, "Order was modified concurrently"),
    RIDER_ALREADY_ASSIGNED(HttpStatus.CONFLICT, "Order already has a rider"),

    // Cash custody
    CASH_OUT_OF_ORDER(HttpStatus.CONFLICT, "Cash custody milestone out of order"),

    // Points
    INSUFFICIENT_POINTS(HttpStatus.BAD_REQUEST, "Insufficient points balance"),
    POINTS_ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "Points account not found"),

    // Referral
    INVALID_REFERRAL_CODE(HttpStatus.BAD_REQUEST, "Invalid referral code"),
    SELF_REFERRAL(HttpStatus.CONFLICT, "You cannot use your own referral code"),
    REFERRAL_ALREADY_USED(HttpStatus.CONFLICT, "A referral code was already applied"),
    REFERRAL_NOT_FOUND(HttpStatus.NOT_FOUND, "Referral not found"),
    REFERRAL_NOT_PENDING(HttpStatus.CONFLICT, "Referral is no longer pending"),

    // Settlement
    PERIOD_NOT_FOUND(HttpStatus.NOT_FOUND, "Weekly period not found"),
    PERIOD_ALREADY_CLOSED(HttpStatus.CONFLICT, "Settlement already closed for this week"),
    NOTHING_TO_SETTLE(HttpStatus.CONFLICT, "No completed orders to settle for this week"),
    SETTLEMENT_IN_PROGRESS(HttpStatus.CONFLICT, "Another settlement close is in progress"),
    SETTLEMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Settlement not found"),
    INVALID_SETTLEMENT_STATUS(HttpStatus.CONFLICT, "Invalid settlement status transition"),
    PERIOD_NOT_SETTLEABLE(HttpStatus.CONFLICT, "Period still has unsettled records"),

    // Ads
    ADS_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Ads service unavailable");

    private final HttpStatus status;
    private final String message;
}
