package com.baladi.order.service;

import com.baladi.common.config.BaladiProperties;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.OrderPricing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure pricing rules, applied once when an order is placed.
 *
 * <ul>
 *   <li>pointsEarned = floor(subtotal / currencyPerPoint)</li>
 *   <li>shopCommission = subtotal x commissionRate</li>
 *   <li>pointsDiscount = pointsUsed (1 point = 1 currency unit), capped by balance and subtotal</li>
 *   <li>platformCommission = shopCommission - pointsDiscount - (free ? deliveryFee : 0), never clamped</li>
 *   <li>riderEarnings = free ? 0 : deliveryFee</li>
 *   <li>total = subtotal + (free ? 0 : deliveryFee) - pointsDiscount</li>
 * </ul>
 */
@Component
public class CommissionAndPointsCalculator {

    private static final int MONEY_SCALE = 2;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(MONEY_SCALE);

    private final BigDecimal currencyPerPoint;

    public CommissionAndPointsCalculator(BaladiProperties properties) {
        this.currencyPerPoint = BigDecimal.valueOf(properties.points().currencyPerPoint());
    }

    public Result<OrderPricing> calculate(BigDecimal subtotal, BigDecimal deliveryFee, BigDecimal commissionRate,
                                          int pointsRequested, int pointsBalance, boolean freeDelivery) {
        if (subtotal == null || subtotal.signum() < 0) {
            return Result.failure(Failure.validation("Subtotal must be zero or positive"));
        }
        if (deliveryFee == null || deliveryFee.signum() < 0) {
            return Result.failure(Failure.validation("Delivery fee must be zero or positive"));
        }
        if (commissionRate == null || commissionRate.signum() < 0 || commissionRate.compareTo(BigDecimal.ONE) > 0) {
            return Result.failure(Failure.validation("Commission rate must be between 0 and 1"));
        }
        if (pointsRequested < 0) {
            return Result.failure(Failure.validation("Points to redeem must be zero or positive"));
        }
        int pointsUsed = pointsUsed(pointsRequested, pointsBalance, subtotal);
        BigDecimal pointsDiscount = money(BigDecimal.valueOf(pointsUsed));
        BigDecimal fee = money(deliveryFee);
        BigDecimal shopCommission = money(subtotal.multiply(commissionRate));
        BigDecimal absorbedDelivery = freeDelivery ? fee : ZERO;

        BigDecimal platformCommission = shopCommission.subtract(pointsDiscount).subtract(absorbedDelivery);
        BigDecimal riderEarnings = freeDelivery ? ZERO : fee;
        BigDecimal total = money(subtotal).add(freeDelivery ? ZERO : fee).subtract(pointsDiscount);

        return Result.success(new OrderPricing(
                money(subtotal), fee, freeDelivery, pointsUsed, pointsDiscount, total,
                shopCommission, platformCommission, riderEarnings, pointsEarned(subtotal)));
    }

    /** Truncates, never rounds: 350 -> 3, 99 -> 0. */
    public int pointsEarned(BigDecimal subtotal) {
        if (subtotal == null || subtotal.signum() <= 0) {
            return 0;
        }
        return subtotal.divide(currencyPerPoint, 0, RoundingMode.FLOOR).intValueExact();
    }

    /** A request above the balance or the subtotal is clamped, never rejected. */
    public int pointsUsed(int requested, int balance, BigDecimal subtotal) {
        int subtotalCap = subtotal.setScale(0, RoundingMode.FLOOR).intValue();
        return Math.max(0, Math.min(requested, Math.min(balance, subtotalCap)));
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
