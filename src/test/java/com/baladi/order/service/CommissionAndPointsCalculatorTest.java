package com.baladi.order.service;

import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.OrderPricing;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static com.baladi.support.Fixtures.money;
import static org.assertj.core.api.Assertions.assertThat;

class CommissionAndPointsCalculatorTest {

    private final CommissionAndPointsCalculator calculator =
            new CommissionAndPointsCalculator(Fixtures.properties());

    @ParameterizedTest
    @CsvSource({
            "350, 3",
            "99, 0",
            "0, 0",
            "100, 1",
            "199.99, 1",
            "1000, 10"
    })
    @DisplayName("points earned are floor(subtotal / 100)")
    void pointsEarnedTruncate(String subtotal, int expected) {
        assertThat(calculator.pointsEarned(new BigDecimal(subtotal))).isEqualTo(expected);
    }

    @Test
    @DisplayName("worked example: 200 subtotal, 15 fee, 10%, 5 points")
    void workedExample() {
        OrderPricing pricing = calculator.calculate(money("200"), money("15"), money("0.10"), 5, 40, false)
                .getOrThrow();

        assertThat(pricing.shopCommission()).isEqualByComparingTo("20");
        assertThat(pricing.pointsDiscount()).isEqualByComparingTo("5");
        assertThat(pricing.platformCommission()).isEqualByComparingTo("15");
        assertThat(pricing.riderEarnings()).isEqualByComparingTo("15");
        assertThat(pricing.total()).isEqualByComparingTo("210");
        assertThat(pricing.pointsUsed()).isEqualTo(5);
        assertThat(pricing.pointsEarned()).isEqualTo(2);
    }

    @Test
    @DisplayName("free delivery: rider earns nothing, platform absorbs the fee and may go negative")
    void freeDeliveryCanMakePlatformCommissionNegative() {
        OrderPricing pricing = calculator.calculate(money("50"), money("15"), money("0.10"), 3, 3, true)
                .getOrThrow();

        assertThat(pricing.riderEarnings()).isEqualByComparingTo("0");
        assertThat(pricing.deliveryFee()).isEqualByComparingTo("15");
        // 5 - 3 - 15
        assertThat(pricing.platformCommission()).isEqualByComparingTo("-13");
        assertThat(pricing.total()).isEqualByComparingTo("47");
    }

    @Test
    @DisplayName("redeeming more points than the balance is clamped to the balance")
    void redeemingAboveBalanceIsClamped() {
        OrderPricing pricing = calculator.calculate(money("200"), money("15"), money("0.10"), 50, 40, false)
                .getOrThrow();

        assertThat(pricing.pointsUsed()).isEqualTo(40);
        assertThat(pricing.pointsDiscount()).isEqualByComparingTo("40");
        // 20 - 40
        assertThat(pricing.platformCommission()).isEqualByComparingTo("-20");
        assertThat(pricing.total()).isEqualByComparingTo("175");
    }

    @Test
    @DisplayName("the points discount never exceeds the subtotal")
    void discountCappedBySubtotal() {
        OrderPricing pricing = calculator.calculate(money("30.50"), money("10"), money("0.10"), 80, 80, false)
                .getOrThrow();

        assertThat(pricing.pointsUsed()).isEqualTo(30);
        assertThat(pricing.pointsDiscount()).isEqualByComparingTo("30");
        assertThat(pricing.total()).isEqualByComparingTo("10.50");
    }

    @Test
    @DisplayName("a commission rate above 100% is rejected")
    void invalidCommissionRate() {
        Result<OrderPricing> result = calculator.calculate(money("100"), money("10"), money("1.5"), 0, 0, false);

        assertThat(result.failure()).isInstanceOf(Failure.ValidationFailure.class);
    }

    @Test
    @DisplayName("money is kept at two decimals")
    void moneyScale() {
        OrderPricing pricing = calculator.calculate(money("33.33"), money("7.5"), money("0.125"), 0, 0, false)
                .getOrThrow();

        assertThat(pricing.shopCommission()).isEqualTo(money("4.17"));
        assertThat(pricing.total()).isEqualTo(money("40.83"));
    }
}
