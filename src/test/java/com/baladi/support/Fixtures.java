package com.baladi.support;

import com.baladi.common.config.BaladiProperties;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderPricing;
import com.baladi.order.entity.OrderStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Shared test data. Time is pinned to Wednesday 2024-01-10 12:00 in Cairo (UTC+2). */
public final class Fixtures {

    public static final ZoneId CAIRO = ZoneId.of("Africa/Cairo");
    public static final Instant NOW = Instant.parse("2024-01-10T10:00:00Z");

    /** Saturday 2024-01-06 00:00 Cairo. */
    public static final Instant WEEK_START = Instant.parse("2024-01-05T22:00:00Z");
    /** Saturday 2024-01-13 00:00 Cairo. */
    public static final Instant NEXT_WEEK_START = Instant.parse("2024-01-12T22:00:00Z");

    private Fixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static BaladiProperties properties() {
        return new BaladiProperties(
                new BaladiProperties.Settlement(CAIRO, Duration.ofSeconds(5), Duration.ofSeconds(120)),
                new BaladiProperties.Points(100, 2),
                new BaladiProperties.Order(new BigDecimal("10.00")));
    }

    public static BigDecimal money(String value) {
        return new BigDecimal(value);
    }

    /** Subtotal 200, fee 15, 10% commission, 5 points redeemed, paid delivery. */
    public static OrderPricing standardPricing() {
        return new OrderPricing(money("200.00"), money("15.00"), false, 5, money("5.00"), money("210.00"),
                money("20.00"), money("15.00"), money("15.00"), 2);
    }

    public static Order order(Long id, OrderStatus status) {
        return order(id, status, standardPricing());
    }

    public static Order order(Long id, OrderStatus status, OrderPricing pricing) {
        return Order.builder()
                .id(id)
                .orderNumber("BLD-20240110-" + String.format("%06d", id))
                .customerId(100L)
                .shopId(10L)
                .riderId(status == OrderStatus.PENDING || status == OrderStatus.ACCEPTED ? null : 7L)
                .status(status)
                .pricing(pricing)
                .placedAt(NOW)
                .build();
    }
}
