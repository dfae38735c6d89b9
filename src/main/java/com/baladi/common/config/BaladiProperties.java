package com.baladi.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Marketplace tunables bound from the {@code baladi.*} namespace.
 */
@ConfigurationProperties(prefix = "baladi")
public record BaladiProperties(
        @DefaultValue Settlement settlement,
        @DefaultValue Points points,
        @DefaultValue Order order
) {

    /**
     * @param zone             fixed zone for Saturday-to-Friday week boundaries
     * @param closeLockWait    how long a close waits for the cluster-wide lock
     * @param closeLockLease   lease after which a crashed holder's lock expires
     */
    public record Settlement(
            @DefaultValue("Africa/Cairo") ZoneId zone,
            @DefaultValue("5s") Duration closeLockWait,
            @DefaultValue("120s") Duration closeLockLease
    ) {
    }

    /**
     * @param currencyPerPoint subtotal units needed to earn one point
     * @param referralBonus    points credited to a referrer
     */
    public record Points(
            @DefaultValue("100") int currencyPerPoint,
            @DefaultValue("2") int referralBonus
    ) {
    }

    public record Order(
            @DefaultValue("10.00") BigDecimal defaultDeliveryFee
    ) {
    }
}
