package com.baladi.settlement.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/** Deliveries, earnings and cash handled by one rider in one period. */
@Entity
@Table(name = "rider_settlements", uniqueConstraints = {
        @UniqueConstraint(name = "uk_rider_settlement_rider_period", columnNames = {"riderId", "periodId"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RiderSettlement extends SettlementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "rider_settlement_seq")
    @SequenceGenerator(name = "rider_settlement_seq", sequenceName = "rider_settlement_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long riderId;

    private int totalDeliveries;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal totalEarnings;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal cashHandled;

    @Builder
    public RiderSettlement(Long riderId, Long periodId, int totalDeliveries, BigDecimal totalEarnings,
                           BigDecimal cashHandled, Instant createdAt) {
        super(periodId, createdAt);
        this.riderId = riderId;
        this.totalDeliveries = totalDeliveries;
        this.totalEarnings = totalEarnings;
        this.cashHandled = cashHandled;
    }
}
