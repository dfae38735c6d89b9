package com.baladi.settlement.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Platform totals of a closed period, stored so reports never recompute them.
 * {@code adminNetCommission} may be negative.
 */
@Entity
@Table(name = "period_summaries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_period_summary_period", columnNames = "periodId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class PeriodSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "period_summary_seq")
    @SequenceGenerator(name = "period_summary_seq", sequenceName = "period_summary_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long periodId;

    private int totalOrders;
    private int completedOrders;
    private int cancelledOrders;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal grossSales;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal totalDeliveryFees;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal totalShopCommissions;

    private int totalPointsRedeemed;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal pointsDiscountValue;

    private int freeDeliveryOrders;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal freeDeliveryCost;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAdsRevenue;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal adminNetCommission;

    @Column(nullable = false)
    private Instant createdAt;
}
