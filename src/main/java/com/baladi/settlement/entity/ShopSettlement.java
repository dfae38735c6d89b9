package com.baladi.settlement.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What one shop earned and owes for one period.
 *
 * <ul>
 *   <li>netPayout = grossSales - totalCommission + pointsDiscountCredit - adsCost</li>
 *   <li>amountOwedToPlatform = totalCommission + adsCost - pointsDiscountCredit</li>
 * </ul>
 * Points discounts are credited back to the shop; the platform funds them.
 */
@Entity
@Table(name = "shop_settlements", uniqueConstraints = {
        @UniqueConstraint(name = "uk_shop_settlement_shop_period", columnNames = {"shopId", "periodId"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShopSettlement extends SettlementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "shop_settlement_seq")
    @SequenceGenerator(name = "shop_settlement_seq", sequenceName = "shop_settlement_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long shopId;

    private int totalOrders;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal grossSales;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal totalCommission;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal pointsDiscountCredit;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal freeDeliveryCost;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal adsCost;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal netPayout;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amountOwedToPlatform;

    @Builder
    public ShopSettlement(Long shopId, Long periodId, int totalOrders, BigDecimal grossSales,
                          BigDecimal totalCommission, BigDecimal pointsDiscountCredit,
                          BigDecimal freeDeliveryCost, BigDecimal adsCost, Instant createdAt) {
        super(periodId, createdAt);
        this.shopId = shopId;
        this.totalOrders = totalOrders;
        this.grossSales = grossSales;
        this.totalCommission = totalCommission;
        this.pointsDiscountCredit = pointsDiscountCredit;
        this.freeDeliveryCost = freeDeliveryCost;
        this.adsCost = adsCost;
        this.netPayout = grossSales.subtract(totalCommission).add(pointsDiscountCredit).subtract(adsCost);
        this.amountOwedToPlatform = totalCommission.add(adsCost).subtract(pointsDiscountCredit);
    }
}
