package com.baladi.settlement.dto;

import com.baladi.settlement.entity.*;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Weekly settlement report. Key names are consumed by external reporting
 * and must stay exactly as declared here.
 */
public record SettlementReport(
        @JsonProperty("weekly_period") Period weeklyPeriod,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("shop_settlements") List<Shop> shopSettlements,
        @JsonProperty("rider_settlements") List<Rider> riderSettlements
) {

    public record Period(
            @JsonProperty("id") Long id,
            @JsonProperty("year") int year,
            @JsonProperty("week_number") int weekNumber,
            @JsonProperty("start_date") Instant startDate,
            @JsonProperty("end_date") Instant endDate,
            @JsonProperty("status") PeriodStatus status,
            @JsonProperty("closed_by") Long closedBy,
            @JsonProperty("closed_at") Instant closedAt
    ) {
        public static Period from(WeeklyPeriod p) {
            return new Period(p.getId(), p.getYear(), p.getWeekNumber(), p.getStartsAt(), p.getEndsAt(),
                    p.getStatus(), p.getClosedBy(), p.getClosedAt());
        }
    }

    public record Summary(
            @JsonProperty("total_orders") int totalOrders,
            @JsonProperty("completed_orders") int completedOrders,
            @JsonProperty("cancelled_orders") int cancelledOrders,
            @JsonProperty("gross_sales") BigDecimal grossSales,
            @JsonProperty("total_delivery_fees") BigDecimal totalDeliveryFees,
            @JsonProperty("total_shop_commissions") BigDecimal totalShopCommissions,
            @JsonProperty("total_points_redeemed") int totalPointsRedeemed,
            @JsonProperty("points_discount_value") BigDecimal pointsDiscountValue,
            @JsonProperty("free_delivery_orders") int freeDeliveryOrders,
            @JsonProperty("free_delivery_cost") BigDecimal freeDeliveryCost,
            @JsonProperty("total_ads_revenue") BigDecimal totalAdsRevenue,
            @JsonProperty("admin_net_commission") BigDecimal adminNetCommission
    ) {
        public static Summary from(PeriodSummary s) {
            return new Summary(s.getTotalOrders(), s.getCompletedOrders(), s.getCancelledOrders(),
                    s.getGrossSales(), s.getTotalDeliveryFees(), s.getTotalShopCommissions(),
                    s.getTotalPointsRedeemed(), s.getPointsDiscountValue(), s.getFreeDeliveryOrders(),
                    s.getFreeDeliveryCost(), s.getTotalAdsRevenue(), s.getAdminNetCommission());
        }
    }

    public record Shop(
            @JsonProperty("id") Long id,
            @JsonProperty("shop_id") Long shopId,
            @JsonProperty("total_orders") int totalOrders,
            @JsonProperty("gross_sales") BigDecimal grossSales,
            @JsonProperty("total_commission") BigDecimal totalCommission,
            @JsonProperty("points_discount_credit") BigDecimal pointsDiscountCredit,
            @JsonProperty("free_delivery_cost") BigDecimal freeDeliveryCost,
            @JsonProperty("ads_cost") BigDecimal adsCost,
            @JsonProperty("net_payout") BigDecimal netPayout,
            @JsonProperty("amount_owed_to_platform") BigDecimal amountOwedToPlatform,
            @JsonProperty("status") SettlementStatus status,
            @JsonProperty("notes") String notes
    ) {
        public static Shop from(ShopSettlement s) {
            return new Shop(s.getId(), s.getShopId(), s.getTotalOrders(), s.getGrossSales(),
                    s.getTotalCommission(), s.getPointsDiscountCredit(), s.getFreeDeliveryCost(), s.getAdsCost(),
                    s.getNetPayout(), s.getAmountOwedToPlatform(), s.getStatus(), s.getNotes());
        }
    }

    public record Rider(
            @JsonProperty("id") Long id,
            @JsonProperty("rider_id") Long riderId,
            @JsonProperty("total_deliveries") int totalDeliveries,
            @JsonProperty("total_earnings") BigDecimal totalEarnings,
            @JsonProperty("cash_handled") BigDecimal cashHandled,
            @JsonProperty("status") SettlementStatus status,
            @JsonProperty("notes") String notes
    ) {
        public static Rider from(RiderSettlement s) {
            return new Rider(s.getId(), s.getRiderId(), s.getTotalDeliveries(), s.getTotalEarnings(),
                    s.getCashHandled(), s.getStatus(), s.getNotes());
        }
    }
}
