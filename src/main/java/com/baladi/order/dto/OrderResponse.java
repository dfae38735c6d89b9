package com.baladi.order.dto;

import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderItem;
import com.baladi.order.entity.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderResponse(
        Long id,
        String orderNumber,
        Long customerId,
        Long shopId,
        Long riderId,
        OrderStatus status,
        List<Item> items,
        BigDecimal subtotal,
        BigDecimal deliveryFee,
        boolean freeDelivery,
        int pointsUsed,
        BigDecimal pointsDiscount,
        BigDecimal total,
        BigDecimal shopCommission,
        BigDecimal platformCommission,
        BigDecimal riderEarnings,
        int pointsEarned,
        boolean cashCollected,
        boolean cashTransferredToShop,
        boolean shopConfirmedCash,
        Long weeklyPeriodId,
        Instant placedAt,
        Instant acceptedAt,
        Instant preparingAt,
        Instant pickedUpAt,
        Instant shopPaidAt,
        Instant completedAt,
        Instant cancelledAt
) {
    public record Item(Long productId, String productName, BigDecimal unitPrice, int quantity, BigDecimal subtotal) {
        static Item from(OrderItem item) {
            return new Item(item.getProductId(), item.getProductName(), item.getUnitPrice(),
                    item.getQuantity(), item.getSubtotal());
        }
    }

    public static OrderResponse from(Order o) {
        return new OrderResponse(o.getId(), o.getOrderNumber(), o.getCustomerId(), o.getShopId(), o.getRiderId(),
                o.getStatus(), o.getItems().stream().map(Item::from).toList(),
                o.getSubtotal(), o.getDeliveryFee(), o.isFreeDelivery(), o.getPointsUsed(), o.getPointsDiscount(),
                o.getTotal(), o.getShopCommission(), o.getPlatformCommission(), o.getRiderEarnings(),
                o.getPointsEarned(), o.isCashCollected(), o.isCashTransferredToShop(), o.isShopConfirmedCash(),
                o.getWeeklyPeriodId(), o.getPlacedAt(), o.getAcceptedAt(), o.getPreparingAt(), o.getPickedUpAt(),
                o.getShopPaidAt(), o.getCompletedAt(), o.getCancelledAt());
    }
}
