package com.baladi.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Order aggregate root.
 *
 * <h3>Design points</h3>
 * <ul>
 *   <li>Financial fields are a frozen {@link OrderPricing} snapshot. The only later
 *       change is {@link #clearEarningsOnCancel()}, which zeroes derived earnings.</li>
 *   <li>No setters. State moves through intention-revealing methods; each lifecycle
 *       timestamp is written once and never overwritten.</li>
 *   <li>{@code @Version} optimistic lock plus a pessimistic row lock in
 *       {@code OrderRepository.findForUpdateById} serialize concurrent actors.</li>
 *   <li>Cash custody flags only move forward:
 *       collected -> transferred to shop -> confirmed by shop.</li>
 * </ul>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_customer_id", columnList = "customerId"),
        @Index(name = "idx_order_shop_id", columnList = "shopId"),
        @Index(name = "idx_order_status_placed", columnList = "status, placedAt"),
        @Index(name = "idx_order_placed_at", columnList = "placedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    private static final BigDecimal ZERO = new BigDecimal("0.00");

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private String orderNumber;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private Long shopId;

    private Long riderId;       // null until a rider takes the order

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    private String deliveryAddress;

    // Financial snapshot
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee;

    private boolean freeDelivery;

    private int pointsUsed;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal pointsDiscount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal shopCommission;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal platformCommission;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal riderEarnings;

    private int pointsEarned;

    // Cash custody
    private boolean cashCollected;
    private boolean cashTransferredToShop;
    private boolean shopConfirmedCash;
    private Instant cashCollectedAt;
    private Instant cashTransferredAt;
    private Instant shopConfirmedCashAt;

    private Long weeklyPeriodId;    // set by the weekly close that settles it

    // Lifecycle timestamps
    @Column(nullable = false)
    private Instant placedAt;
    private Instant acceptedAt;
    private Instant preparingAt;
    private Instant pickedUpAt;
    private Instant shopPaidAt;
    private Instant completedAt;
    private Instant cancelledAt;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Builder
    public Order(Long id, String orderNumber, Long customerId, Long shopId, Long riderId,
                 String deliveryAddress, OrderStatus status, OrderPricing pricing, Instant placedAt) {
        this.id = id;
        this.orderNumber = orderNumber;
        this.customerId = customerId;
        this.shopId = shopId;
        this.riderId = riderId;
        this.deliveryAddress = deliveryAddress;
        this.status = status != null ? status : OrderStatus.PENDING;
        this.placedAt = placedAt;
        this.subtotal = pricing.subtotal();
        this.deliveryFee = pricing.deliveryFee();
        this.freeDelivery = pricing.freeDelivery();
        this.pointsUsed = pricing.pointsUsed();
        this.pointsDiscount = pricing.pointsDiscount();
        this.total = pricing.total();
        this.shopCommission = pricing.shopCommission();
        this.platformCommission = pricing.platformCommission();
        this.riderEarnings = pricing.riderEarnings();
        this.pointsEarned = pricing.pointsEarned();
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    /**
     * Moves to {@code newStatus} and stamps its timestamp.
     * Callers validate the transition first (see {@code OrderStatusStateMachine}).
     */
    public void moveTo(OrderStatus newStatus, Instant at) {
        switch (newStatus) {
            case ACCEPTED -> acceptedAt = stampOnce(acceptedAt, at);
            case PREPARING -> preparingAt = stampOnce(preparingAt, at);
            case PICKED_UP -> pickedUpAt = stampOnce(pickedUpAt, at);
            case SHOP_PAID -> shopPaidAt = stampOnce(shopPaidAt, at);
            case COMPLETED -> completedAt = stampOnce(completedAt, at);
            case CANCELLED -> cancelledAt = stampOnce(cancelledAt, at);
            case PENDING -> throw new IllegalStateException("Orders never move back to PENDING");
        }
        this.status = newStatus;
    }

    public void assignRider(Long riderId) {
        if (this.riderId != null) {
            throw new IllegalStateException("Rider already assigned: orderId=" + id);
        }
        this.riderId = riderId;
    }

    public void markCashCollected(Instant at) {
        this.cashCollected = true;
        this.cashCollectedAt = stampOnce(cashCollectedAt, at);
    }

    public void markCashTransferredToShop(Instant at) {
        if (!cashCollected) {
            throw new IllegalStateException("Cash not collected yet: orderId=" + id);
        }
        this.cashTransferredToShop = true;
        this.cashTransferredAt = stampOnce(cashTransferredAt, at);
    }

    public void markShopConfirmedCash(Instant at) {
        if (!cashTransferredToShop) {
            throw new IllegalStateException("Cash not transferred yet: orderId=" + id);
        }
        this.shopConfirmedCash = true;
        this.shopConfirmedCashAt = stampOnce(shopConfirmedCashAt, at);
    }

    /** Cancellation voids every derived earning; the customer-facing amounts stay for the record. */
    public void clearEarningsOnCancel() {
        this.shopCommission = ZERO;
        this.platformCommission = ZERO;
        this.riderEarnings = ZERO;
        this.pointsEarned = 0;
    }

    public void assignToPeriod(Long periodId) {
        if (this.weeklyPeriodId == null) {
            this.weeklyPeriodId = periodId;
        }
    }

    public boolean isAssignedTo(Long riderId) {
        return this.riderId != null && this.riderId.equals(riderId);
    }

    private static Instant stampOnce(Instant current, Instant at) {
        return current != null ? current : at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
