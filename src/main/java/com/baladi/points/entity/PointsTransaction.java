package com.baladi.points.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Immutable ledger line. {@code points} is signed. */
@Entity
@Table(name = "points_transactions", indexes = {
        @Index(name = "idx_points_tx_customer_id", columnList = "customerId"),
        @Index(name = "idx_points_tx_order_type", columnList = "orderId, type")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PointsTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "points_transaction_seq")
    @SequenceGenerator(name = "points_transaction_seq", sequenceName = "points_transaction_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long customerId;

    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PointsTransactionType type;

    @Column(nullable = false)
    private int points;

    @Column(nullable = false)
    private int balanceAfter;

    private String description;

    @Column(nullable = false)
    private Instant createdAt;

    @Builder
    public PointsTransaction(Long customerId, Long orderId, PointsTransactionType type, int points,
                             int balanceAfter, String description, Instant createdAt) {
        this.customerId = customerId;
        this.orderId = orderId;
        this.type = type;
        this.points = points;
        this.balanceAfter = balanceAfter;
        this.description = description;
        this.createdAt = createdAt;
    }
}
