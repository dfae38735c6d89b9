package com.baladi.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Append-only audit row for one status transition. */
@Entity
@Table(name = "order_status_history", indexes = {
        @Index(name = "idx_status_history_order_id", columnList = "orderId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderStatusHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_status_history_seq")
    @SequenceGenerator(name = "order_status_history_seq", sequenceName = "order_status_history_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus toStatus;

    @Column(nullable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActorRole actorRole;

    private String note;

    @Column(nullable = false)
    private Instant changedAt;

    @Builder
    public OrderStatusHistory(Long orderId, OrderStatus fromStatus, OrderStatus toStatus,
                              Long actorId, ActorRole actorRole, String note, Instant changedAt) {
        this.orderId = orderId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.actorId = actorId;
        this.actorRole = actorRole;
        this.note = note;
        this.changedAt = changedAt;
    }
}
