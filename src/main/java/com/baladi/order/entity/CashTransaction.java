package com.baladi.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Auditable record of cash changing hands.
 *
 * <p>{@code orderId} is null for {@link CashTransactionType#SHOP_TO_ADMIN}, which is
 * raised per shop and period at settlement close ({@code periodId} set instead).</p>
 */
@Entity
@Table(name = "cash_transactions", indexes = {
        @Index(name = "idx_cash_tx_order_id", columnList = "orderId"),
        @Index(name = "idx_cash_tx_period_id", columnList = "periodId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CashTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "cash_transaction_seq")
    @SequenceGenerator(name = "cash_transaction_seq", sequenceName = "cash_transaction_seq", allocationSize = 50)
    private Long id;

    private Long orderId;

    private Long periodId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CashTransactionType type;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    private Long fromPartyId;
    private Long toPartyId;

    private Instant confirmedAt;
    private Long confirmedBy;

    @Column(nullable = false)
    private Instant createdAt;

    @Builder
    public CashTransaction(Long orderId, Long periodId, CashTransactionType type, BigDecimal amount,
                           Long fromPartyId, Long toPartyId, Instant confirmedAt, Long confirmedBy,
                           Instant createdAt) {
        this.orderId = orderId;
        this.periodId = periodId;
        this.type = type;
        this.amount = amount;
        this.fromPartyId = fromPartyId;
        this.toPartyId = toPartyId;
        this.confirmedAt = confirmedAt;
        this.confirmedBy = confirmedBy;
        this.createdAt = createdAt;
    }

    public void confirm(Long confirmedBy, Instant at) {
        if (this.confirmedAt == null) {
            this.confirmedBy = confirmedBy;
            this.confirmedAt = at;
        }
    }

    public boolean isConfirmed() {
        return confirmedAt != null;
    }
}
