package com.baladi.points.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Running points balance of one customer.
 *
 * <p>The balance is a cache of the ledger: it always equals the sum of the
 * customer's {@link PointsTransaction} deltas and never drops below zero.</p>
 */
@Entity
@Table(name = "points_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PointsAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "points_account_seq")
    @SequenceGenerator(name = "points_account_seq", sequenceName = "points_account_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private Long customerId;

    @Column(nullable = false)
    private int balance;

    @Column(nullable = false, unique = true, length = 16)
    private String referralCode;

    @Builder
    public PointsAccount(Long customerId, int balance, String referralCode) {
        this.customerId = customerId;
        this.balance = balance;
        this.referralCode = referralCode;
    }

    public boolean canApply(int delta) {
        return balance + delta >= 0;
    }

    /** Returns the new balance. */
    public int apply(int delta) {
        if (!canApply(delta)) {
            throw new IllegalStateException("Points balance would become negative: customerId=" + customerId);
        }
        this.balance += delta;
        return balance;
    }
}
