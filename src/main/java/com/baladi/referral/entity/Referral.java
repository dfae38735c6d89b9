package com.baladi.referral.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Link between a referrer and the customer who used their code.
 * One referral per referred customer, enforced by a unique constraint.
 */
@Entity
@Table(name = "referrals", uniqueConstraints = {
        @UniqueConstraint(name = "uk_referral_referred_id", columnNames = "referredId")
}, indexes = {
        @Index(name = "idx_referral_referrer_id", columnList = "referrerId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Referral {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "referral_seq")
    @SequenceGenerator(name = "referral_seq", sequenceName = "referral_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private Long referrerId;

    @Column(nullable = false)
    private Long referredId;

    @Column(nullable = false, length = 16)
    private String referralCode;

    private Long firstOrderId;

    private boolean pointsAwarded;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReferralStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant completedAt;

    private Instant expiredAt;

    @Builder
    public Referral(Long referrerId, Long referredId, String referralCode, Instant createdAt) {
        this.referrerId = referrerId;
        this.referredId = referredId;
        this.referralCode = referralCode;
        this.createdAt = createdAt;
        this.status = ReferralStatus.PENDING;
    }

    public boolean isPending() {
        return status == ReferralStatus.PENDING;
    }

    public void complete(Long firstOrderId, Instant at) {
        if (!isPending()) {
            throw new IllegalStateException("Referral is not pending: referralId=" + id);
        }
        this.firstOrderId = firstOrderId;
        this.pointsAwarded = true;
        this.status = ReferralStatus.COMPLETED;
        this.completedAt = at;
    }

    public void expire(Instant at) {
        if (!isPending()) {
            throw new IllegalStateException("Referral is not pending: referralId=" + id);
        }
        this.status = ReferralStatus.EXPIRED;
        this.expiredAt = at;
    }
}
