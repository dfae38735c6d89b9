package com.baladi.settlement.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Review state shared by shop and rider settlements.
 * Amounts are written once by the weekly close; only these fields change afterwards.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SettlementRecord {

    @Version
    private Long version;

    @Column(nullable = false)
    private Long periodId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SettlementStatus status = SettlementStatus.PENDING;

    @Column(length = 1000)
    private String notes;

    private Long reviewedBy;
    private Instant reviewedAt;
    private Instant settledAt;

    @Column(nullable = false)
    private Instant createdAt;

    protected SettlementRecord(Long periodId, Instant createdAt) {
        this.periodId = periodId;
        this.createdAt = createdAt;
    }

    public abstract Long getId();

    public void moveTo(SettlementStatus target, Long adminId, String note, Instant at) {
        if (!status.canMoveTo(target)) {
            throw new IllegalStateException("Cannot move settlement from " + status + " to " + target);
        }
        this.status = target;
        this.reviewedBy = adminId;
        this.reviewedAt = at;
        if (note != null && !note.isBlank()) {
            this.notes = note;
        }
        if (target == SettlementStatus.SETTLED) {
            this.settledAt = at;
        }
    }
}
