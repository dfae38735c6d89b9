package com.baladi.settlement.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Saturday-to-Friday settlement week.
 *
 * <p>{@code endsAt} is Friday 23:59:59 in the settlement zone; orders are matched
 * against the half-open window {@code [startsAt, windowEnd())}.</p>
 */
@Entity
@Table(name = "weekly_periods", uniqueConstraints = {
        @UniqueConstraint(name = "uk_weekly_period_year_week", columnNames = {"periodYear", "weekNumber"})
}, indexes = {
        @Index(name = "idx_weekly_period_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WeeklyPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "weekly_period_seq")
    @SequenceGenerator(name = "weekly_period_seq", sequenceName = "weekly_period_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(name = "periodYear", nullable = false)
    private int year;

    @Column(nullable = false)
    private int weekNumber;

    @Column(nullable = false)
    private Instant startsAt;

    @Column(nullable = false)
    private Instant endsAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PeriodStatus status;

    private Long closedBy;
    private Instant closedAt;
    private String closeNote;
    private Instant settledAt;

    @Builder
    public WeeklyPeriod(int year, int weekNumber, Instant startsAt, Instant endsAt) {
        this.year = year;
        this.weekNumber = weekNumber;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.status = PeriodStatus.ACTIVE;
    }

    /** Exclusive end of the order window: the next Saturday 00:00. */
    public Instant windowEnd() {
        return endsAt.plusSeconds(1);
    }

    public boolean isActive() {
        return status == PeriodStatus.ACTIVE;
    }

    public void close(Long adminId, String note, Instant at) {
        if (!isActive()) {
            throw new IllegalStateException("Period is not active: periodId=" + id);
        }
        this.status = PeriodStatus.CLOSED;
        this.closedBy = adminId;
        this.closeNote = note;
        this.closedAt = at;
    }

    public void markSettled(Instant at) {
        if (status != PeriodStatus.CLOSED) {
            throw new IllegalStateException("Period is not closed: periodId=" + id);
        }
        this.status = PeriodStatus.SETTLED;
        this.settledAt = at;
    }
}
