package com.baladi.settlement.service;

import com.baladi.common.config.BaladiProperties;
import com.baladi.settlement.entity.PeriodStatus;
import com.baladi.settlement.entity.WeeklyPeriod;
import com.baladi.settlement.repository.WeeklyPeriodRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** Creates and looks up settlement weeks. */
@Slf4j
@Service
@Transactional(readOnly = true)
public class WeeklyPeriodService {

    private final WeeklyPeriodRepository periodRepository;
    private final Clock clock;
    private final ZoneId zone;

    public WeeklyPeriodService(WeeklyPeriodRepository periodRepository, Clock clock, BaladiProperties properties) {
        this.periodRepository = periodRepository;
        this.clock = clock;
        this.zone = properties.settlement().zone();
    }

    public ZoneId zone() {
        return zone;
    }

    public SettlementWeek currentWeek() {
        return SettlementWeek.containing(clock.instant(), zone);
    }

    public Optional<WeeklyPeriod> findActive() {
        return periodRepository.findFirstByStatusOrderByStartsAtAsc(PeriodStatus.ACTIVE);
    }

    /** The stored period for {@code week}, created as ACTIVE when missing. */
    @Transactional
    public WeeklyPeriod getOrOpen(SettlementWeek week) {
        return periodRepository.findByYearAndWeekNumber(week.year(), week.weekNumber())
                .orElseGet(() -> {
                    WeeklyPeriod period = periodRepository.save(WeeklyPeriod.builder()
                            .year(week.year())
                            .weekNumber(week.weekNumber())
                            .startsAt(week.start())
                            .endsAt(week.end())
                            .build());
                    log.info("Weekly period opened: periodId={}, year={}, week={}, startsAt={}",
                            period.getId(), week.year(), week.weekNumber(), week.start());
                    return period;
                });
    }

    /**
     * Makes sure some period is ACTIVE. When the current week is already closed,
     * the following week is opened instead.
     */
    @Transactional
    public WeeklyPeriod ensureActivePeriod() {
        Optional<WeeklyPeriod> active = findActive();
        if (active.isPresent()) {
            return active.get();
        }
        SettlementWeek week = currentWeek();
        WeeklyPeriod period = getOrOpen(week);
        return period.isActive() ? period : getOrOpen(week.next(zone));
    }

    /** The week right after {@code period}. */
    @Transactional
    public WeeklyPeriod openFollowing(WeeklyPeriod period) {
        Instant nextStart = period.windowEnd();
        return getOrOpen(SettlementWeek.containing(nextStart, zone));
    }
}
