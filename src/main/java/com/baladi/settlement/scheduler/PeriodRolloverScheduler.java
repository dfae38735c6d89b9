package com.baladi.settlement.scheduler;

import com.baladi.settlement.entity.WeeklyPeriod;
import com.baladi.settlement.service.WeeklyPeriodService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps an ACTIVE settlement week open.
 *
 * <p>Runs every 15 minutes and on every instance; ShedLock lets only one of them
 * do the work. Closing is never automatic, an admin closes the week.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeriodRolloverScheduler {

    private final WeeklyPeriodService periodService;

    @Scheduled(cron = "${baladi.settlement.rollover-cron:0 */15 * * * *}", zone = "${baladi.settlement.zone:Africa/Cairo}")
    @SchedulerLock(name = "PeriodRolloverScheduler", lockAtMostFor = "1m", lockAtLeastFor = "5s")
    public void ensureActivePeriod() {
        try {
            WeeklyPeriod period = periodService.ensureActivePeriod();
            log.debug("Active period: periodId={}, year={}, week={}",
                    period.getId(), period.getYear(), period.getWeekNumber());
        } catch (DataAccessException e) {
            // Next run retries
            log.error("Failed to ensure an active settlement period", e);
        }
    }
}
