package com.baladi.settlement.repository;

import com.baladi.settlement.entity.PeriodStatus;
import com.baladi.settlement.entity.WeeklyPeriod;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WeeklyPeriodRepository extends JpaRepository<WeeklyPeriod, Long> {

    Optional<WeeklyPeriod> findFirstByStatusOrderByStartsAtAsc(PeriodStatus status);

    Optional<WeeklyPeriod> findByYearAndWeekNumber(int year, int weekNumber);

    List<WeeklyPeriod> findAllByOrderByStartsAtDesc();
}
