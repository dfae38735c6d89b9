package com.baladi.settlement.repository;

import com.baladi.settlement.entity.PeriodSummary;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PeriodSummaryRepository extends JpaRepository<PeriodSummary, Long> {

    Optional<PeriodSummary> findByPeriodId(Long periodId);
}
