package com.baladi.settlement.repository;

import com.baladi.settlement.entity.RiderSettlement;
import com.baladi.settlement.entity.SettlementStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RiderSettlementRepository extends JpaRepository<RiderSettlement, Long> {

    List<RiderSettlement> findByPeriodIdOrderByRiderIdAsc(Long periodId);

    List<RiderSettlement> findByRiderIdOrderByCreatedAtDesc(Long riderId);

    boolean existsByPeriodIdAndStatusNot(Long periodId, SettlementStatus status);
}
