package com.baladi.settlement.repository;

import com.baladi.settlement.entity.SettlementStatus;
import com.baladi.settlement.entity.ShopSettlement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ShopSettlementRepository extends JpaRepository<ShopSettlement, Long> {

    List<ShopSettlement> findByPeriodIdOrderByShopIdAsc(Long periodId);

    List<ShopSettlement> findByShopIdOrderByCreatedAtDesc(Long shopId);

    boolean existsByPeriodId(Long periodId);

    boolean existsByPeriodIdAndStatusNot(Long periodId, SettlementStatus status);
}
