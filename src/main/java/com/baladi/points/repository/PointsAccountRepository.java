package com.baladi.points.repository;

import com.baladi.points.entity.PointsAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PointsAccountRepository extends JpaRepository<PointsAccount, Long> {

    Optional<PointsAccount> findByCustomerId(Long customerId);

    Optional<PointsAccount> findByReferralCode(String referralCode);

    boolean existsByReferralCode(String referralCode);

    /** Row lock so two debits for the same customer cannot both pass the balance check. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM PointsAccount a WHERE a.customerId = :customerId")
    Optional<PointsAccount> findForUpdateByCustomerId(@Param("customerId") Long customerId);
}
