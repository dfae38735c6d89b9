package com.baladi.referral.repository;

import com.baladi.referral.entity.Referral;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReferralRepository extends JpaRepository<Referral, Long> {

    boolean existsByReferredId(Long referredId);

    List<Referral> findByReferrerIdOrderByCreatedAtDesc(Long referrerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Referral r WHERE r.referredId = :referredId")
    Optional<Referral> findForUpdateByReferredId(@Param("referredId") Long referredId);
}
