package com.baladi.referral.service;

import com.baladi.common.config.BaladiProperties;
import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import com.baladi.order.repository.OrderRepository;
import com.baladi.points.entity.PointsAccount;
import com.baladi.points.repository.PointsAccountRepository;
import com.baladi.points.service.PointsService;
import com.baladi.referral.entity.Referral;
import com.baladi.referral.repository.ReferralRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Referral codes and the one-time bonus paid to the referrer.
 *
 * <p>"First order" means the referred customer's first <em>completed</em> order:
 * no other order of theirs has reached COMPLETED. A completed referral is never
 * paid again, so running the completion hook twice for the same order is a no-op.</p>
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ReferralBonusEngine {

    private final ReferralRepository referralRepository;
    private final PointsAccountRepository accountRepository;
    private final OrderRepository orderRepository;
    private final PointsService pointsService;
    private final Clock clock;
    private final int referralBonus;

    public ReferralBonusEngine(ReferralRepository referralRepository,
                               PointsAccountRepository accountRepository,
                               OrderRepository orderRepository,
                               PointsService pointsService,
                               Clock clock,
                               BaladiProperties properties) {
        this.referralRepository = referralRepository;
        this.accountRepository = accountRepository;
        this.orderRepository = orderRepository;
        this.pointsService = pointsService;
        this.clock = clock;
        this.referralBonus = properties.points().referralBonus();
    }

    @Transactional
    public Result<Referral> applyReferralCode(Long customerId, String code) {
        if (code == null || code.isBlank()) {
            return Result.failure(Failure.validation(ErrorCode.INVALID_REFERRAL_CODE, "Referral code is required"));
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);

        Optional<PointsAccount> referrer = accountRepository.findByReferralCode(normalized);
        if (referrer.isEmpty()) {
            return Result.failure(Failure.validation(ErrorCode.INVALID_REFERRAL_CODE,
                    "Unknown referral code: " + normalized));
        }
        Long referrerId = referrer.get().getCustomerId();
        if (referrerId.equals(customerId)) {
            log.warn("Self-referral rejected: customerId={}", customerId);
            return Result.failure(Failure.businessRule(ErrorCode.SELF_REFERRAL));
        }
        if (referralRepository.existsByReferredId(customerId)) {
            log.warn("Referral already applied: customerId={}", customerId);
            return Result.failure(Failure.businessRule(ErrorCode.REFERRAL_ALREADY_USED));
        }

        Referral referral = referralRepository.save(Referral.builder()
                .referrerId(referrerId)
                .referredId(customerId)
                .referralCode(normalized)
                .createdAt(clock.instant())
                .build());
        log.info("Referral applied: referrerId={}, referredId={}", referrerId, customerId);
        return Result.success(referral);
    }

    public static boolean shouldAwardBonus(boolean isFirstOrder, boolean referralPending) {
        return isFirstOrder && referralPending;
    }

    /**
     * Pays the referrer if {@code order} is the referred customer's first completed order.
     *
     * @return {@code true} when a bonus was paid by this call
     */
    @Transactional
    public Result<Boolean> onOrderCompleted(Order order) {
        if (order.getStatus() != OrderStatus.COMPLETED) {
            return Result.success(false);
        }
        Optional<Referral> found = referralRepository.findForUpdateByReferredId(order.getCustomerId());
        if (found.isEmpty()) {
            return Result.success(false);
        }
        Referral referral = found.get();
        boolean isFirstOrder = orderRepository.countByCustomerIdAndStatusAndIdNot(
                order.getCustomerId(), OrderStatus.COMPLETED, order.getId()) == 0;
        if (!shouldAwardBonus(isFirstOrder, referral.isPending())) {
            return Result.success(false);
        }

        return pointsService.awardReferralBonus(referral.getReferrerId(), order.getId(), referralBonus)
                .map(tx -> {
                    referral.complete(order.getId(), clock.instant());
                    log.info("Referral bonus awarded: referralId={}, referrerId={}, orderId={}, points={}",
                            referral.getId(), referral.getReferrerId(), order.getId(), referralBonus);
                    return true;
                });
    }

    /** Closes a pending referral without a bonus. */
    @Transactional
    public Result<Referral> expireReferral(Long referralId) {
        Optional<Referral> found = referralRepository.findById(referralId);
        if (found.isEmpty()) {
            return Result.failure(Failure.notFound(ErrorCode.REFERRAL_NOT_FOUND));
        }
        Referral referral = found.get();
        if (!referral.isPending()) {
            log.warn("Referral not expired: referralId={}, status={}", referralId, referral.getStatus());
            return Result.failure(Failure.businessRule(ErrorCode.REFERRAL_NOT_PENDING));
        }
        referral.expire(clock.instant());
        log.info("Referral expired: referralId={}, referredId={}", referralId, referral.getReferredId());
        return Result.success(referral);
    }

    public List<Referral> getReferralsBy(Long referrerId) {
        return referralRepository.findByReferrerIdOrderByCreatedAtDesc(referrerId);
    }
}
