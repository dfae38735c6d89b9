package com.baladi.settlement.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.settlement.dto.SettlementReport;
import com.baladi.settlement.dto.SettlementResult;
import com.baladi.settlement.entity.*;
import com.baladi.settlement.repository.PeriodSummaryRepository;
import com.baladi.settlement.repository.RiderSettlementRepository;
import com.baladi.settlement.repository.ShopSettlementRepository;
import com.baladi.settlement.repository.WeeklyPeriodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Settlement storage and admin review.
 *
 * <p>Closing is delegated to {@link WeeklySettlementAggregator}; this service owns
 * lookups, the review workflow and the final "period settled" step.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SettlementService {

    private final WeeklySettlementAggregator aggregator;
    private final WeeklyPeriodService periodService;
    private final WeeklyPeriodRepository periodRepository;
    private final ShopSettlementRepository shopSettlementRepository;
    private final RiderSettlementRepository riderSettlementRepository;
    private final PeriodSummaryRepository summaryRepository;
    private final Clock clock;

    public Optional<WeeklyPeriod> getCurrentWeekSettlement() {
        return periodService.findActive();
    }

    public List<WeeklyPeriod> getPeriods() {
        return periodRepository.findAllByOrderByStartsAtDesc();
    }

    public Result<WeeklyPeriod> getPeriod(Long periodId) {
        return periodRepository.findById(periodId)
                .<Result<WeeklyPeriod>>map(Result::success)
                .orElseGet(() -> Result.failure(Failure.notFound(ErrorCode.PERIOD_NOT_FOUND)));
    }

    /**
     * Runs the weekly close and returns the period it closed. The close opens its own
     * transaction once it holds the cluster lock, so none is started here.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Result<WeeklyPeriod> closeWeek(Long adminId, String note) {
        return aggregator.closeCurrentPeriod(adminId, note)
                .map(SettlementResult::periodId)
                .flatMap(this::getPeriod);
    }

    public List<ShopSettlement> getShopSettlements(Long periodId) {
        return shopSettlementRepository.findByPeriodIdOrderByShopIdAsc(periodId);
    }

    public List<RiderSettlement> getRiderSettlements(Long periodId) {
        return riderSettlementRepository.findByPeriodIdOrderByRiderIdAsc(periodId);
    }

    public List<ShopSettlement> getShopHistory(Long shopId) {
        return shopSettlementRepository.findByShopIdOrderByCreatedAtDesc(shopId);
    }

    public List<RiderSettlement> getRiderHistory(Long riderId) {
        return riderSettlementRepository.findByRiderIdOrderByCreatedAtDesc(riderId);
    }

    public Result<SettlementReport> getSettlementReport(Long periodId) {
        return getPeriod(periodId).flatMap(period -> summaryRepository.findByPeriodId(periodId)
                .<Result<SettlementReport>>map(summary -> Result.success(new SettlementReport(
                        SettlementReport.Period.from(period),
                        SettlementReport.Summary.from(summary),
                        getShopSettlements(periodId).stream().map(SettlementReport.Shop::from).toList(),
                        getRiderSettlements(periodId).stream().map(SettlementReport.Rider::from).toList())))
                .orElseGet(() -> Result.failure(Failure.businessRule(ErrorCode.SETTLEMENT_NOT_FOUND,
                        "Period " + periodId + " has not been closed yet"))));
    }

    @Transactional
    public Result<ShopSettlement> reviewShopSettlement(Long settlementId, SettlementStatus target,
                                                       Long adminId, String note) {
        return review(shopSettlementRepository, settlementId, target, adminId, note);
    }

    @Transactional
    public Result<RiderSettlement> reviewRiderSettlement(Long settlementId, SettlementStatus target,
                                                         Long adminId, String note) {
        return review(riderSettlementRepository, settlementId, target, adminId, note);
    }

    /** CLOSED -> SETTLED once every shop and rider settlement of the period is SETTLED. */
    @Transactional
    public Result<WeeklyPeriod> markPeriodSettled(Long periodId) {
        return getPeriod(periodId).flatMap(period -> {
            if (period.getStatus() != PeriodStatus.CLOSED) {
                return Result.failure(Failure.businessRule(ErrorCode.PERIOD_NOT_SETTLEABLE,
                        "Only a closed period can be settled, period is " + period.getStatus()));
            }
            if (shopSettlementRepository.existsByPeriodIdAndStatusNot(periodId, SettlementStatus.SETTLED)
                    || riderSettlementRepository.existsByPeriodIdAndStatusNot(periodId, SettlementStatus.SETTLED)) {
                return Result.failure(Failure.businessRule(ErrorCode.PERIOD_NOT_SETTLEABLE,
                        "Every shop and rider settlement must be settled first"));
            }
            period.markSettled(clock.instant());
            log.info("Period settled: periodId={}", periodId);
            return Result.success(period);
        });
    }

    private <T extends SettlementRecord> Result<T> review(JpaRepository<T, Long> repository, Long settlementId,
                                                          SettlementStatus target, Long adminId, String note) {
        if (target == null || adminId == null) {
            return Result.failure(Failure.validation("Target status and admin id are required"));
        }
        Optional<T> found = repository.findById(settlementId);
        if (found.isEmpty()) {
            return Result.failure(Failure.notFound(ErrorCode.SETTLEMENT_NOT_FOUND));
        }
        T settlement = found.get();
        if (!settlement.getStatus().canMoveTo(target)) {
            log.warn("Rejected settlement review: settlementId={}, from={}, to={}",
                    settlementId, settlement.getStatus(), target);
            return Result.failure(Failure.businessRule(ErrorCode.INVALID_SETTLEMENT_STATUS,
                    "Cannot move settlement from " + settlement.getStatus() + " to " + target));
        }
        settlement.moveTo(target, adminId, note, clock.instant());
        log.info("Settlement reviewed: settlementId={}, status={}, adminId={}", settlementId, target, adminId);
        return Result.success(settlement);
    }
}
