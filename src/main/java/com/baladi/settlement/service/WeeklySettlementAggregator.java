package com.baladi.settlement.service;

import com.baladi.ads.AdsCost;
import com.baladi.ads.AdsCostProvider;
import com.baladi.common.config.BaladiProperties;
import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Failures;
import com.baladi.common.result.Result;
import com.baladi.order.entity.CashTransaction;
import com.baladi.order.entity.CashTransactionType;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import com.baladi.order.repository.CashTransactionRepository;
import com.baladi.order.repository.OrderRepository;
import com.baladi.settlement.dto.SettlementResult;
import com.baladi.settlement.entity.PeriodSummary;
import com.baladi.settlement.entity.RiderSettlement;
import com.baladi.settlement.entity.ShopSettlement;
import com.baladi.settlement.entity.WeeklyPeriod;
import com.baladi.settlement.event.WeeklySettlementClosedEvent;
import com.baladi.settlement.repository.PeriodSummaryRepository;
import com.baladi.settlement.repository.RiderSettlementRepository;
import com.baladi.settlement.repository.ShopSettlementRepository;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Closes the active settlement week.
 *
 * <h3>Flow</h3>
 * <pre>
 * 1. Redisson lock "lock:settlement-close" (one close cluster-wide)
 * 2. BEGIN
 * 3.   resolve the ACTIVE period; reject if it was closed or has not started
 * 4.   load orders placed in [start, nextStart) plus late completions of earlier weeks
 * 5.   keep COMPLETED only; reject when nothing is left
 * 6.   fetch ads costs (remote)
 * 7.   accumulate per shop / per rider / platform
 * 8.   insert settlements, summary and shop_to_admin cash rows; close period; open next
 * 9. COMMIT, or ROLLBACK on any failure
 * 10. unlock
 * </pre>
 *
 * <p>The close is all-or-nothing. A second close of the same week fails with
 * PERIOD_ALREADY_CLOSED; the (shop, period) and (rider, period) unique keys back this up
 * at the database level.</p>
 */
@Slf4j
@Service
public class WeeklySettlementAggregator {

    static final String CLOSE_LOCK = "lock:settlement-close";
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final RedissonClient redissonClient;
    private final TransactionOperations transactionOperations;
    private final WeeklyPeriodService periodService;
    private final OrderRepository orderRepository;
    private final ShopSettlementRepository shopSettlementRepository;
    private final RiderSettlementRepository riderSettlementRepository;
    private final PeriodSummaryRepository summaryRepository;
    private final CashTransactionRepository cashTransactionRepository;
    private final AdsCostProvider adsCostProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration lockWait;
    private final Duration lockLease;

    public WeeklySettlementAggregator(RedissonClient redissonClient,
                                      TransactionOperations transactionOperations,
                                      WeeklyPeriodService periodService,
                                      OrderRepository orderRepository,
                                      ShopSettlementRepository shopSettlementRepository,
                                      RiderSettlementRepository riderSettlementRepository,
                                      PeriodSummaryRepository summaryRepository,
                                      CashTransactionRepository cashTransactionRepository,
                                      AdsCostProvider adsCostProvider,
                                      ApplicationEventPublisher eventPublisher,
                                      Clock clock,
                                      BaladiProperties properties) {
        this.redissonClient = redissonClient;
        this.transactionOperations = transactionOperations;
        this.periodService = periodService;
        this.orderRepository = orderRepository;
        this.shopSettlementRepository = shopSettlementRepository;
        this.riderSettlementRepository = riderSettlementRepository;
        this.summaryRepository = summaryRepository;
        this.cashTransactionRepository = cashTransactionRepository;
        this.adsCostProvider = adsCostProvider;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.lockWait = properties.settlement().closeLockWait();
        this.lockLease = properties.settlement().closeLockLease();
    }

    public Result<SettlementResult> closeCurrentPeriod(Long adminId, String note) {
        if (adminId == null) {
            return Result.failure(Failure.validation("Admin id is required"));
        }

        RLock lock = redissonClient.getLock(CLOSE_LOCK);
        try {
            if (!lock.tryLock(lockWait.toMillis(), lockLease.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Settlement close already running: adminId={}", adminId);
                return Result.failure(Failure.businessRule(ErrorCode.SETTLEMENT_IN_PROGRESS));
            }
            return transactionOperations.execute(status -> {
                Result<SettlementResult> result = closeInTransaction(adminId, note);
                if (result.isFailure()) {
                    status.setRollbackOnly();
                }
                return result;
            });
        } catch (DataAccessException e) {
            return Result.failure(Failures.fromDataAccess(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the settlement lock", e);
            return Result.failure(new Failure.NetworkFailure(ErrorCode.SERVICE_UNAVAILABLE,
                    "Interrupted while waiting for the settlement lock"));
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private Result<SettlementResult> closeInTransaction(Long adminId, String note) {
        Instant now = clock.instant();
        WeeklyPeriod period = periodService.findActive()
                .orElseGet(() -> periodService.getOrOpen(periodService.currentWeek()));

        if (!period.isActive() || period.getStartsAt().isAfter(now)
                || shopSettlementRepository.existsByPeriodId(period.getId())) {
            log.warn("Settlement already closed: periodId={}, status={}", period.getId(), period.getStatus());
            return Result.failure(Failure.businessRule(ErrorCode.PERIOD_ALREADY_CLOSED));
        }

        List<Order> windowOrders = orderRepository.findForSettlement(period.getStartsAt(), period.windowEnd());
        List<Order> lateCompletions = orderRepository.findUnsettledCompletedBefore(period.getStartsAt());

        List<Order> completed = new ArrayList<>();
        for (Order order : windowOrders) {
            if (order.getStatus() == OrderStatus.COMPLETED && order.getWeeklyPeriodId() == null) {
                completed.add(order);
            }
        }
        completed.addAll(lateCompletions);

        if (completed.isEmpty()) {
            log.warn("Nothing to settle: periodId={}, ordersInWindow={}", period.getId(), windowOrders.size());
            return Result.failure(Failure.businessRule(ErrorCode.NOTHING_TO_SETTLE));
        }

        Result<List<AdsCost>> ads = adsCostProvider.getAdsCostForPeriod(period.getStartsAt(), period.windowEnd());
        if (ads.isFailure()) {
            log.warn("Settlement aborted, ads costs unavailable: periodId={}", period.getId());
            return Result.failure(ads.failure());
        }

        Totals totals = accumulate(windowOrders, lateCompletions, completed, ads.getOrThrow());
        persist(period, totals, now);

        completed.forEach(order -> order.assignToPeriod(period.getId()));
        period.close(adminId, note, now);
        WeeklyPeriod next = periodService.openFollowing(period);

        eventPublisher.publishEvent(new WeeklySettlementClosedEvent(period.getId(), adminId,
                completed.size(), totals.shops.size(), totals.riders.size(), now));
        log.info("Weekly settlement closed: periodId={}, orders={}, shops={}, riders={}, adminNet={}, nextPeriodId={}",
                period.getId(), completed.size(), totals.shops.size(), totals.riders.size(),
                totals.adminNetCommission(), next.getId());

        Map<Long, BigDecimal> credits = new TreeMap<>();
        totals.shops.forEach((shopId, shop) -> credits.put(shopId, shop.pointsCredit));
        return Result.success(new SettlementResult(period.getId(), completed.size(), totals.shops.size(),
                totals.riders.size(), totals.pointsDiscountValue, Collections.unmodifiableMap(credits),
                totals.adminNetCommission()));
    }

    private Totals accumulate(List<Order> windowOrders, List<Order> lateCompletions,
                              List<Order> completed, List<AdsCost> adsCosts) {
        Totals totals = new Totals();
        totals.totalOrders = windowOrders.size() + lateCompletions.size();
        totals.cancelledOrders = (int) windowOrders.stream()
                .filter(order -> order.getStatus() == OrderStatus.CANCELLED)
                .count();
        totals.completedOrders = completed.size();

        for (Order order : completed) {
            ShopTotals shop = totals.shops.computeIfAbsent(order.getShopId(), id -> new ShopTotals());
            shop.orders++;
            shop.grossSales = shop.grossSales.add(order.getSubtotal());
            shop.commission = shop.commission.add(order.getShopCommission());
            // Redeemed points are platform-funded: credited to the shop, not deducted
            shop.pointsCredit = shop.pointsCredit.add(order.getPointsDiscount());

            totals.grossSales = totals.grossSales.add(order.getSubtotal());
            totals.shopCommissions = totals.shopCommissions.add(order.getShopCommission());
            totals.pointsRedeemed += order.getPointsUsed();
            totals.pointsDiscountValue = totals.pointsDiscountValue.add(order.getPointsDiscount());

            if (order.isFreeDelivery()) {
                shop.freeDeliveryCost = shop.freeDeliveryCost.add(order.getDeliveryFee());
                totals.freeDeliveryOrders++;
                totals.freeDeliveryCost = totals.freeDeliveryCost.add(order.getDeliveryFee());
            } else {
                totals.deliveryFees = totals.deliveryFees.add(order.getDeliveryFee());
            }

            if (order.getRiderId() != null) {
                RiderTotals rider = totals.riders.computeIfAbsent(order.getRiderId(), id -> new RiderTotals());
                rider.deliveries++;
                rider.earnings = rider.earnings.add(order.getRiderEarnings());
                rider.cashHandled = rider.cashHandled.add(order.getTotal());
            }
        }

        for (AdsCost cost : adsCosts) {
            if (cost.shopId() == null || cost.totalCost() == null || cost.totalCost().signum() == 0) {
                continue;
            }
            BigDecimal amount = cost.totalCost().setScale(2, RoundingMode.HALF_UP);
            ShopTotals shop = totals.shops.computeIfAbsent(cost.shopId(), id -> new ShopTotals());
            shop.adsCost = shop.adsCost.add(amount);
            totals.adsRevenue = totals.adsRevenue.add(amount);
        }
        return totals;
    }

    private void persist(WeeklyPeriod period, Totals totals, Instant now) {
        List<ShopSettlement> shopSettlements = new ArrayList<>();
        totals.shops.forEach((shopId, shop) -> shopSettlements.add(ShopSettlement.builder()
                .shopId(shopId)
                .periodId(period.getId())
                .totalOrders(shop.orders)
                .grossSales(shop.grossSales)
                .totalCommission(shop.commission)
                .pointsDiscountCredit(shop.pointsCredit)
                .freeDeliveryCost(shop.freeDeliveryCost)
                .adsCost(shop.adsCost)
                .createdAt(now)
                .build()));
        shopSettlementRepository.saveAll(shopSettlements);

        List<RiderSettlement> riderSettlements = new ArrayList<>();
        totals.riders.forEach((riderId, rider) -> riderSettlements.add(RiderSettlement.builder()
                .riderId(riderId)
                .periodId(period.getId())
                .totalDeliveries(rider.deliveries)
                .totalEarnings(rider.earnings)
                .cashHandled(rider.cashHandled)
                .createdAt(now)
                .build()));
        riderSettlementRepository.saveAll(riderSettlements);

        List<CashTransaction> shopToAdmin = shopSettlements.stream()
                .filter(settlement -> settlement.getAmountOwedToPlatform().signum() > 0)
                .map(settlement -> CashTransaction.builder()
                        .periodId(period.getId())
                        .type(CashTransactionType.SHOP_TO_ADMIN)
                        .amount(settlement.getAmountOwedToPlatform())
                        .fromPartyId(settlement.getShopId())
                        .createdAt(now)
                        .build())
                .toList();
        cashTransactionRepository.saveAll(shopToAdmin);

        summaryRepository.save(PeriodSummary.builder()
                .periodId(period.getId())
                .totalOrders(totals.totalOrders)
                .completedOrders(totals.completedOrders)
                .cancelledOrders(totals.cancelledOrders)
                .grossSales(totals.grossSales)
                .totalDeliveryFees(totals.deliveryFees)
                .totalShopCommissions(totals.shopCommissions)
                .totalPointsRedeemed(totals.pointsRedeemed)
                .pointsDiscountValue(totals.pointsDiscountValue)
                .freeDeliveryOrders(totals.freeDeliveryOrders)
                .freeDeliveryCost(totals.freeDeliveryCost)
                .totalAdsRevenue(totals.adsRevenue)
                .adminNetCommission(totals.adminNetCommission())
                .createdAt(now)
                .build());
    }

    private static final class ShopTotals {
        int orders;
        BigDecimal grossSales = ZERO;
        BigDecimal commission = ZERO;
        BigDecimal pointsCredit = ZERO;
        BigDecimal freeDeliveryCost = ZERO;
        BigDecimal adsCost = ZERO;
    }

    private static final class RiderTotals {
        int deliveries;
        BigDecimal earnings = ZERO;
        BigDecimal cashHandled = ZERO;
    }

    private static final class Totals {
        final Map<Long, ShopTotals> shops = new TreeMap<>();
        final Map<Long, RiderTotals> riders = new TreeMap<>();
        int totalOrders;
        int completedOrders;
        int cancelledOrders;
        int pointsRedeemed;
        int freeDeliveryOrders;
        BigDecimal grossSales = ZERO;
        BigDecimal deliveryFees = ZERO;
        BigDecimal shopCommissions = ZERO;
        BigDecimal pointsDiscountValue = ZERO;
        BigDecimal freeDeliveryCost = ZERO;
        BigDecimal adsRevenue = ZERO;

        /** Not clamped; a negative week is reported as such. */
        BigDecimal adminNetCommission() {
            return shopCommissions.subtract(pointsDiscountValue).subtract(freeDeliveryCost).add(adsRevenue);
        }
    }
}
