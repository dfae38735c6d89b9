package com.baladi.order.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.CashTransaction;
import com.baladi.order.entity.CashTransactionType;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import com.baladi.order.repository.CashTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Physical cash milestones of a cash-on-delivery order.
 *
 * <pre>
 * customer --(collected)--> rider --(transferred)--> shop --(confirmed)--> COMPLETED
 * </pre>
 *
 * <p>Each milestone requires the previous ones. The hand-over to the shop is also the
 * PICKED_UP -> SHOP_PAID transition, and the shop's confirmation is the only way an
 * order reaches COMPLETED. Callers hold the order's row lock.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CashCustodyTracker {

    private final OrderStatusStateMachine stateMachine;
    private final CashTransactionRepository cashTransactionRepository;
    private final Clock clock;

    /** Rider took the customer's cash. */
    public Result<Order> markCashCollected(Order order, Long riderId) {
        if (!order.isAssignedTo(riderId)) {
            return Result.failure(notAssignedRider(order, riderId));
        }
        if (order.getStatus() != OrderStatus.PICKED_UP) {
            return Result.failure(Failure.businessRule(ErrorCode.CASH_OUT_OF_ORDER,
                    "Cash can only be collected once the order is picked up"));
        }
        if (order.isCashCollected()) {
            return Result.failure(Failure.businessRule(ErrorCode.CASH_OUT_OF_ORDER, "Cash already collected"));
        }

        Instant now = clock.instant();
        order.markCashCollected(now);
        cashTransactionRepository.save(CashTransaction.builder()
                .orderId(order.getId())
                .type(CashTransactionType.CUSTOMER_TO_RIDER)
                .amount(order.getTotal())
                .fromPartyId(order.getCustomerId())
                .toPartyId(riderId)
                .confirmedBy(riderId)
                .confirmedAt(now)
                .createdAt(now)
                .build());

        log.info("Cash collected: orderId={}, riderId={}, amount={}", order.getId(), riderId, order.getTotal());
        return Result.success(order);
    }

    /** Rider handed the shop its share; the order becomes SHOP_PAID. */
    public Result<Order> markCashTransferredToShop(Order order, Long riderId) {
        if (!order.isAssignedTo(riderId)) {
            return Result.failure(notAssignedRider(order, riderId));
        }
        if (!order.isCashCollected()) {
            return Result.failure(outOfOrder(order, "Cash must be collected before it is handed to the shop"));
        }
        if (order.isCashTransferredToShop()) {
            return Result.failure(Failure.businessRule(ErrorCode.CASH_OUT_OF_ORDER, "Cash already handed to the shop"));
        }

        return stateMachine.transition(order, OrderStatus.SHOP_PAID, ActorRole.RIDER)
                .peek(paid -> {
                    Instant now = clock.instant();
                    paid.markCashTransferredToShop(now);
                    BigDecimal shopShare = paid.getTotal().subtract(paid.getRiderEarnings());
                    cashTransactionRepository.save(CashTransaction.builder()
                            .orderId(paid.getId())
                            .type(CashTransactionType.RIDER_TO_SHOP)
                            .amount(shopShare)
                            .fromPartyId(riderId)
                            .toPartyId(paid.getShopId())
                            .createdAt(now)
                            .build());
                    log.info("Cash handed to shop: orderId={}, shopId={}, amount={}",
                            paid.getId(), paid.getShopId(), shopShare);
                });
    }

    /** Shop confirms it received the cash; the order becomes COMPLETED. */
    public Result<Order> confirmShopReceivedCash(Order order, Long shopId) {
        if (!order.getShopId().equals(shopId)) {
            return Result.failure(Failure.validation(ErrorCode.ACTOR_NOT_ALLOWED,
                    "Shop " + shopId + " does not own order " + order.getId()));
        }
        if (!order.isCashCollected() || !order.isCashTransferredToShop()) {
            return Result.failure(outOfOrder(order, "Cash must be collected and handed over before the shop confirms"));
        }
        if (order.isShopConfirmedCash()) {
            return Result.failure(Failure.businessRule(ErrorCode.CASH_OUT_OF_ORDER, "Cash already confirmed"));
        }

        return stateMachine.transition(order, OrderStatus.COMPLETED, ActorRole.SHOP)
                .peek(completed -> {
                    Instant now = clock.instant();
                    completed.markShopConfirmedCash(now);
                    cashTransactionRepository
                            .findByOrderIdAndType(completed.getId(), CashTransactionType.RIDER_TO_SHOP)
                            .ifPresent(tx -> tx.confirm(shopId, now));
                    log.info("Shop confirmed cash: orderId={}, shopId={}", completed.getId(), shopId);
                });
    }

    private static Failure notAssignedRider(Order order, Long riderId) {
        return Failure.validation(ErrorCode.ACTOR_NOT_ALLOWED,
                "Rider " + riderId + " is not assigned to order " + order.getId());
    }

    private static Failure outOfOrder(Order order, String message) {
        log.warn("Cash milestone out of order: orderId={}, collected={}, transferred={}",
                order.getId(), order.isCashCollected(), order.isCashTransferredToShop());
        return Failure.businessRule(ErrorCode.CASH_OUT_OF_ORDER, message);
    }
}
