package com.baladi.order.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

/**
 * Validates and applies order status transitions.
 *
 * <pre>
 * target       allowed actors
 * ACCEPTED     SHOP
 * PREPARING    SHOP
 * PICKED_UP    RIDER
 * SHOP_PAID    RIDER
 * COMPLETED    SHOP
 * CANCELLED    CUSTOMER, SHOP, ADMIN (from PENDING or ACCEPTED only)
 * </pre>
 *
 * <p>Graph violations are {@link Failure.BusinessRuleFailure}; a legal edge
 * requested by the wrong party is a {@link Failure.ValidationFailure}. The order
 * is only touched once both checks pass.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusStateMachine {

    private static final Set<ActorRole> CANCELLERS =
            EnumSet.of(ActorRole.CUSTOMER, ActorRole.SHOP, ActorRole.ADMIN);

    private final Clock clock;

    public Result<Order> transition(Order order, OrderStatus target, ActorRole actorRole) {
        if (target == null || actorRole == null) {
            return Result.failure(Failure.validation("Target status and actor role are required"));
        }

        OrderStatus current = order.getStatus();
        if (!isAllowedEdge(current, target)) {
            log.warn("Rejected transition: orderId={}, from={}, to={}", order.getId(), current, target);
            return Result.failure(Failure.businessRule(ErrorCode.INVALID_ORDER_STATUS,
                    "Cannot move order from " + current + " to " + target));
        }

        if (!allowedActors(target).contains(actorRole)) {
            log.warn("Actor not allowed: orderId={}, to={}, role={}", order.getId(), target, actorRole);
            return Result.failure(Failure.validation(ErrorCode.ACTOR_NOT_ALLOWED,
                    actorRole + " cannot move an order to " + target));
        }

        order.moveTo(target, clock.instant());
        log.info("Order status changed: orderId={}, from={}, to={}, role={}",
                order.getId(), current, target, actorRole);
        return Result.success(order);
    }

    /** Exactly the next forward step, or cancellation while still cancellable. */
    public boolean isAllowedEdge(OrderStatus current, OrderStatus target) {
        if (target == OrderStatus.CANCELLED) {
            return current.isCancellable();
        }
        return target == current.next();
    }

    static Set<ActorRole> allowedActors(OrderStatus target) {
        return switch (target) {
            case ACCEPTED, PREPARING, COMPLETED -> EnumSet.of(ActorRole.SHOP);
            case PICKED_UP, SHOP_PAID -> EnumSet.of(ActorRole.RIDER);
            case CANCELLED -> CANCELLERS;
            case PENDING -> EnumSet.noneOf(ActorRole.class);
        };
    }
}
