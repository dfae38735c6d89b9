package com.baladi.order.service;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.entity.ActorRole;
import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusStateMachineTest {

    private final OrderStatusStateMachine stateMachine = new OrderStatusStateMachine(Fixtures.fixedClock());

    @Test
    @DisplayName("PENDING -> PREPARING skips a step and is rejected")
    void cannotSkipSteps() {
        Order order = Fixtures.order(1L, OrderStatus.PENDING);

        Result<Order> result = stateMachine.transition(order, OrderStatus.PREPARING, ActorRole.SHOP);

        assertThat(result.failure()).isInstanceOf(Failure.BusinessRuleFailure.class);
        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.INVALID_ORDER_STATUS);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPreparingAt()).isNull();
    }

    @Test
    @DisplayName("the full chain succeeds in strict order and stamps every timestamp")
    void fullChainSucceeds() {
        Order order = Fixtures.order(1L, OrderStatus.PENDING);

        Result<Order> result = stateMachine.transition(order, OrderStatus.ACCEPTED, ActorRole.SHOP)
                .flatMap(o -> stateMachine.transition(o, OrderStatus.PREPARING, ActorRole.SHOP))
                .flatMap(o -> stateMachine.transition(o, OrderStatus.PICKED_UP, ActorRole.RIDER))
                .flatMap(o -> stateMachine.transition(o, OrderStatus.SHOP_PAID, ActorRole.RIDER))
                .flatMap(o -> stateMachine.transition(o, OrderStatus.COMPLETED, ActorRole.SHOP));

        assertThat(result.isSuccess()).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getAcceptedAt()).isEqualTo(Fixtures.NOW);
        assertThat(order.getPreparingAt()).isEqualTo(Fixtures.NOW);
        assertThat(order.getPickedUpAt()).isEqualTo(Fixtures.NOW);
        assertThat(order.getShopPaidAt()).isEqualTo(Fixtures.NOW);
        assertThat(order.getCompletedAt()).isEqualTo(Fixtures.NOW);
        assertThat(order.getCancelledAt()).isNull();
    }

    @Test
    @DisplayName("cancelling a picked-up order is rejected")
    void cannotCancelAfterPickup() {
        Order order = Fixtures.order(1L, OrderStatus.PICKED_UP);

        Result<Order> result = stateMachine.transition(order, OrderStatus.CANCELLED, ActorRole.ADMIN);

        assertThat(result.failure()).isInstanceOf(Failure.BusinessRuleFailure.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PICKED_UP);
    }

    @ParameterizedTest
    @EnumSource(value = ActorRole.class, names = {"CUSTOMER", "SHOP", "ADMIN"})
    @DisplayName("customer, shop and admin may cancel a pending order")
    void cancellersMayCancelPending(ActorRole role) {
        Order order = Fixtures.order(1L, OrderStatus.PENDING);

        Result<Order> result = stateMachine.transition(order, OrderStatus.CANCELLED, role);

        assertThat(result.isSuccess()).isTrue();
        assertThat(order.getCancelledAt()).isEqualTo(Fixtures.NOW);
    }

    @Test
    @DisplayName("a rider cannot cancel")
    void riderCannotCancel() {
        Order order = Fixtures.order(1L, OrderStatus.ACCEPTED);

        Result<Order> result = stateMachine.transition(order, OrderStatus.CANCELLED, ActorRole.RIDER);

        assertThat(result.failure()).isInstanceOf(Failure.ValidationFailure.class);
        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.ACTOR_NOT_ALLOWED);
    }

    @Test
    @DisplayName("a legal edge requested by the wrong actor is a validation failure")
    void wrongActorIsValidationFailure() {
        Order order = Fixtures.order(1L, OrderStatus.PREPARING);

        Result<Order> result = stateMachine.transition(order, OrderStatus.PICKED_UP, ActorRole.SHOP);

        assertThat(result.failure()).isInstanceOf(Failure.ValidationFailure.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(order.getPickedUpAt()).isNull();
    }

    @ParameterizedTest
    @EnumSource(OrderStatus.class)
    @DisplayName("terminal states have no outgoing edge")
    void terminalStatesAreFinal(OrderStatus target) {
        assertThat(stateMachine.isAllowedEdge(OrderStatus.COMPLETED, target)).isFalse();
        assertThat(stateMachine.isAllowedEdge(OrderStatus.CANCELLED, target)).isFalse();
    }

    @Test
    @DisplayName("a missing target status is rejected as invalid input")
    void nullTarget() {
        Result<Order> result = stateMachine.transition(Fixtures.order(1L, OrderStatus.PENDING), null, ActorRole.SHOP);

        assertThat(result.failure()).isInstanceOf(Failure.ValidationFailure.class);
    }
}
