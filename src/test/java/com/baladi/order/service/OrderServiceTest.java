package com.baladi.order.service;

import com.baladi.common.exception.BusinessException;
import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.order.dto.PlaceOrderRequest;
import com.baladi.order.entity.*;
import com.baladi.order.event.OrderStatusChangedEvent;
import com.baladi.order.repository.CashTransactionRepository;
import com.baladi.order.repository.OrderRepository;
import com.baladi.order.repository.OrderStatusHistoryRepository;
import com.baladi.points.service.PointsService;
import com.baladi.referral.service.ReferralBonusEngine;
import com.baladi.shop.entity.Product;
import com.baladi.shop.entity.Shop;
import com.baladi.shop.service.ShopService;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.baladi.support.Fixtures.money;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStatusHistoryRepository historyRepository;
    @Mock
    private CashTransactionRepository cashTransactionRepository;
    @Mock
    private ShopService shopService;
    @Mock
    private PointsService pointsService;
    @Mock
    private ReferralBonusEngine referralBonusEngine;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderService orderService;

    @BeforeEach
    void setUp() {
        OrderStatusStateMachine stateMachine = new OrderStatusStateMachine(Fixtures.fixedClock());
        orderService = new OrderService(orderRepository, historyRepository, cashTransactionRepository,
                shopService, pointsService, referralBonusEngine, stateMachine,
                new CommissionAndPointsCalculator(Fixtures.properties()),
                new CashCustodyTracker(stateMachine, cashTransactionRepository, Fixtures.fixedClock()),
                eventPublisher, Fixtures.fixedClock(), Fixtures.properties());
    }

    private Shop openShop() {
        return Shop.builder().id(10L).name("Koshary Corner").commissionRate(money("0.10"))
                .deliveryFee(money("15.00")).open(true).build();
    }

    private Product product(Long id, String price) {
        return Product.builder().id(id).shopId(10L).name("Product " + id).price(money(price)).available(true).build();
    }

    @Test
    @DisplayName("placing an order snapshots items, prices it and redeems points")
    void placeOrder_Success() {
        given(shopService.findOpenShop(10L)).willReturn(Result.success(openShop()));
        given(shopService.findOrderableProducts(eq(10L), anyCollection()))
                .willReturn(Result.success(Map.of(1L, product(1L, "50.00"), 2L, product(2L, "100.00"))));
        given(pointsService.getBalance(100L)).willReturn(12);
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(pointsService.redeemForOrder(eq(100L), any(), eq(5))).willReturn(Result.success(null));

        PlaceOrderRequest request = new PlaceOrderRequest(100L, 10L, List.of(
                new PlaceOrderRequest.Item(1L, 1),
                new PlaceOrderRequest.Item(2L, 1),
                new PlaceOrderRequest.Item(1L, 1)), 5, false, "Tahrir St. 5");

        Order order = orderService.placeOrder(request).getOrThrow();

        assertThat(order.getOrderNumber()).matches("BLD-20240110-[A-Z0-9]{6}");
        assertThat(order.getItems()).hasSize(2);
        assertThat(order.getItems().get(0).getQuantity()).isEqualTo(2);
        assertThat(order.getSubtotal()).isEqualByComparingTo("200");
        assertThat(order.getShopCommission()).isEqualByComparingTo("20");
        assertThat(order.getPlatformCommission()).isEqualByComparingTo("15");
        assertThat(order.getTotal()).isEqualByComparingTo("210");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        verify(pointsService).redeemForOrder(eq(100L), any(), eq(5));
    }

    @Test
    @DisplayName("the shop's own delivery fee wins; the default applies when it has none")
    void placeOrder_DefaultDeliveryFee() {
        Shop noFeeShop = Shop.builder().id(10L).name("Bakery").commissionRate(money("0.10")).open(true).build();
        given(shopService.findOpenShop(10L)).willReturn(Result.success(noFeeShop));
        given(shopService.findOrderableProducts(eq(10L), anyCollection()))
                .willReturn(Result.success(Map.of(1L, product(1L, "40.00"))));
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));

        Order order = orderService.placeOrder(new PlaceOrderRequest(100L, 10L,
                List.of(new PlaceOrderRequest.Item(1L, 1)), 0, false, null)).getOrThrow();

        assertThat(order.getDeliveryFee()).isEqualByComparingTo("10.00");
        verify(pointsService, never()).redeemForOrder(any(), any(), anyInt());
    }

    @Test
    @DisplayName("a closed shop rejects the order and nothing is saved")
    void placeOrder_ShopClosed() {
        given(shopService.findOpenShop(10L)).willReturn(Result.failure(Failure.businessRule(ErrorCode.SHOP_CLOSED)));

        Result<Order> result = orderService.placeOrder(new PlaceOrderRequest(100L, 10L,
                List.of(new PlaceOrderRequest.Item(1L, 1)), 0, false, null));

        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.SHOP_CLOSED);
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("an order without items is invalid")
    void placeOrder_NoItems() {
        Result<Order> result = orderService.placeOrder(new PlaceOrderRequest(100L, 10L, List.of(), 0, false, null));

        assertThat(result.failure()).isInstanceOf(Failure.ValidationFailure.class);
        verifyNoInteractions(shopService, orderRepository);
    }

    @Test
    @DisplayName("redeeming more points than the balance redeems the whole balance")
    void placeOrder_PointsClampedToBalance() {
        given(shopService.findOpenShop(10L)).willReturn(Result.success(openShop()));
        given(shopService.findOrderableProducts(eq(10L), anyCollection()))
                .willReturn(Result.success(Map.of(1L, product(1L, "80.00"))));
        given(pointsService.getBalance(100L)).willReturn(3);
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(pointsService.redeemForOrder(eq(100L), any(), eq(3))).willReturn(Result.success(null));

        Order order = orderService.placeOrder(new PlaceOrderRequest(100L, 10L,
                List.of(new PlaceOrderRequest.Item(1L, 1)), 10, false, null)).getOrThrow();

        assertThat(order.getPointsUsed()).isEqualTo(3);
        assertThat(order.getPointsDiscount()).isEqualByComparingTo("3.00");
        verify(pointsService).redeemForOrder(eq(100L), any(), eq(3));
    }

    @Test
    @DisplayName("a ledger failure after the order is saved is thrown so the transaction rolls back")
    void placeOrder_RedemptionRaceRollsBack() {
        given(shopService.findOpenShop(10L)).willReturn(Result.success(openShop()));
        given(shopService.findOrderableProducts(eq(10L), anyCollection()))
                .willReturn(Result.success(Map.of(1L, product(1L, "80.00"))));
        given(pointsService.getBalance(100L)).willReturn(10);
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(pointsService.redeemForOrder(eq(100L), any(), eq(10)))
                .willReturn(Result.failure(Failure.businessRule(ErrorCode.INSUFFICIENT_POINTS)));

        assertThatThrownBy(() -> orderService.placeOrder(new PlaceOrderRequest(100L, 10L,
                List.of(new PlaceOrderRequest.Item(1L, 1)), 10, false, null)))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("shop accepts its order: history row and event are written")
    void updateStatus_ShopAccepts() {
        Order order = Fixtures.order(1L, OrderStatus.PENDING);
        given(orderRepository.findForUpdateById(1L)).willReturn(Optional.of(order));

        Order accepted = orderService.updateOrderStatus(1L, OrderStatus.ACCEPTED, 10L, ActorRole.SHOP, "on it")
                .getOrThrow();

        assertThat(accepted.getStatus()).isEqualTo(OrderStatus.ACCEPTED);
        ArgumentCaptor<OrderStatusHistory> history = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getFromStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(history.getValue().getToStatus()).isEqualTo(OrderStatus.ACCEPTED);
        assertThat(history.getValue().getNote()).isEqualTo("on it");
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("another shop cannot move the order")
    void updateStatus_ForeignShop() {
        given(orderRepository.findForUpdateById(1L)).willReturn(Optional.of(Fixtures.order(1L, OrderStatus.PENDING)));

        Result<Order> result = orderService.updateOrderStatus(1L, OrderStatus.ACCEPTED, 11L, ActorRole.SHOP, null);

        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.ACTOR_NOT_ALLOWED);
        verify(historyRepository, never()).save(any());
    }

    @Test
    @DisplayName("COMPLETED cannot be set through the generic status endpoint")
    void updateStatus_CompletedIsCashDriven() {
        Result<Order> result = orderService.updateOrderStatus(1L, OrderStatus.COMPLETED, 10L, ActorRole.SHOP, null);

        assertThat(result.failure()).isInstanceOf(Failure.BusinessRuleFailure.class);
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("unknown order is not found")
    void updateStatus_NotFound() {
        given(orderRepository.findForUpdateById(404L)).willReturn(Optional.empty());

        Result<Order> result = orderService.updateOrderStatus(404L, OrderStatus.ACCEPTED, 10L, ActorRole.SHOP, null);

        assertThat(result.failure()).isInstanceOf(Failure.NotFoundFailure.class);
    }

    @Test
    @DisplayName("cancelling refunds redeemed points and zeroes derived earnings")
    void cancel_RefundsPoints() {
        Order order = Fixtures.order(1L, OrderStatus.ACCEPTED);
        given(orderRepository.findForUpdateById(1L)).willReturn(Optional.of(order));
        given(pointsService.refundForOrder(100L, 1L, 5)).willReturn(Result.success(null));

        Order cancelled = orderService.cancelOrder(1L, 100L, ActorRole.CUSTOMER, "changed my mind").getOrThrow();

        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getShopCommission()).isEqualByComparingTo("0");
        assertThat(cancelled.getPlatformCommission()).isEqualByComparingTo("0");
        assertThat(cancelled.getRiderEarnings()).isEqualByComparingTo("0");
        assertThat(cancelled.getPointsEarned()).isZero();
        verify(pointsService).refundForOrder(100L, 1L, 5);
    }

    @Test
    @DisplayName("a rider can be assigned once")
    void assignRider_Twice() {
        Order order = Fixtures.order(1L, OrderStatus.ACCEPTED);
        given(orderRepository.findForUpdateById(1L)).willReturn(Optional.of(order));

        assertThat(orderService.assignRider(1L, 7L).isSuccess()).isTrue();
        Result<Order> second = orderService.assignRider(1L, 8L);

        assertThat(second.failure().errorCode()).isEqualTo(ErrorCode.RIDER_ALREADY_ASSIGNED);
        assertThat(order.getRiderId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("the shop's cash confirmation completes the order and runs points and referral hooks")
    void confirmCash_CompletesOrder() {
        Order order = Fixtures.order(1L, OrderStatus.PICKED_UP);
        given(orderRepository.findForUpdateById(1L)).willReturn(Optional.of(order));
        given(pointsService.earnForOrder(100L, 1L, 2)).willReturn(Result.success(null));
        given(referralBonusEngine.onOrderCompleted(order)).willReturn(Result.success(true));

        orderService.collectCash(1L, 7L).getOrThrow();
        orderService.handCashToShop(1L, 7L).getOrThrow();
        Order completed = orderService.confirmShopReceivedCash(1L, 10L).getOrThrow();

        assertThat(completed.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        verify(pointsService).earnForOrder(100L, 1L, 2);
        verify(referralBonusEngine).onOrderCompleted(order);
        verify(historyRepository, times(2)).save(any(OrderStatusHistory.class));
    }
}
