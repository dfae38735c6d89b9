package com.baladi.order.service;

import com.baladi.common.config.BaladiProperties;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Order workflow: placement, status changes, rider assignment and cash custody.
 *
 * <p>Every mutating method loads the order with {@code SELECT ... FOR UPDATE}, so two
 * actors working on the same order are serialized. Validation happens before any write
 * and comes back as a failed {@link Result}. A failure from a step that runs after the
 * first write (points ledger, referral bonus) is thrown with {@code getOrThrow()} so the
 * whole transaction rolls back; an order is never persisted without its points rows.</p>
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class OrderService {

    static final int MAX_ITEMS = 50;
    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String ORDER_NUMBER_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final CashTransactionRepository cashTransactionRepository;
    private final ShopService shopService;
    private final PointsService pointsService;
    private final ReferralBonusEngine referralBonusEngine;
    private final OrderStatusStateMachine stateMachine;
    private final CommissionAndPointsCalculator calculator;
    private final CashCustodyTracker cashCustodyTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final BigDecimal defaultDeliveryFee;
    private final ZoneId zone;

    public OrderService(OrderRepository orderRepository,
                        OrderStatusHistoryRepository historyRepository,
                        CashTransactionRepository cashTransactionRepository,
                        ShopService shopService,
                        PointsService pointsService,
                        ReferralBonusEngine referralBonusEngine,
                        OrderStatusStateMachine stateMachine,
                        CommissionAndPointsCalculator calculator,
                        CashCustodyTracker cashCustodyTracker,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock,
                        BaladiProperties properties) {
        this.orderRepository = orderRepository;
        this.historyRepository = historyRepository;
        this.cashTransactionRepository = cashTransactionRepository;
        this.shopService = shopService;
        this.pointsService = pointsService;
        this.referralBonusEngine = referralBonusEngine;
        this.stateMachine = stateMachine;
        this.calculator = calculator;
        this.cashCustodyTracker = cashCustodyTracker;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.defaultDeliveryFee = properties.order().defaultDeliveryFee();
        this.zone = properties.settlement().zone();
    }

    @Transactional
    public Result<Order> placeOrder(PlaceOrderRequest request) {
        if (request.items() == null || request.items().isEmpty() || request.items().size() > MAX_ITEMS) {
            return Result.failure(Failure.validation("An order needs between 1 and " + MAX_ITEMS + " items"));
        }
        if (request.items().stream().anyMatch(item -> item.productId() == null || item.quantity() <= 0)) {
            return Result.failure(Failure.validation("Every item needs a product and a positive quantity"));
        }

        // Same product listed twice becomes one line
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        request.items().forEach(item -> quantities.merge(item.productId(), item.quantity(), Integer::sum));

        Result<Shop> shopResult = shopService.findOpenShop(request.shopId());
        if (shopResult.isFailure()) {
            return Result.failure(shopResult.failure());
        }
        Shop shop = shopResult.getOrThrow();

        Result<Map<Long, Product>> productsResult =
                shopService.findOrderableProducts(shop.getId(), quantities.keySet());
        if (productsResult.isFailure()) {
            return Result.failure(productsResult.failure());
        }
        Map<Long, Product> products = productsResult.getOrThrow();

        List<OrderItem> items = quantities.entrySet().stream()
                .map(entry -> {
                    Product product = products.get(entry.getKey());
                    return OrderItem.builder()
                            .productId(product.getId())
                            .productName(product.getName())
                            .unitPrice(product.getPrice())
                            .quantity(entry.getValue())
                            .build();
                })
                .toList();
        BigDecimal subtotal = items.stream().map(OrderItem::getSubtotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal deliveryFee = shop.getDeliveryFee() != null ? shop.getDeliveryFee() : defaultDeliveryFee;
        int balance = pointsService.getBalance(request.customerId());

        Result<OrderPricing> pricingResult = calculator.calculate(subtotal, deliveryFee, shop.getCommissionRate(),
                request.pointsToRedeem(), balance, request.freeDelivery());
        if (pricingResult.isFailure()) {
            log.warn("Order rejected: customerId={}, reason={}", request.customerId(), pricingResult.failure().message());
            return Result.failure(pricingResult.failure());
        }
        OrderPricing pricing = pricingResult.getOrThrow();

        Instant now = clock.instant();
        Order order = Order.builder()
                .orderNumber(newOrderNumber(now))
                .customerId(request.customerId())
                .shopId(shop.getId())
                .deliveryAddress(request.deliveryAddress())
                .pricing(pricing)
                .placedAt(now)
                .build();
        items.forEach(order::addItem);
        order = orderRepository.save(order);

        if (pricing.pointsUsed() > 0) {
            pointsService.redeemForOrder(order.getCustomerId(), order.getId(), pricing.pointsUsed()).getOrThrow();
        }

        log.info("Order placed: orderId={}, orderNumber={}, shopId={}, subtotal={}, total={}",
                order.getId(), order.getOrderNumber(), shop.getId(), pricing.subtotal(), pricing.total());
        return Result.success(order);
    }

    public Result<Order> getOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .<Result<Order>>map(Result::success)
                .orElseGet(() -> Result.failure(Failure.notFound(ErrorCode.ORDER_NOT_FOUND)));
    }

    public List<Order> getOrdersByCustomer(Long customerId) {
        return orderRepository.findByCustomerIdOrderByPlacedAtDesc(customerId);
    }

    public List<OrderStatusHistory> getStatusHistory(Long orderId) {
        return historyRepository.findByOrderIdOrderByChangedAtAsc(orderId);
    }

    public List<CashTransaction> getCashTransactions(Long orderId) {
        return cashTransactionRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    /**
     * Generic status change. SHOP_PAID and COMPLETED are reached only through the
     * cash hand-over and the shop's cash confirmation.
     */
    @Transactional
    public Result<Order> updateOrderStatus(Long orderId, OrderStatus newStatus, Long actorId,
                                           ActorRole actorRole, String note) {
        if (newStatus == OrderStatus.SHOP_PAID || newStatus == OrderStatus.COMPLETED) {
            return Result.failure(Failure.businessRule(ErrorCode.INVALID_ORDER_STATUS,
                    newStatus + " is set by the cash hand-over, not directly"));
        }
        if (newStatus == OrderStatus.CANCELLED) {
            return cancelOrder(orderId, actorId, actorRole, note);
        }
        return withLockedOrder(orderId, order -> checkActor(order, actorId, actorRole)
                .flatMap(owned -> applyTransition(owned, newStatus, actorId, actorRole, note)));
    }

    /** Cancels and gives redeemed points back. Derived earnings are zeroed. */
    @Transactional
    public Result<Order> cancelOrder(Long orderId, Long actorId, ActorRole actorRole, String note) {
        return withLockedOrder(orderId, order -> checkActor(order, actorId, actorRole)
                .flatMap(owned -> applyTransition(owned, OrderStatus.CANCELLED, actorId, actorRole, note))
                .peek(cancelled -> {
                    cancelled.clearEarningsOnCancel();
                    pointsService.refundForOrder(cancelled.getCustomerId(), cancelled.getId(),
                            cancelled.getPointsUsed()).getOrThrow();
                }));
    }

    @Transactional
    public Result<Order> assignRider(Long orderId, Long riderId) {
        if (riderId == null) {
            return Result.failure(Failure.validation("Rider is required"));
        }
        return withLockedOrder(orderId, order -> {
            if (order.getRiderId() != null) {
                return Result.failure(Failure.businessRule(ErrorCode.RIDER_ALREADY_ASSIGNED));
            }
            if (order.getStatus() != OrderStatus.ACCEPTED && order.getStatus() != OrderStatus.PREPARING) {
                return Result.failure(Failure.businessRule(ErrorCode.INVALID_ORDER_STATUS,
                        "A rider can only be assigned to an accepted or preparing order"));
            }
            order.assignRider(riderId);
            log.info("Rider assigned: orderId={}, riderId={}", orderId, riderId);
            return Result.success(order);
        });
    }

    @Transactional
    public Result<Order> collectCash(Long orderId, Long riderId) {
        return withLockedOrder(orderId, order -> cashCustodyTracker.markCashCollected(order, riderId));
    }

    @Transactional
    public Result<Order> handCashToShop(Long orderId, Long riderId) {
        return withLockedOrder(orderId, order -> {
            OrderStatus from = order.getStatus();
            return cashCustodyTracker.markCashTransferredToShop(order, riderId)
                    .peek(paid -> recordTransition(paid, from, riderId, ActorRole.RIDER, "Cash handed to shop"));
        });
    }

    /** The shop's confirmation completes the order and runs the completion hooks. */
    @Transactional
    public Result<Order> confirmShopReceivedCash(Long orderId, Long shopId) {
        return withLockedOrder(orderId, order -> {
            OrderStatus from = order.getStatus();
            return cashCustodyTracker.confirmShopReceivedCash(order, shopId)
                    .peek(completed -> {
                        recordTransition(completed, from, shopId, ActorRole.SHOP, "Cash received by shop");
                        onCompleted(completed);
                    });
        });
    }

    private void onCompleted(Order order) {
        pointsService.earnForOrder(order.getCustomerId(), order.getId(), order.getPointsEarned()).getOrThrow();
        referralBonusEngine.onOrderCompleted(order).getOrThrow();
    }

    private Result<Order> applyTransition(Order order, OrderStatus target, Long actorId,
                                          ActorRole actorRole, String note) {
        OrderStatus from = order.getStatus();
        return stateMachine.transition(order, target, actorRole)
                .peek(moved -> recordTransition(moved, from, actorId, actorRole, note));
    }

    private void recordTransition(Order order, OrderStatus from, Long actorId, ActorRole actorRole, String note) {
        Instant now = clock.instant();
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .fromStatus(from)
                .toStatus(order.getStatus())
                .actorId(actorId)
                .actorRole(actorRole)
                .note(note)
                .changedAt(now)
                .build());
        eventPublisher.publishEvent(new OrderStatusChangedEvent(order.getId(), order.getCustomerId(),
                order.getShopId(), order.getRiderId(), from, order.getStatus(), actorRole, now));
    }

    /** Admins act on any order; everyone else only on orders they are party to. */
    private static Result<Order> checkActor(Order order, Long actorId, ActorRole actorRole) {
        if (actorRole == null || actorId == null) {
            return Result.failure(Failure.validation("Actor id and role are required"));
        }
        boolean party = switch (actorRole) {
            case ADMIN -> true;
            case CUSTOMER -> order.getCustomerId().equals(actorId);
            case SHOP -> order.getShopId().equals(actorId);
            case RIDER -> order.isAssignedTo(actorId);
        };
        if (!party) {
            return Result.failure(Failure.validation(ErrorCode.ACTOR_NOT_ALLOWED,
                    actorRole + " " + actorId + " is not a party to order " + order.getId()));
        }
        return Result.success(order);
    }

    private Result<Order> withLockedOrder(Long orderId, Function<Order, Result<Order>> action) {
        return orderRepository.findForUpdateById(orderId)
                .map(action)
                .orElseGet(() -> Result.failure(Failure.notFound(ErrorCode.ORDER_NOT_FOUND)));
    }

    private String newOrderNumber(Instant now) {
        String date = ORDER_DATE.format(now.atZone(zone));
        String number;
        do {
            StringBuilder suffix = new StringBuilder(6);
            for (int i = 0; i < 6; i++) {
                suffix.append(ORDER_NUMBER_ALPHABET.charAt(RANDOM.nextInt(ORDER_NUMBER_ALPHABET.length())));
            }
            number = "BLD-" + date + "-" + suffix;
        } while (orderRepository.existsByOrderNumber(number));
        return number;
    }
}
