package com.baladi.order.repository;

import com.baladi.order.entity.Order;
import com.baladi.order.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    @EntityGraph(attributePaths = {"items"})
    Optional<Order> findWithItemsById(Long id);

    /**
     * SELECT ... FOR UPDATE. Shop, rider and admin can act on the same order
     * near-simultaneously; the row lock makes them queue instead of racing.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findForUpdateById(@Param("id") Long id);

    List<Order> findByCustomerIdOrderByPlacedAtDesc(Long customerId);

    /** Every order placed in {@code [start, end)}, whatever its status. */
    @Query("SELECT o FROM Order o WHERE o.placedAt >= :start AND o.placedAt < :end ORDER BY o.id")
    List<Order> findForSettlement(@Param("start") Instant start, @Param("end") Instant end);

    /** Completed orders placed before {@code start} that no closed period has picked up yet. */
    @Query("SELECT o FROM Order o WHERE o.status = com.baladi.order.entity.OrderStatus.COMPLETED "
            + "AND o.weeklyPeriodId IS NULL AND o.placedAt < :start ORDER BY o.id")
    List<Order> findUnsettledCompletedBefore(@Param("start") Instant start);

    long countByCustomerIdAndStatusAndIdNot(Long customerId, OrderStatus status, Long excludedOrderId);

    boolean existsByOrderNumber(String orderNumber);
}
