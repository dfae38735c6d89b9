package com.baladi.points.repository;

import com.baladi.points.entity.PointsTransaction;
import com.baladi.points.entity.PointsTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PointsTransactionRepository extends JpaRepository<PointsTransaction, Long> {

    List<PointsTransaction> findByCustomerIdOrderByCreatedAtDescIdDesc(Long customerId);

    boolean existsByOrderIdAndType(Long orderId, PointsTransactionType type);
}
