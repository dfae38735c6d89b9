package com.baladi.order.repository;

import com.baladi.order.entity.CashTransaction;
import com.baladi.order.entity.CashTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CashTransactionRepository extends JpaRepository<CashTransaction, Long> {

    List<CashTransaction> findByOrderIdOrderByCreatedAtAsc(Long orderId);

    Optional<CashTransaction> findByOrderIdAndType(Long orderId, CashTransactionType type);
}
