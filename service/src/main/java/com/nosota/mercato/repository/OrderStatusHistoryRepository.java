package com.nosota.mercato.repository;

import com.nosota.mercato.model.OrderStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrderStatusHistoryRepository extends JpaRepository<OrderStatusHistory, UUID> {

    List<OrderStatusHistory> findBySubOrderIdOrderByChangedAtAsc(UUID subOrderId);
}
