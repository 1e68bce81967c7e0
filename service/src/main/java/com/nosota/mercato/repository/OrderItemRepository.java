package com.nosota.mercato.repository;

import com.nosota.mercato.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, UUID> {

    List<OrderItem> findBySubOrderIdOrderByIdAsc(UUID subOrderId);
}
