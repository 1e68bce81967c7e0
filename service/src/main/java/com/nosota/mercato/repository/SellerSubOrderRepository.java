package com.nosota.mercato.repository;

import com.nosota.mercato.model.SellerSubOrder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SellerSubOrderRepository extends JpaRepository<SellerSubOrder, UUID> {

    /**
     * Retrieves a sub-order and locks it for update.
     * Serializes concurrent refunds and status changes on the same sub-order.
     *
     * @param id The sub-order ID
     * @return The sub-order, locked for update
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SellerSubOrder s WHERE s.id = :id")
    Optional<SellerSubOrder> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Locks every sub-order of an order, in id order so concurrent lockers cannot deadlock.
     *
     * @param orderId The order ID
     * @return Sub-orders of the order, locked for update
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SellerSubOrder s WHERE s.orderId = :orderId ORDER BY s.id")
    List<SellerSubOrder> findByOrderIdForUpdate(@Param("orderId") UUID orderId);

    List<SellerSubOrder> findByOrderId(UUID orderId);
}
