package com.nosota.mercato.repository;

import com.nosota.mercato.api.model.RefundStatus;
import com.nosota.mercato.model.RefundTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Repository for {@link RefundTransaction} entity operations.
 *
 * <p>Provides data access methods for refund operations including:
 * <ul>
 *   <li>Finding refunds by order</li>
 *   <li>Finding refunds by store and status</li>
 *   <li>Calculating total refunded amount of an order</li>
 * </ul>
 */
@Repository
public interface RefundTransactionRepository extends JpaRepository<RefundTransaction, UUID> {

    List<RefundTransaction> findByOrderIdOrderByCreatedAtDesc(UUID orderId);

    List<RefundTransaction> findByStoreIdOrderByCreatedAtDesc(Long storeId);

    List<RefundTransaction> findByStoreIdAndStatusOrderByCreatedAtDesc(Long storeId, RefundStatus status);

    boolean existsByRefundNumber(String refundNumber);

    /**
     * Calculates the amount actually returned for an order.
     *
     * @param orderId The order ID
     * @return Sum of COMPLETED refunds (or 0 if none)
     */
    @Query("""
            SELECT COALESCE(SUM(r.amount), 0)
            FROM RefundTransaction r
            WHERE r.orderId = :orderId
              AND r.status = com.nosota.mercato.api.model.RefundStatus.COMPLETED
            """)
    BigDecimal sumCompletedAmountByOrderId(@Param("orderId") UUID orderId);
}
