package com.nosota.mercato.repository;

import com.nosota.mercato.model.EscrowTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link EscrowTransaction} entity operations.
 */
@Repository
public interface EscrowTransactionRepository extends JpaRepository<EscrowTransaction, UUID> {

    Optional<EscrowTransaction> findBySubOrderId(UUID subOrderId);

    List<EscrowTransaction> findByOrderId(UUID orderId);

    boolean existsByOrderId(UUID orderId);

    /**
     * Finds the escrows of a store whose order was placed within the period (both ends inclusive).
     * Order placement, not delivery, defines period membership.
     *
     * @param storeId     The store ID
     * @param periodStart Start of the period
     * @param periodEnd   End of the period
     * @return Escrows ordered by order placement time
     */
    @Query("""
            SELECT e
            FROM EscrowTransaction e, Order o
            WHERE e.orderId = o.id
              AND e.storeId = :storeId
              AND o.orderedAt >= :periodStart
              AND o.orderedAt <= :periodEnd
            ORDER BY o.orderedAt, e.id
            """)
    List<EscrowTransaction> findByStoreIdAndOrderedAtBetween(@Param("storeId") Long storeId,
                                                             @Param("periodStart") LocalDateTime periodStart,
                                                             @Param("periodEnd") LocalDateTime periodEnd);
}
