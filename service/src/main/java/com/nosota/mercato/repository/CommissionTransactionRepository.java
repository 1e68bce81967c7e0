package com.nosota.mercato.repository;

import com.nosota.mercato.api.model.CommissionTransactionType;
import com.nosota.mercato.model.CommissionTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link CommissionTransaction} audit records. Insert and read only.
 */
@Repository
public interface CommissionTransactionRepository extends JpaRepository<CommissionTransaction, UUID> {

    /**
     * Finds the most recent transaction of a type for an escrow.
     * Used to locate the INITIAL charge a refund is reversed against.
     *
     * @param escrowTransactionId The escrow transaction ID
     * @param transactionType     The transaction type
     * @return Latest matching transaction, if any
     */
    Optional<CommissionTransaction> findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
            UUID escrowTransactionId,
            CommissionTransactionType transactionType
    );

    List<CommissionTransaction> findByEscrowTransactionIdOrderByCreatedAtAsc(UUID escrowTransactionId);

    /**
     * Finds transactions of a store created in {@code [from, to)}.
     *
     * @param storeId The store ID
     * @param from    Inclusive lower bound
     * @param to      Exclusive upper bound
     * @return Transactions ordered by creation time
     */
    List<CommissionTransaction> findByStoreIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
            Long storeId,
            LocalDateTime from,
            LocalDateTime to
    );

    /**
     * Sums commission over all stores for a date range (both ends inclusive).
     *
     * @param from Start of the range
     * @param to   End of the range
     * @return Net commission, refund adjustments included (0 if none)
     */
    @Query("""
            SELECT COALESCE(SUM(c.commissionAmount), 0)
            FROM CommissionTransaction c
            WHERE c.createdAt >= :from
              AND c.createdAt <= :to
            """)
    BigDecimal sumCommissionBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
