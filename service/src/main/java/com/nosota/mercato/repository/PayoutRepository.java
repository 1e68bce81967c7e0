package com.nosota.mercato.repository;

import com.nosota.mercato.model.Payout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<Payout, UUID> {

    /**
     * Sums PAID payouts of a store completed within the period (both ends inclusive).
     *
     * @param storeId     The store ID
     * @param periodStart Start of the period
     * @param periodEnd   End of the period
     * @return Total paid out (or 0 if none)
     */
    @Query("""
            SELECT COALESCE(SUM(p.amount), 0)
            FROM Payout p
            WHERE p.storeId = :storeId
              AND p.status = com.nosota.mercato.api.model.PayoutStatus.PAID
              AND p.completedAt >= :periodStart
              AND p.completedAt <= :periodEnd
            """)
    BigDecimal sumPaidAmount(@Param("storeId") Long storeId,
                             @Param("periodStart") LocalDateTime periodStart,
                             @Param("periodEnd") LocalDateTime periodEnd);
}
