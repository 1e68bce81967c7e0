package com.nosota.mercato.repository;

import com.nosota.mercato.api.model.SettlementStatus;
import com.nosota.mercato.model.Settlement;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Settlement} entity operations.
 *
 * <p>Provides data access methods for settlement operations including:
 * <ul>
 *   <li>Locking a settlement for regeneration, adjustment and finalization</li>
 *   <li>Finding the live version of a store period</li>
 *   <li>Listing settlements of a store with or without superseded versions</li>
 * </ul>
 */
@Repository
public interface SettlementRepository extends JpaRepository<Settlement, UUID> {

    /**
     * Retrieves a settlement and locks it for update.
     * Concurrent regenerations of the same version serialize here; the loser sees SUPERSEDED.
     *
     * @param id The settlement ID
     * @return The settlement, locked for update
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Settlement s WHERE s.id = :id")
    Optional<Settlement> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Finds a settlement for the exact period that is not in the given status.
     * Called with SUPERSEDED to find the live version.
     *
     * @param storeId     The store ID
     * @param periodStart Start of the period
     * @param periodEnd   End of the period
     * @param status      Status to exclude
     * @return Matching settlement, if any
     */
    Optional<Settlement> findFirstByStoreIdAndPeriodStartAndPeriodEndAndStatusNot(
            Long storeId,
            LocalDateTime periodStart,
            LocalDateTime periodEnd,
            SettlementStatus status
    );

    long countByStoreIdAndPeriodStartAndPeriodEndAndCurrentVersionTrue(
            Long storeId,
            LocalDateTime periodStart,
            LocalDateTime periodEnd
    );

    List<Settlement> findByStoreIdOrderByPeriodStartDescVersionDesc(Long storeId);

    List<Settlement> findByStoreIdAndStatusNotOrderByPeriodStartDescVersionDesc(Long storeId, SettlementStatus status);
}
