package com.nosota.mercato.repository;

import com.nosota.mercato.api.model.CommissionInvoiceStatus;
import com.nosota.mercato.model.CommissionInvoice;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link CommissionInvoice} entity operations.
 */
@Repository
public interface CommissionInvoiceRepository extends JpaRepository<CommissionInvoice, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CommissionInvoice i WHERE i.id = :id")
    Optional<CommissionInvoice> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Finds a regular (non credit note) invoice for the exact period whose status is not excluded.
     *
     * @param storeId     The store ID
     * @param periodStart First day of the period
     * @param periodEnd   Last day of the period
     * @param excluded    Statuses to ignore (CANCELLED, SUPERSEDED)
     * @return Live invoice of the period, if any
     */
    Optional<CommissionInvoice> findFirstByStoreIdAndPeriodStartAndPeriodEndAndCreditNoteFalseAndStatusNotIn(
            Long storeId,
            LocalDate periodStart,
            LocalDate periodEnd,
            Collection<CommissionInvoiceStatus> excluded
    );

    /**
     * Finds the invoice with the highest number for a prefix such as {@code INV-2024-}.
     * Sequences are zero padded, so the lexical maximum is the numeric maximum.
     *
     * @param prefix Invoice number prefix
     * @return Highest numbered invoice, if any
     */
    Optional<CommissionInvoice> findFirstByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(String prefix);

    List<CommissionInvoice> findByStoreIdOrderByPeriodStartDescCreatedAtDesc(Long storeId);

    List<CommissionInvoice> findByStoreIdAndStatusNotOrderByPeriodStartDescCreatedAtDesc(
            Long storeId,
            CommissionInvoiceStatus status
    );
}
