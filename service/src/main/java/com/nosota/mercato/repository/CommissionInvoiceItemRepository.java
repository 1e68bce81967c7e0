package com.nosota.mercato.repository;

import com.nosota.mercato.model.CommissionInvoiceItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CommissionInvoiceItemRepository extends JpaRepository<CommissionInvoiceItem, UUID> {

    List<CommissionInvoiceItem> findByInvoiceIdOrderByIdAsc(UUID invoiceId);
}
