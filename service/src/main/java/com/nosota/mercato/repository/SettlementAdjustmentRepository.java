package com.nosota.mercato.repository;

import com.nosota.mercato.model.SettlementAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementAdjustmentRepository extends JpaRepository<SettlementAdjustment, UUID> {

    List<SettlementAdjustment> findBySettlementIdOrderByCreatedAtAsc(UUID settlementId);
}
