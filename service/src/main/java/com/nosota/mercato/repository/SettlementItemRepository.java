package com.nosota.mercato.repository;

import com.nosota.mercato.model.SettlementItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementItemRepository extends JpaRepository<SettlementItem, UUID> {

    List<SettlementItem> findBySettlementIdOrderByOrderedAtAsc(UUID settlementId);
}
