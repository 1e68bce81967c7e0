package com.nosota.mercato.repository;

import com.nosota.mercato.model.CommissionConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CommissionConfigRepository extends JpaRepository<CommissionConfig, Long> {

    /**
     * Finds the active global configuration, newest first if several were left active.
     *
     * @return Active configuration, if any
     */
    Optional<CommissionConfig> findFirstByActiveTrueOrderByEffectiveFromDesc();
}
