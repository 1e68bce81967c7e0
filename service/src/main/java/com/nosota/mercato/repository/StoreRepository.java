package com.nosota.mercato.repository;

import com.nosota.mercato.api.model.StoreStatus;
import com.nosota.mercato.model.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoreRepository extends JpaRepository<Store, Long> {

    List<Store> findByStatusOrderByIdAsc(StoreStatus status);
}
