package com.nosota.mercato.model;

import com.nosota.mercato.api.model.StoreStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Seller store. Read-only lookup data for this service.
 *
 * <p>A non-null {@code commissionPercentageOverride} or {@code fixedCommissionAmountOverride}
 * replaces the global commission configuration for the store.
 */
@Entity
@Table(name = "store")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Store {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "store_name", nullable = false, length = 200)
    private String storeName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private StoreStatus status;

    @Column(name = "commission_percentage_override", precision = 7, scale = 4)
    private BigDecimal commissionPercentageOverride;

    @Column(name = "fixed_commission_amount_override", precision = 19, scale = 2)
    private BigDecimal fixedCommissionAmountOverride;

    public boolean hasCommissionOverride() {
        return commissionPercentageOverride != null || fixedCommissionAmountOverride != null;
    }
}
