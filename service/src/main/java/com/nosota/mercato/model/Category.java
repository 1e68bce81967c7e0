package com.nosota.mercato.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Product category. Read-only lookup data; a category override wins over store and global rates.
 */
@Entity
@Table(name = "category")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "commission_percentage_override", precision = 7, scale = 4)
    private BigDecimal commissionPercentageOverride;

    @Column(name = "fixed_commission_amount_override", precision = 19, scale = 2)
    private BigDecimal fixedCommissionAmountOverride;

    public boolean hasCommissionOverride() {
        return commissionPercentageOverride != null || fixedCommissionAmountOverride != null;
    }
}
