package com.nosota.mercato.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Platform-wide commission rate. At most one row is expected to be active.
 */
@Entity
@Table(name = "commission_config")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CommissionConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "global_commission_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal globalCommissionPercentage;

    @Column(name = "global_fixed_commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal globalFixedCommissionAmount;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "effective_from", nullable = false)
    private LocalDateTime effectiveFrom;
}
