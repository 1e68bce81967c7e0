package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.SettlementAdjustmentType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record SettlementAdjustmentDTO(
        UUID id,
        SettlementAdjustmentType type,
        BigDecimal amount,
        String description,
        UUID relatedSettlementId,
        boolean priorPeriodAdjustment,
        Long createdBy,
        LocalDateTime createdAt
) {
}
