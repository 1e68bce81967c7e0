package com.nosota.mercato.api.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record CommissionInvoiceItemDTO(
        UUID id,
        UUID commissionTransactionId,
        String description,
        BigDecimal amount
) {
}
