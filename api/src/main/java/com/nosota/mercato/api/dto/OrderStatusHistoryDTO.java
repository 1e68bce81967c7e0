package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.OrderStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record OrderStatusHistoryDTO(
        UUID id,
        UUID subOrderId,
        OrderStatus previousStatus,
        OrderStatus newStatus,
        String notes,
        Long changedBy,
        LocalDateTime changedAt
) {
}
