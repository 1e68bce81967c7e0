package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.RefundInitiator;
import com.nosota.mercato.api.model.RefundStatus;
import com.nosota.mercato.api.model.RefundType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Refund record as seen by callers.
 *
 * @param subOrderId      Null for the order-level record of a full refund
 * @param errorMessage    Last provider error, set while FAILED
 * @param attemptCount    Provider calls made so far
 */
public record RefundTransactionDTO(
        UUID id,
        String refundNumber,
        UUID orderId,
        UUID subOrderId,
        RefundType refundType,
        BigDecimal amount,
        BigDecimal commissionRefundAmount,
        String currency,
        RefundStatus status,
        RefundInitiator initiator,
        Long initiatedBy,
        UUID returnRequestId,
        String reason,
        String providerRefundId,
        String errorMessage,
        Integer attemptCount,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
}
