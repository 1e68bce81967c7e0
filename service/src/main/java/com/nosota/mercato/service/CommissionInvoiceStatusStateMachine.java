package com.nosota.mercato.service;

import com.nosota.mercato.api.model.CommissionInvoiceStatus;
import com.nosota.mercato.error.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for commission invoice statuses.
 *
 * <p>State diagram:
 * <pre>
 * DRAFT ──► ISSUED ──► PAID
 *   │         │         │
 *   ├─────────┴──► CANCELLED
 *   └─────────┴─────────┴──► SUPERSEDED   (credit note)
 * </pre>
 *
 * <p>A PAID invoice cannot be cancelled; it is corrected with a credit note instead.
 */
@Component
public class CommissionInvoiceStatusStateMachine {

    private static final Map<CommissionInvoiceStatus, Set<CommissionInvoiceStatus>> ALLOWED_TRANSITIONS = Map.of(
            CommissionInvoiceStatus.DRAFT, EnumSet.of(
                    CommissionInvoiceStatus.ISSUED,
                    CommissionInvoiceStatus.CANCELLED,
                    CommissionInvoiceStatus.SUPERSEDED
            ),
            CommissionInvoiceStatus.ISSUED, EnumSet.of(
                    CommissionInvoiceStatus.PAID,
                    CommissionInvoiceStatus.CANCELLED,
                    CommissionInvoiceStatus.SUPERSEDED
            ),
            CommissionInvoiceStatus.PAID, EnumSet.of(CommissionInvoiceStatus.SUPERSEDED)
    );

    public boolean isTransitionAllowed(CommissionInvoiceStatus fromStatus, CommissionInvoiceStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<CommissionInvoiceStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws StateConflictException if transition is not allowed
     */
    public void validateTransition(CommissionInvoiceStatus fromStatus, CommissionInvoiceStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new StateConflictException(
                    String.format("Invalid invoice status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }
}
