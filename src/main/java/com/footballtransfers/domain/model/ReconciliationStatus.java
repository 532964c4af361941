package com.footballtransfers.domain.model;

/**
 * Outcome of reconciliation for a single record.
 */
public enum ReconciliationStatus {
    /** Not yet seen by the reconciler. */
    PENDING,
    /** Matched with the counterpart club's report of the same transfer. */
    PAIRED,
    /** No counterpart report exists; kept as reported. */
    UNPAIRED
}
