package com.footballtransfers.domain.error;

import com.footballtransfers.domain.model.TransferKey;

/**
 * The two clubs reported different values for the same transfer. Not an
 * error: the conflict is resolved and kept for the run report.
 *
 * @param key       transfer the reports belong to
 * @param field     dataset column that disagreed
 * @param inValue   value on the buying club's page
 * @param outValue  value on the selling club's page
 * @param resolved  value written to both records
 */
public record ReconciliationConflict(TransferKey key, String field, String inValue, String outValue, String resolved) {
}
