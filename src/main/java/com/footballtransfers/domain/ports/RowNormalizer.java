package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.error.NormalizationException;
import com.footballtransfers.domain.model.RawRow;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.model.TransferRecord;

/**
 * Port for converting raw rows into typed records.
 */
public interface RowNormalizer {

    /**
     * @param row     raw row from the extractor
     * @param context page context supplied by the caller
     * @return typed record
     * @throws NormalizationException if the row fails a data-quality check
     */
    TransferRecord normalize(RawRow row, ScrapeContext context) throws NormalizationException;
}
