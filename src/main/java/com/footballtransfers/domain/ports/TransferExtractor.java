package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.RawRow;

import java.util.List;

/**
 * Port for turning a fetched page into raw transfer rows.
 */
public interface TransferExtractor {

    /**
     * Extracts every transfer row of the page. Header, advert and
     * "no transfers" rows are skipped.
     *
     * @param page fetched page
     * @return rows in page order, possibly empty
     * @throws ExtractionException if the page layout is not recognized
     */
    List<RawRow> extract(RawPage page) throws ExtractionException;
}
