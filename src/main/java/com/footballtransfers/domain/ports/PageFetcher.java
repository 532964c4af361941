package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.ScrapeContext;

/**
 * Port for retrieving transfer listing pages.
 */
public interface PageFetcher {

    /**
     * Fetches the transfer page of one club for one season and window.
     * Politeness delays, retries and rate-limit cooldowns happen inside.
     *
     * @param context league, season, window and club to fetch
     * @return the fetched page
     * @throws FetchException when the page could not be retrieved after retries,
     *                        or immediately for terminal failures
     */
    RawPage fetch(ScrapeContext context) throws FetchException;
}
