package com.footballtransfers.domain.model;

import java.net.URI;
import java.time.Instant;

/**
 * A fetched listing page, before any parsing.
 */
public record RawPage(ScrapeContext context, String url, int statusCode, String body, Instant fetchedAt) {

    public String host() {
        return URI.create(url).getHost();
    }
}
