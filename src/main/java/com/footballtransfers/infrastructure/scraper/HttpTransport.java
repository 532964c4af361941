package com.footballtransfers.infrastructure.scraper;

import java.io.IOException;
import java.util.Map;

/**
 * Minimal HTTP GET capability the fetcher depends on.
 */
public interface HttpTransport {

    /**
     * Issues a GET. Non-2xx statuses are returned, not thrown.
     *
     * @throws IOException on connection failures and timeouts
     */
    HttpResult get(String url, Map<String, String> headers) throws IOException;

    /**
     * @param statusCode HTTP status
     * @param headers    response headers, names lower-cased
     * @param body       decoded body, empty when absent
     */
    record HttpResult(int statusCode, Map<String, String> headers, String body) {

        public String header(String name) {
            return headers.get(name.toLowerCase(java.util.Locale.ROOT));
        }
    }
}
