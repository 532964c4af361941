package com.footballtransfers.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link HttpTransport} backed by a shared, pooled Apache HttpClient.
 */
public class ApacheHttpTransport implements HttpTransport, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ApacheHttpTransport.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;

    public ApacheHttpTransport(Duration connectTimeout, Duration responseTimeout, int maxConnections) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnections);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.of(connectTimeout))
            .setSocketTimeout(Timeout.of(responseTimeout))
            .build());

        this.httpClient = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.of(responseTimeout))
                .build())
            .build();
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.debug("Response body preview: {}", preview);
    }

    @Override
    public HttpResult get(String url, Map<String, String> headers) throws IOException {
        HttpGet request = new HttpGet(url);

        if (headers != null) {
            headers.forEach(request::addHeader);
        }

        logger.debug("GET {}", url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();

            Map<String, String> responseHeaders = new HashMap<>();
            for (Header header : response.getHeaders()) {
                responseHeaders.put(header.getName().toLowerCase(Locale.ROOT), header.getValue());
            }

            HttpEntity entity = response.getEntity();
            String responseBody;
            try {
                responseBody = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
            } catch (ParseException e) {
                throw new IOException("Failed to parse response", e);
            }

            if (statusCode < 200 || statusCode >= 300) {
                logger.debug("HTTP request to {} returned status {}", url, statusCode);
                logResponseBodyPreview(responseBody);
            }
            return new HttpResult(statusCode, responseHeaders, responseBody);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
