package com.footballtransfers.infrastructure.scraper;

import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.RunCancellation;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.ports.PageFetcher;
import com.footballtransfers.infrastructure.scraper.transfermarkt.TransfermarktUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Fetches pages over HTTP with politeness delays, bounded retries and
 * rate-limit cooldowns.
 *
 * Transient failures (I/O errors, timeouts, 5xx, truncated bodies) are retried
 * with exponential backoff and jitter. 4xx responses other than 429 fail at
 * once. A 429 suspends the host in the shared {@link HostRateLimiter} for the
 * time the server asked for, then the attempt is retried.
 */
public class HttpPageFetcher implements PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpPageFetcher.class);

    private static final int TOO_MANY_REQUESTS = 429;

    private final HttpTransport transport;
    private final HostRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration defaultCooldown;
    private final TransfermarktUrls urls;
    private final RunCancellation cancellation;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;

    public HttpPageFetcher(HttpTransport transport,
                           HostRateLimiter rateLimiter,
                           RetryPolicy retryPolicy,
                           Duration defaultCooldown,
                           TransfermarktUrls urls,
                           RunCancellation cancellation,
                           Clock clock,
                           Sleeper sleeper,
                           Random random) {
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.defaultCooldown = defaultCooldown;
        this.urls = urls;
        this.cancellation = cancellation;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    @Override
    public RawPage fetch(ScrapeContext context) throws FetchException {
        String url = urls.clubTransfers(context);
        String body = fetchBody(url);
        return new RawPage(context, url, 200, body, clock.instant());
    }

    /**
     * Fetches any page of the source site and returns its body.
     */
    public String fetchBody(String url) throws FetchException {
        String host = URI.create(url).getHost();
        FetchException lastFailure = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            if (cancellation.isCancelled()) {
                throw new FetchException(FetchException.Kind.CANCELLED, -1, url, "Run cancelled before fetching " + url);
            }

            HttpTransport.HttpResult result;
            try (HostRateLimiter.Permit permit = rateLimiter.acquire(host)) {
                result = transport.get(url, requestHeaders());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(FetchException.Kind.CANCELLED, -1, url, "Interrupted while fetching " + url, e);
            } catch (IOException e) {
                lastFailure = new FetchException(FetchException.Kind.TRANSIENT, -1, url,
                    "I/O failure fetching " + url + ": " + e.getMessage(), e);
                result = null;
            }

            if (result != null) {
                lastFailure = classify(url, host, result);
                if (lastFailure == null) {
                    logger.debug("Fetched {} on attempt {}", url, attempt);
                    return result.body();
                }
                if (lastFailure.getKind() == FetchException.Kind.TERMINAL) {
                    logger.warn("Giving up on {}: {}", url, lastFailure.getMessage());
                    throw lastFailure;
                }
            }

            if (attempt < retryPolicy.maxAttempts() && lastFailure.getKind() == FetchException.Kind.TRANSIENT) {
                Duration backoff = retryPolicy.backoff(attempt, random);
                logger.info("Attempt {}/{} for {} failed ({}); retrying in {} ms",
                    attempt, retryPolicy.maxAttempts(), url, lastFailure.getMessage(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchException(FetchException.Kind.CANCELLED, -1, url, "Interrupted while backing off", e);
                }
            }
        }

        logger.warn("Exhausted {} attempts for {}: {}", retryPolicy.maxAttempts(), url, lastFailure.getMessage());
        throw lastFailure;
    }

    /**
     * @return null when the response is usable, otherwise the failure it represents
     */
    private FetchException classify(String url, String host, HttpTransport.HttpResult result) {
        int status = result.statusCode();
        if (status >= 200 && status < 300) {
            if (isTruncated(result.body())) {
                return new FetchException(FetchException.Kind.TRANSIENT, status, url, "Truncated or empty body");
            }
            return null;
        }
        if (status == TOO_MANY_REQUESTS) {
            Duration cooldown = retryAfter(result.header("Retry-After"));
            rateLimiter.suspend(host, cooldown);
            return new FetchException(FetchException.Kind.RATE_LIMITED, status, url,
                "Rate limited, cooling down for " + cooldown.toSeconds() + " s");
        }
        if (status >= 500) {
            return new FetchException(FetchException.Kind.TRANSIENT, status, url, "Server error " + status);
        }
        return new FetchException(FetchException.Kind.TERMINAL, status, url, "HTTP status " + status);
    }

    private static boolean isTruncated(String body) {
        if (body == null || body.isBlank()) {
            return true;
        }
        return !body.toLowerCase(Locale.ROOT).contains("</html>");
    }

    /**
     * Reads a Retry-After header given either in seconds or as an HTTP date.
     */
    Duration retryAfter(String header) {
        if (header == null || header.isBlank()) {
            return defaultCooldown;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds > 0 ? Duration.ofSeconds(seconds) : defaultCooldown;
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try the date form
        }
        try {
            Instant until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(clock.instant(), until);
            return wait.isNegative() || wait.isZero() ? defaultCooldown : wait;
        } catch (DateTimeParseException e) {
            logger.debug("Unreadable Retry-After header '{}', using default cooldown", value);
            return defaultCooldown;
        }
    }

    private Map<String, String> requestHeaders() {
        return Map.of(
            "accept", "text/html,application/xhtml+xml",
            "accept-language", "en-US,en;q=0.9",
            "user-agent", UserAgents.pick(random)
        );
    }
}
