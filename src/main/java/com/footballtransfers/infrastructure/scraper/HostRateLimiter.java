package com.footballtransfers.infrastructure.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * Politeness budget shared by all fetch workers.
 *
 * Each host is a leaky bucket draining one request per {@code minDelay}; a host
 * can additionally be suspended for a cooldown after a rate-limit response.
 * A global semaphore caps the number of requests in flight. All per-host state
 * is read and written under this object's monitor while holding a concurrency
 * slot; waiting happens outside both.
 */
public class HostRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(HostRateLimiter.class);

    private final Duration minDelay;
    private final Semaphore inFlight;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, HostState> hosts = new HashMap<>();

    public HostRateLimiter(Duration minDelay, int maxConcurrent, Clock clock, Sleeper sleeper) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.minDelay = minDelay;
        this.inFlight = new Semaphore(maxConcurrent, true);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    private static final class HostState {
        private Instant nextSlot = Instant.MIN;
        private Instant cooldownUntil = Instant.MIN;
    }

    /**
     * Handle for one in-flight request; closing it frees the concurrency slot.
     */
    public final class Permit implements AutoCloseable {
        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                inFlight.release();
            }
        }
    }

    /**
     * Blocks until a concurrency slot is free and the host may receive another
     * request. The host's slot and cooldown are checked only while holding the
     * concurrency slot; if the host is not ready yet the slot is handed back
     * for the wait, so a cooled-down host never holds slots other hosts could use.
     */
    public Permit acquire(String host) throws InterruptedException {
        while (true) {
            inFlight.acquire();
            Duration wait;
            try {
                wait = reserveSlot(host);
            } catch (RuntimeException e) {
                inFlight.release();
                throw e;
            }
            if (wait == null) {
                return new Permit();
            }
            inFlight.release();
            logger.debug("Waiting {} ms before next request to {}", wait.toMillis(), host);
            sleeper.sleep(wait);
        }
    }

    /**
     * Reserves the host's next slot if it is due.
     *
     * @return null when reserved, otherwise how long until the host is ready
     */
    private synchronized Duration reserveSlot(String host) {
        HostState state = hosts.computeIfAbsent(host, h -> new HostState());
        Instant now = clock.instant();
        Instant earliest = later(state.nextSlot, state.cooldownUntil);
        if (!now.isBefore(earliest)) {
            state.nextSlot = now.plus(minDelay);
            return null;
        }
        return Duration.between(now, earliest);
    }

    /**
     * Stops new requests to {@code host} for {@code cooldown}. Overlapping
     * suspensions keep the later end.
     */
    public synchronized void suspend(String host, Duration cooldown) {
        HostState state = hosts.computeIfAbsent(host, h -> new HostState());
        Instant until = clock.instant().plus(cooldown);
        state.cooldownUntil = later(state.cooldownUntil, until);
        logger.warn("Rate limited by {}; pausing requests until {}", host, state.cooldownUntil);
    }

    /** End of the host's current cooldown, or {@link Instant#MIN} if none was set. */
    public synchronized Instant cooldownUntil(String host) {
        HostState state = hosts.get(host);
        return state == null ? Instant.MIN : state.cooldownUntil;
    }

    public int availableSlots() {
        return inFlight.availablePermits();
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
