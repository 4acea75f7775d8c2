package com.libraryindex.agent.search;

import com.libraryindex.agent.exception.ResearchException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Paces calls to the academic search API: one request per {@code minInterval}.
 *
 * One instance is shared across all sessions: the provider's limit applies to
 * this process as a whole, not to a session. Backed by a resilience4j
 * {@link RateLimiter} with one permit per refresh period; waiting callers reserve
 * successive periods, so concurrent sessions queue up instead of bursting.
 */
@Slf4j
public class SearchRateLimiter {

    static final Duration MAX_WAIT = Duration.ofMinutes(5);

    private final RateLimiter rateLimiter;
    private final Duration maxWait;

    public SearchRateLimiter(Duration minInterval) {
        this(minInterval, MAX_WAIT);
    }

    SearchRateLimiter(Duration minInterval, Duration maxWait) {
        this.maxWait = maxWait;
        if (minInterval.isZero() || minInterval.isNegative()) {
            this.rateLimiter = null;
            return;
        }
        this.rateLimiter = RateLimiter.of("academic-search", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(minInterval)
                .timeoutDuration(maxWait)
                .build());
    }

    /**
     * Blocks until the caller may issue one request.
     *
     * @return milliseconds spent waiting
     * @throws ResearchException when no slot frees up within the maximum wait
     */
    public long acquire() throws InterruptedException {
        if (rateLimiter == null) {
            return 0;
        }

        long start = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - start) / 1_000_000;

        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted waiting for search rate limit");
        }
        if (!permitted) {
            throw new ResearchException("No search slot within " + maxWait.toMillis() + "ms");
        }
        if (waitedMs > 0) {
            log.debug("Search rate limit: waited {}ms", waitedMs);
        }
        return waitedMs;
    }
}
