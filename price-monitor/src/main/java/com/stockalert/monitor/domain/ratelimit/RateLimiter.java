package com.stockalert.monitor.domain.ratelimit;

/**
 * Admission control for a rate-capped provider.
 * Blocks the calling thread until the request may be issued.
 */
public interface RateLimiter {

    /**
     * @throws com.stockalert.monitor.domain.exceptions.RateLimitInterruptedException if the
     *     thread is interrupted while waiting; nothing is admitted
     */
    void admit();
}
