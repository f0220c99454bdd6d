package com.stockalert.monitor.domain.exceptions;

import java.time.Duration;

public class RateLimitInterruptedException extends RuntimeException {

    private RateLimitInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RateLimitInterruptedException of(Duration wait, InterruptedException cause) {
        return new RateLimitInterruptedException(
                "Interrupted while waiting " + wait.toMillis() + " ms for a rate limit slot", cause);
    }
}
