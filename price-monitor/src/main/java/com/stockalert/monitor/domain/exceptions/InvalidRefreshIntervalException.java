package com.stockalert.monitor.domain.exceptions;

import java.time.Duration;

public class InvalidRefreshIntervalException extends RuntimeException {

    private InvalidRefreshIntervalException(String message) {
        super(message);
    }

    public static InvalidRefreshIntervalException of(Duration interval, Duration minimum) {
        return new InvalidRefreshIntervalException(
                "Refresh interval " + interval.toSeconds() + "s is below the minimum of " + minimum.toSeconds() + "s");
    }
}
