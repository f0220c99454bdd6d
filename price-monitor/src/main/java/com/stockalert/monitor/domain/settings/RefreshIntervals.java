package com.stockalert.monitor.domain.settings;

import java.time.Duration;

public record RefreshIntervals(Duration domestic, Duration foreign) {

    public RefreshIntervals withOverrides(Duration domesticOverride, Duration foreignOverride) {
        return new RefreshIntervals(
                domesticOverride != null ? domesticOverride : domestic,
                foreignOverride != null ? foreignOverride : foreign);
    }
}
