package com.stockalert.monitor.domain.alert;

import com.stockalert.monitor.domain.market.Exchanges;
import com.stockalert.monitor.domain.settings.RefreshIntervals;
import java.time.Duration;
import java.time.Instant;

/** An active alert together with its owner's resolved refresh intervals. */
public record MonitoredAlert(Alert alert, RefreshIntervals intervals) {

    public boolean isDomestic() {
        return Exchanges.isDomestic(alert.exchange());
    }

    public Duration refreshInterval() {
        return isDomestic() ? intervals.domestic() : intervals.foreign();
    }

    /** Never-checked alerts are always due. */
    public boolean isDueAt(Instant now) {
        var lastChecked = alert.lastCheckedAt();
        if (lastChecked == null) {
            return true;
        }
        return Duration.between(lastChecked, now).compareTo(refreshInterval()) >= 0;
    }

    public String ticker() {
        return alert.ticker();
    }

    public String exchange() {
        return alert.exchange();
    }
}
