package com.stockalert.monitor.domain.selection;

import com.stockalert.monitor.domain.alert.MonitoredAlert;
import com.stockalert.monitor.domain.market.MarketCalendar;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DueAlertSelector {

    private final MarketCalendar marketCalendar;

    /** Splits active alerts whose refresh interval has elapsed into the two free tiers. */
    public DueAlerts partition(Collection<MonitoredAlert> alerts, Instant now) {
        var domestic = new ArrayList<MonitoredAlert>();
        var foreign = new ArrayList<MonitoredAlert>();

        for (var alert : alerts) {
            if (!alert.alert().active() || !alert.isDueAt(now)) {
                continue;
            }
            if (alert.isDomestic()) {
                domestic.add(alert);
            } else {
                foreign.add(alert);
            }
        }
        return new DueAlerts(List.copyOf(domestic), List.copyOf(foreign));
    }

    /**
     * Foreign alerts whose own exchange is in session. The metered batch spans several
     * exchanges, so "some foreign market is open" is not enough.
     */
    public List<MonitoredAlert> meteredCandidates(Collection<MonitoredAlert> alerts, Instant now) {
        return alerts.stream()
                .filter(alert -> alert.alert().active())
                .filter(alert -> !alert.isDomestic())
                .filter(alert -> marketCalendar.isOpen(alert.exchange(), now))
                .toList();
    }

    public List<String> distinctTickers(Collection<MonitoredAlert> alerts) {
        var tickers = new LinkedHashSet<String>();
        for (var alert : alerts) {
            tickers.add(alert.ticker());
        }
        return List.copyOf(tickers);
    }
}
