package com.stockalert.monitor.domain.cycle;

import com.stockalert.monitor.domain.alert.AlertRepository;
import com.stockalert.monitor.domain.alert.MonitoredAlert;
import com.stockalert.monitor.domain.evaluation.PriceUpdateEvaluator;
import com.stockalert.monitor.domain.market.Exchanges;
import com.stockalert.monitor.domain.market.MarketCalendar;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.QuoteProviderRegistry;
import com.stockalert.monitor.domain.selection.DueAlertSelector;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Slow cycle over the metered tier. Runs only while at least one foreign exchange is in
 * session and only for alerts whose own exchange is open, so credits are never spent on
 * prices that cannot trigger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeteredTierCycle {

    private final AlertRepository alertRepository;
    private final DueAlertSelector selector;
    private final QuoteProviderRegistry providers;
    private final PriceUpdateEvaluator evaluator;
    private final MarketCalendar marketCalendar;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CycleReport run() {
        if (!marketCalendar.anyForeignOpen()) {
            log.info("Metered cycle: all foreign exchanges closed, skipping (next {} open in {} min)",
                    Exchanges.NYSE, marketCalendar.secondsUntilOpen(Exchanges.NYSE) / 60);
            return CycleReport.empty();
        }

        var now = clock.instant();
        List<MonitoredAlert> alerts;
        try {
            alerts = alertRepository.findActiveMonitored();
        } catch (DataAccessException | TransactionException e) {
            log.error("Metered cycle: could not load active alerts: {}", e.getMessage());
            return CycleReport.abortedBeforeStart();
        }

        var candidates = selector.meteredCandidates(alerts, now);
        if (candidates.isEmpty()) {
            log.info("Metered cycle: no alerts on open foreign exchanges");
            return CycleReport.empty();
        }

        var tickers = selector.distinctTickers(candidates);
        log.info("Metered cycle: refreshing {} tickers for {} alerts", tickers.size(), candidates.size());

        var prices = providers.get(ProviderTier.METERED).fetchMany(tickers);
        meterRegistry.counter("monitor.quotes.received", "tier", ProviderTier.METERED.name())
                .increment(prices.size());
        if (prices.isEmpty()) {
            log.info("Metered cycle: no prices received (budget exhausted or provider unavailable)");
            return new CycleReport(candidates.size(), 0, 0, 0, false);
        }

        var report = evaluator.applyAll(candidates, prices, now);
        log.info("Metered cycle: updated {}/{} alerts, {} triggered",
                report.updated(), candidates.size(), report.triggered());
        return report;
    }
}
