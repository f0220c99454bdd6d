package com.stockalert.monitor.domain.cycle;

import com.stockalert.monitor.domain.alert.AlertRepository;
import com.stockalert.monitor.domain.alert.MonitoredAlert;
import com.stockalert.monitor.domain.evaluation.PriceUpdateEvaluator;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.QuoteProviderRegistry;
import com.stockalert.monitor.domain.selection.DueAlertSelector;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Fast cycle over the two free tiers: one batch call for all due foreign tickers,
 * one single-quote call per due domestic ticker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FreeTierCycle {

    private final AlertRepository alertRepository;
    private final DueAlertSelector selector;
    private final QuoteProviderRegistry providers;
    private final PriceUpdateEvaluator evaluator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CycleReport run() {
        var now = clock.instant();

        List<MonitoredAlert> alerts;
        try {
            alerts = alertRepository.findActiveMonitored();
        } catch (DataAccessException | TransactionException e) {
            log.error("Free-tier cycle: could not load active alerts: {}", e.getMessage());
            return CycleReport.abortedBeforeStart();
        }

        var due = selector.partition(alerts, now);
        if (due.isEmpty()) {
            return CycleReport.empty();
        }

        var report = CycleReport.empty();
        if (!due.foreignDue().isEmpty()) {
            report = report.plus(refresh(ProviderTier.FREE_BATCH, due.foreignDue(), now));
        }
        if (!report.aborted() && !due.domesticDue().isEmpty()) {
            report = report.plus(refresh(ProviderTier.DOMESTIC, due.domesticDue(), now));
        }

        log.debug("Free-tier cycle: {} due, {} prices, {} updated, {} triggered",
                report.candidates(), report.pricesReceived(), report.updated(), report.triggered());
        return report;
    }

    private CycleReport refresh(ProviderTier tier, List<MonitoredAlert> due, Instant now) {
        var tickers = selector.distinctTickers(due);
        Map<String, BigDecimal> prices = providers.get(tier).fetchMany(tickers);
        log.debug("{}: requested {} tickers, received {} prices", tier, tickers.size(), prices.size());
        meterRegistry.counter("monitor.quotes.received", "tier", tier.name()).increment(prices.size());
        return evaluator.applyAll(due, prices, now);
    }
}
