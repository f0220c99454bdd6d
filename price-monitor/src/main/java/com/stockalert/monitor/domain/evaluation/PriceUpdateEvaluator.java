package com.stockalert.monitor.domain.evaluation;

import com.stockalert.common.event.AlertTriggered;
import com.stockalert.monitor.domain.alert.AlertRepository;
import com.stockalert.monitor.domain.alert.MonitoredAlert;
import com.stockalert.monitor.domain.cycle.CycleReport;
import com.stockalert.monitor.domain.market.MarketCalendar;
import com.stockalert.monitor.domain.notification.DeliveryResult;
import com.stockalert.monitor.domain.notification.NotificationDispatcher;
import io.micrometer.core.instrument.Counter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Applies a fetched price to an alert and fires the one-shot trigger.
 *
 * <p>The price is always stored, even while the exchange is closed. The trigger
 * condition is only evaluated while the exchange is in session, so stale weekend
 * quotes never notify. Deactivation is the latch; delivery is best-effort and a
 * failed delivery does not re-arm the alert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceUpdateEvaluator {

    private final AlertRepository alertRepository;
    private final MarketCalendar marketCalendar;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final Counter alertsTriggeredCounter;
    private final Counter notificationsFailedCounter;

    public EvaluationOutcome apply(MonitoredAlert monitored, BigDecimal price, Instant checkedAt) {
        var alert = monitored.alert();
        alertRepository.recordCheck(alert.id(), price, checkedAt);

        if (!marketCalendar.isOpen(alert.exchange())) {
            return EvaluationOutcome.UPDATED;
        }
        if (!alert.direction().isReachedBy(price, alert.targetPrice())) {
            return EvaluationOutcome.UPDATED;
        }

        if (!alertRepository.deactivate(alert.id())) {
            log.debug("Alert {} already deactivated, not firing again", alert.id());
            return EvaluationOutcome.ALREADY_LATCHED;
        }

        log.info("Alert {} fired for {} at {} (target: {}, direction: {})",
                alert.id(), alert.ticker(), price, alert.targetPrice(), alert.direction());
        alertsTriggeredCounter.increment();

        var event = AlertTriggered.builder()
                .alertId(alert.id())
                .ownerId(alert.ownerId())
                .ticker(alert.ticker())
                .exchange(alert.exchange())
                .companyName(alert.companyName())
                .targetPrice(alert.targetPrice())
                .observedPrice(price)
                .currency(alert.currency())
                .direction(alert.direction())
                .triggeredAt(clock.instant())
                .build();

        if (notificationDispatcher.deliver(event) == DeliveryResult.FAILED) {
            notificationsFailedCounter.increment();
            log.error("Notification for alert {} (owner {}) was not delivered; alert stays deactivated",
                    alert.id(), alert.ownerId());
        }
        return EvaluationOutcome.TRIGGERED;
    }

    /**
     * Applies {@code prices} to every candidate whose ticker has a price. A persistence
     * failure stops the remaining writes of this batch; the next cycle starts over.
     */
    public CycleReport applyAll(List<MonitoredAlert> candidates, Map<String, BigDecimal> prices, Instant checkedAt) {
        var updated = 0;
        var triggered = 0;
        try {
            for (var candidate : candidates) {
                var price = prices.get(candidate.ticker());
                if (price == null) {
                    continue;
                }
                var outcome = apply(candidate, price, checkedAt);
                updated++;
                if (outcome == EvaluationOutcome.TRIGGERED) {
                    triggered++;
                }
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Persistence unavailable, aborting remaining {} writes of this cycle: {}",
                    candidates.size() - updated, e.getMessage());
            return new CycleReport(candidates.size(), prices.size(), updated, triggered, true);
        }
        return new CycleReport(candidates.size(), prices.size(), updated, triggered, false);
    }
}
