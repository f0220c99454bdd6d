package com.stockalert.monitor.domain.alert;

import com.stockalert.common.event.Direction;
import com.stockalert.monitor.domain.exceptions.AlertNotFoundException;
import com.stockalert.monitor.domain.exceptions.AlertNotOwnedException;
import com.stockalert.monitor.domain.exceptions.InvalidTargetPriceException;
import com.stockalert.monitor.domain.market.Exchanges;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.Quote;
import com.stockalert.monitor.domain.quote.QuoteProviderRegistry;
import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final AlertRepository alertRepository;
    private final QuoteProviderRegistry providers;

    public Alert getAlert(Long alertId, Long ownerId) {
        var alert = alertRepository.findById(alertId)
                .orElseThrow(() -> AlertNotFoundException.of(alertId));
        if (!alert.ownerId().equals(ownerId)) {
            throw AlertNotOwnedException.of(alertId, ownerId);
        }
        return alert;
    }

    /**
     * Moves the target of an alert and re-arms it. The direction is derived from a fresh
     * free-tier price; metered credits are never spent here.
     */
    public Alert retarget(Long alertId, Long ownerId, BigDecimal newTarget) {
        if (newTarget == null || newTarget.signum() <= 0) {
            throw InvalidTargetPriceException.of(newTarget);
        }
        var alert = getAlert(alertId, ownerId);

        var tier = Exchanges.isDomestic(alert.exchange())
                ? ProviderTier.DOMESTIC
                : ProviderTier.FREE_BATCH;
        var currentPrice = providers.find(tier)
                .flatMap(provider -> provider.fetchOne(alert.ticker()))
                .map(Quote::price)
                .orElseGet(() -> alert.lastPrice() != null ? alert.lastPrice() : BigDecimal.ZERO);
        var direction = Direction.towards(newTarget, currentPrice);

        if (!alertRepository.retarget(alertId, ownerId, newTarget, direction, currentPrice)) {
            throw AlertNotFoundException.of(alertId);
        }
        log.info("Retargeted alert {} ({}) to {} {} at current price {}",
                alertId, alert.ticker(), direction, newTarget, currentPrice);

        return alert.toBuilder()
                .targetPrice(newTarget)
                .direction(direction)
                .lastPrice(currentPrice)
                .lastCheckedAt(null)
                .active(true)
                .build();
    }
}
