package com.stockalert.monitor.domain.quote;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a ticker typed by a user into a canonical quote.
 * Providers are tried in a fixed order and the first hit wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TickerSearchService {

    static final List<ProviderTier> SEARCH_ORDER =
            List.of(ProviderTier.DOMESTIC, ProviderTier.METERED, ProviderTier.FREE_BATCH);

    private final QuoteProviderRegistry registry;

    public Optional<Quote> search(String rawTicker) {
        if (rawTicker == null || rawTicker.isBlank()) {
            return Optional.empty();
        }
        var ticker = rawTicker.trim().toUpperCase(Locale.ROOT);

        for (var tier : SEARCH_ORDER) {
            var provider = registry.find(tier);
            if (provider.isEmpty()) {
                continue;
            }
            var quote = provider.get().fetchOne(ticker);
            if (quote.isPresent()) {
                log.info("Resolved {} via {}: {} on {} at {} {}",
                        ticker, tier, quote.get().companyName(), quote.get().exchange(),
                        quote.get().price(), quote.get().currency());
                return quote;
            }
            log.debug("Ticker {} not found via {}", ticker, tier);
        }

        log.info("Ticker {} not found by any provider", ticker);
        return Optional.empty();
    }
}
