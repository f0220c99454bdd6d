package com.stockalert.monitor.domain.quote;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Price source capability. Implementations never throw past this boundary:
 * a failed or empty lookup is an empty result.
 */
public interface QuoteProvider {

    ProviderTier tier();

    Optional<Quote> fetchOne(String ticker);

    /**
     * Prices for as many of {@code tickers} as the provider could resolve.
     * Unresolved tickers are absent from the map.
     */
    Map<String, BigDecimal> fetchMany(List<String> tickers);
}
