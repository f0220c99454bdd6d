package com.stockalert.monitor.infrastructure.provider.yahoo;

import static com.stockalert.monitor.infrastructure.provider.JsonPrices.firstNonBlank;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockalert.common.json.JacksonConfig;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.Quote;
import com.stockalert.monitor.domain.quote.QuoteProvider;
import com.stockalert.monitor.infrastructure.provider.JsonPrices;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Free Yahoo Finance chart API. One spark request covers every foreign ticker of a cycle.
 *
 * <p>Spark has two response shapes in the wild: {@code spark.result[]} with nested
 * chart indicators, and a flat object keyed by symbol with a {@code close} array.
 * Both are accepted.
 */
@Slf4j
@Component
public class YahooQuoteProvider implements QuoteProvider {

    private final RestClient restClient;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public YahooQuoteProvider(RestClient yahooRestClient) {
        this.restClient = yahooRestClient;
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.FREE_BATCH;
    }

    @Override
    public Map<String, BigDecimal> fetchMany(List<String> tickers) {
        if (tickers.isEmpty()) {
            return Map.of();
        }
        var prices = spark(tickers, "1d", "5m");
        if (prices.isEmpty()) {
            log.debug("Yahoo intraday spark returned no prices, falling back to daily closes");
            prices = spark(tickers, "5d", "1d");
        }
        return prices;
    }

    @Override
    public Optional<Quote> fetchOne(String ticker) {
        var symbol = ticker.trim().toUpperCase(Locale.ROOT);
        var root = get("chart " + symbol, restClient.get()
                .uri(uri -> uri.path("/v8/finance/chart/{ticker}")
                        .queryParam("range", "5d")
                        .queryParam("interval", "1d")
                        .build(symbol)));
        if (root.isEmpty()) {
            return Optional.empty();
        }

        var result = root.get().path("chart").path("result").path(0);
        var meta = result.path("meta");
        var price = JsonPrices.positive(meta.get("regularMarketPrice"))
                .or(() -> JsonPrices.lastPositive(closes(result)));
        if (price.isEmpty()) {
            log.debug("Yahoo chart has no price for {}", symbol);
            return Optional.empty();
        }

        return Optional.of(Quote.builder()
                .ticker(symbol)
                .companyName(firstNonBlank(
                        JsonPrices.text(meta.get("longName")), JsonPrices.text(meta.get("shortName")), symbol))
                .price(price.get())
                .currency(firstNonBlank(JsonPrices.text(meta.get("currency")), ""))
                .exchange(YahooExchangeCodes.normalize(firstNonBlank(
                        JsonPrices.text(meta.get("exchangeName")), JsonPrices.text(meta.get("fullExchangeName")))))
                .build());
    }

    private Map<String, BigDecimal> spark(List<String> tickers, String range, String interval) {
        var root = get("spark " + range + "/" + interval, restClient.get()
                .uri(uri -> uri.path("/v8/finance/spark")
                        .queryParam("symbols", String.join(",", tickers))
                        .queryParam("range", range)
                        .queryParam("interval", interval)
                        .build()));
        if (root.isEmpty()) {
            return Map.of();
        }

        var requested = new HashSet<>(tickers);
        var prices = new LinkedHashMap<String, BigDecimal>();
        var results = root.get().path("spark").path("result");
        if (results.isArray()) {
            for (var entry : results) {
                var symbol = entry.path("symbol").asText();
                var closes = closes(entry.path("response").path(0));
                put(prices, requested, symbol, JsonPrices.lastPositive(closes));
            }
        } else {
            root.get().fields().forEachRemaining(field ->
                    put(prices, requested, field.getKey(), JsonPrices.lastPositive(field.getValue().path("close"))));
        }
        log.debug("Yahoo spark {}/{}: {} of {} tickers priced", range, interval, prices.size(), tickers.size());
        return prices;
    }

    private static void put(
            Map<String, BigDecimal> prices, Set<String> requested, String symbol, Optional<BigDecimal> price) {
        if (requested.contains(symbol)) {
            price.ifPresent(p -> prices.put(symbol, p));
        }
    }

    private static JsonNode closes(JsonNode chartResult) {
        return chartResult.path("indicators").path("quote").path(0).path("close");
    }

    private Optional<JsonNode> get(String what, RestClient.RequestHeadersSpec<?> request) {
        try {
            var body = request.retrieve().body(String.class);
            return body == null ? Optional.empty() : Optional.of(objectMapper.readTree(body));
        } catch (RestClientException e) {
            log.warn("Yahoo {} request failed: {}", what, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Yahoo {} response is not valid JSON: {}", what, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
