package com.stockalert.monitor.infrastructure.provider.twelvedata;

import static com.stockalert.monitor.infrastructure.provider.JsonPrices.firstNonBlank;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockalert.common.json.JacksonConfig;
import com.stockalert.monitor.application.config.MonitorProperties;
import com.stockalert.monitor.domain.budget.CreditBudgetLedger;
import com.stockalert.monitor.domain.exceptions.RateLimitInterruptedException;
import com.stockalert.monitor.domain.market.Exchanges;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.Quote;
import com.stockalert.monitor.domain.quote.QuoteProvider;
import com.stockalert.monitor.domain.ratelimit.RateLimiter;
import com.stockalert.monitor.infrastructure.provider.JsonPrices;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Metered Twelve Data client. Every symbol in a {@code /price} call costs one credit,
 * every HTTP request counts against the per-minute limit.
 *
 * <p>Chunks are admitted by the rate limiter and charged to the ledger on the calling
 * thread, in order; only the HTTP round trips run on the provider executor.
 */
@Slf4j
@Component
public class TwelveDataQuoteProvider implements QuoteProvider {

    private final RestClient restClient;
    private final RateLimiter rateLimiter;
    private final CreditBudgetLedger ledger;
    private final Executor executor;
    private final MonitorProperties.TwelveData settings;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public TwelveDataQuoteProvider(
            RestClient twelveDataRestClient,
            RateLimiter rateLimiter,
            CreditBudgetLedger ledger,
            @Qualifier("providerExecutor") Executor executor,
            MonitorProperties properties) {
        this.restClient = twelveDataRestClient;
        this.rateLimiter = rateLimiter;
        this.ledger = ledger;
        this.executor = executor;
        this.settings = properties.providers().twelveData();
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.METERED;
    }

    @Override
    public Map<String, BigDecimal> fetchMany(List<String> tickers) {
        if (tickers.isEmpty() || !settings.hasApiKey()) {
            return Map.of();
        }

        var available = ledger.availableForBatch();
        if (available <= 0) {
            log.info("Twelve Data batch skipped: budget exhausted ({} credits left, {} reserved)",
                    ledger.remaining(), ledger.reserveFloor());
            return Map.of();
        }

        var selected = tickers;
        if (tickers.size() > available) {
            log.warn("Twelve Data batch clipped from {} to {} tickers by the daily budget", tickers.size(), available);
            selected = tickers.subList(0, available);
        }

        var chunks = chunk(selected, settings.chunkSize());
        log.info("Twelve Data batch: {} tickers in {} requests of up to {}",
                selected.size(), chunks.size(), settings.chunkSize());

        var pending = new ArrayList<CompletableFuture<Map<String, BigDecimal>>>(chunks.size());
        var charged = 0;
        for (var chunk : chunks) {
            try {
                rateLimiter.admit();
            } catch (RateLimitInterruptedException e) {
                log.warn("Twelve Data batch stopped after {}/{} requests: {}",
                        pending.size(), chunks.size(), e.getMessage());
                break;
            }
            pending.add(CompletableFuture.supplyAsync(() -> fetchChunk(chunk), executor)
                    .exceptionally(e -> {
                        log.warn("Twelve Data /price chunk {} failed unexpectedly", chunk, e);
                        return Map.of();
                    }));
            ledger.charge(chunk.size());
            charged += chunk.size();
        }

        var prices = new LinkedHashMap<String, BigDecimal>();
        for (var future : pending) {
            prices.putAll(future.join());
        }
        log.info("Twelve Data batch: received {}/{} prices, spent {} credits",
                prices.size(), selected.size(), charged);
        return prices;
    }

    /** Draws on the reserve: allowed while any credit remains today. */
    @Override
    public Optional<Quote> fetchOne(String ticker) {
        if (!settings.hasApiKey()) {
            log.warn("Twelve Data api key not configured");
            return Optional.empty();
        }
        if (ledger.remaining() <= 0) {
            log.warn("Twelve Data daily budget exhausted, /quote skipped for {}", ticker);
            return Optional.empty();
        }

        var symbol = ticker.trim().toUpperCase(Locale.ROOT);
        try {
            rateLimiter.admit();
        } catch (RateLimitInterruptedException e) {
            log.warn("Twelve Data /quote skipped for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
        var root = get("/quote " + symbol, "/quote", symbol);
        if (root.isEmpty()) {
            return Optional.empty();
        }

        var close = JsonPrices.positive(root.get().get("close"));
        if (close.isEmpty()) {
            return Optional.empty();
        }
        ledger.charge(1);

        var data = root.get();
        var exchange = firstNonBlank(JsonPrices.text(data.get("exchange")), "");
        return Optional.of(Quote.builder()
                .ticker(firstNonBlank(JsonPrices.text(data.get("symbol")), symbol))
                .companyName(firstNonBlank(JsonPrices.text(data.get("name")), symbol))
                .price(close.get())
                .currency(firstNonBlank(JsonPrices.text(data.get("currency")), defaultCurrency(exchange)))
                .exchange(exchange)
                .build());
    }

    private Map<String, BigDecimal> fetchChunk(List<String> chunk) {
        var root = get("/price chunk " + chunk, "/price", String.join(",", chunk));
        if (root.isEmpty()) {
            return Map.of();
        }
        var data = root.get();
        var prices = new LinkedHashMap<String, BigDecimal>();
        if (chunk.size() == 1) {
            JsonPrices.positive(data.get("price")).ifPresent(p -> prices.put(chunk.get(0), p));
        } else {
            for (var ticker : chunk) {
                JsonPrices.positive(data.path(ticker).get("price")).ifPresent(p -> prices.put(ticker, p));
            }
        }
        return prices;
    }

    private Optional<JsonNode> get(String what, String path, String symbols) {
        JsonNode root;
        try {
            var body = restClient.get()
                    .uri(uri -> uri.path(path)
                            .queryParam("symbol", symbols)
                            .queryParam("apikey", settings.apiKey())
                            .queryParam("format", "JSON")
                            .build())
                    .retrieve()
                    .body(String.class);
            if (body == null) {
                return Optional.empty();
            }
            root = objectMapper.readTree(body);
        } catch (RestClientException e) {
            log.warn("Twelve Data {} failed: {}", what, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Twelve Data {} returned invalid JSON: {}", what, e.getOriginalMessage());
            return Optional.empty();
        }
        if (!root.isObject()) {
            return Optional.empty();
        }
        if (root.has("code") || "error".equals(root.path("status").asText())) {
            log.warn("Twelve Data {} error: {}", what, root.path("message").asText(root.toString()));
            return Optional.empty();
        }
        return Optional.of(root);
    }

    static String defaultCurrency(String exchange) {
        var normalized = Exchanges.normalize(exchange);
        return Exchanges.HKEX.equals(normalized) || Exchanges.HKSE.equals(normalized) ? "HKD" : "USD";
    }

    static <T> List<List<T>> chunk(List<T> items, int size) {
        var chunks = new ArrayList<List<T>>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return chunks;
    }
}
