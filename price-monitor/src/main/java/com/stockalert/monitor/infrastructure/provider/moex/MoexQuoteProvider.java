package com.stockalert.monitor.infrastructure.provider.moex;

import static com.stockalert.monitor.infrastructure.provider.JsonPrices.firstNonBlank;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockalert.common.json.JacksonConfig;
import com.stockalert.monitor.application.config.MonitorProperties;
import com.stockalert.monitor.domain.market.Exchanges;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.Quote;
import com.stockalert.monitor.domain.quote.QuoteProvider;
import com.stockalert.monitor.infrastructure.provider.JsonPrices;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Moscow Exchange ISS client. One request per ticker; the free feed is delayed but
 * unmetered. ISS answers in a columns/data table layout per block.
 */
@Slf4j
@Component
public class MoexQuoteProvider implements QuoteProvider {

    static final String CURRENCY = "RUB";

    private static final List<String> PRICE_PREFERENCE = List.of("LAST", "CLOSEPRICE", "MARKETPRICE2");

    private final RestClient restClient;
    private final String board;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public MoexQuoteProvider(RestClient moexRestClient, MonitorProperties properties) {
        this.restClient = moexRestClient;
        this.board = properties.providers().moex().board();
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.DOMESTIC;
    }

    @Override
    public Optional<Quote> fetchOne(String ticker) {
        var symbol = ticker.trim().toUpperCase(Locale.ROOT);
        String body;
        try {
            body = restClient.get()
                    .uri(uri -> uri.path("/engines/stock/markets/shares/boards/{board}/securities/{ticker}.json")
                            .queryParam("iss.meta", "off")
                            .queryParam("iss.only", "securities,marketdata")
                            .queryParam("securities.columns", "SECID,SECNAME,SHORTNAME,PREVPRICE")
                            .queryParam("marketdata.columns", "SECID,LAST,CLOSEPRICE,MARKETPRICE2")
                            .queryParam("lang", "ru")
                            .build(board, symbol))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            log.warn("MOEX request for {} failed: {}", symbol, e.getMessage());
            return Optional.empty();
        }
        if (body == null) {
            return Optional.empty();
        }
        try {
            return parse(symbol, objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            log.warn("MOEX response for {} is not valid JSON: {}", symbol, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public Map<String, BigDecimal> fetchMany(List<String> tickers) {
        var prices = new LinkedHashMap<String, BigDecimal>();
        for (var ticker : tickers) {
            fetchOne(ticker).ifPresent(quote -> prices.put(ticker, quote.price()));
        }
        return prices;
    }

    private Optional<Quote> parse(String ticker, JsonNode root) {
        var securities = firstRow(root.path("securities"));
        var marketData = firstRow(root.path("marketdata"));
        if (securities.isEmpty() || marketData.isEmpty()) {
            log.debug("MOEX has no {} row for {}", securities.isEmpty() ? "securities" : "marketdata", ticker);
            return Optional.empty();
        }

        Optional<BigDecimal> price = Optional.empty();
        for (var column : PRICE_PREFERENCE) {
            price = JsonPrices.positive(marketData.get(column));
            if (price.isPresent()) {
                break;
            }
        }
        if (price.isEmpty()) {
            price = JsonPrices.positive(securities.get("PREVPRICE"));
        }
        if (price.isEmpty()) {
            return Optional.empty();
        }

        var name = firstNonBlank(
                JsonPrices.text(securities.get("SECNAME")), JsonPrices.text(securities.get("SHORTNAME")), ticker);
        return Optional.of(Quote.builder()
                .ticker(ticker)
                .companyName(name)
                .price(price.get())
                .currency(CURRENCY)
                .exchange(Exchanges.MOEX)
                .build());
    }

    /** Zips the block's column names with its first data row. */
    private static Map<String, JsonNode> firstRow(JsonNode block) {
        var columns = block.path("columns");
        var rows = block.path("data");
        if (!columns.isArray() || !rows.isArray() || rows.isEmpty()) {
            return Map.of();
        }
        var row = rows.get(0);
        var result = new HashMap<String, JsonNode>();
        for (int i = 0; i < columns.size() && i < row.size(); i++) {
            result.put(columns.get(i).asText(), row.get(i));
        }
        return result;
    }
}
