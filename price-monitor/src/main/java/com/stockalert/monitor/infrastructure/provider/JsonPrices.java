package com.stockalert.monitor.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Optional;

/** Price extraction shared by the provider parsers. Providers send prices as numbers or strings. */
public final class JsonPrices {

    private JsonPrices() {}

    public static Optional<BigDecimal> positive(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                value = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return value.signum() > 0 ? Optional.of(value) : Optional.empty();
    }

    /** Last non-null positive element of a close-price array. */
    public static Optional<BigDecimal> lastPositive(JsonNode array) {
        if (array == null || !array.isArray()) {
            return Optional.empty();
        }
        for (int i = array.size() - 1; i >= 0; i--) {
            var price = positive(array.get(i));
            if (price.isPresent()) {
                return price;
            }
        }
        return Optional.empty();
    }

    public static String text(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }

    public static String firstNonBlank(String... values) {
        for (var value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
