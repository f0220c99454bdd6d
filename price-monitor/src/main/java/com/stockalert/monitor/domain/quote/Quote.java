package com.stockalert.monitor.domain.quote;

import java.math.BigDecimal;
import lombok.Builder;

/** Provider-independent result of a single-ticker lookup. */
@Builder(toBuilder = true)
public record Quote(
        String ticker,
        String companyName,
        BigDecimal price,
        String currency,
        String exchange) {}
