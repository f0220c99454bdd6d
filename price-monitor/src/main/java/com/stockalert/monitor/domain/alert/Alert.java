package com.stockalert.monitor.domain.alert;

import com.stockalert.common.event.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record Alert(
        Long id,
        Long ownerId,
        String ticker,
        String exchange,
        String companyName,
        BigDecimal targetPrice,
        String currency,
        Direction direction,
        BigDecimal lastPrice,
        Instant lastCheckedAt,
        boolean active,
        Instant createdAt
) {
}
