package com.stockalert.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record AlertTriggered(
        @JsonProperty("alert_id") Long alertId,
        @JsonProperty("owner_id") Long ownerId,
        String ticker,
        String exchange,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("target_price") BigDecimal targetPrice,
        @JsonProperty("observed_price") BigDecimal observedPrice,
        String currency,
        Direction direction,
        @JsonProperty("triggered_at") Instant triggeredAt) {}
