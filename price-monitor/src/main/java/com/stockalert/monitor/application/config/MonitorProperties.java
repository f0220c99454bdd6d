package com.stockalert.monitor.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "monitor")
public record MonitorProperties(
        @Valid @NotNull Cycles cycles,
        @Valid @NotNull Refresh refresh,
        @Valid @NotNull Market market,
        @Valid @NotNull Providers providers,
        @Valid @NotNull Notification notification) {

    public record Cycles(
            @NotNull Duration fastInterval,
            @NotNull Duration fastInitialDelay,
            @NotNull Duration meteredInterval,
            @NotNull Duration meteredInitialDelay) {}

    public record Refresh(@NotNull Duration domesticDefault, @NotNull Duration foreignDefault) {}

    public record Market(@NotNull Duration buffer) {}

    public record Providers(
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout,
            @Valid @NotNull Moex moex,
            @Valid @NotNull Yahoo yahoo,
            @Valid @NotNull TwelveData twelveData) {}

    public record Moex(@NotBlank String baseUrl, @NotBlank String board) {}

    public record Yahoo(@NotBlank String baseUrl, @NotBlank String userAgent) {}

    /** Metered provider. A blank api key disables the tier without failing startup. */
    public record TwelveData(
            @NotBlank String baseUrl,
            String apiKey,
            @Min(1) int dailyCredits,
            @Min(0) int reserveCredits,
            @Min(1) int chunkSize,
            @Min(1) int requestsPerMinute,
            @NotNull Duration rateLimitMargin,
            @NotNull ZoneId budgetZone) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Notification(@NotNull Duration sendTimeout) {}
}
