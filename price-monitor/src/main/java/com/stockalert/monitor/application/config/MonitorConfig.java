package com.stockalert.monitor.application.config;

import com.stockalert.monitor.domain.budget.CreditBudgetLedger;
import com.stockalert.monitor.domain.market.MarketCalendar;
import com.stockalert.monitor.domain.ratelimit.Sleeper;
import com.stockalert.monitor.domain.ratelimit.SlidingWindowRateLimiter;
import com.stockalert.monitor.domain.settings.RefreshIntervals;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitorConfig {

    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketCalendar marketCalendar(Clock clock, MonitorProperties properties) {
        return new MarketCalendar(clock, properties.market().buffer());
    }

    @Bean
    public RefreshIntervals defaultRefreshIntervals(MonitorProperties properties) {
        var refresh = properties.refresh();
        return new RefreshIntervals(refresh.domesticDefault(), refresh.foreignDefault());
    }

    /** Shared by every metered call in the process. */
    @Bean
    public SlidingWindowRateLimiter meteredRateLimiter(Clock clock, MonitorProperties properties) {
        var twelveData = properties.providers().twelveData();
        return new SlidingWindowRateLimiter(
                twelveData.requestsPerMinute(), RATE_WINDOW, twelveData.rateLimitMargin(), clock, Sleeper.THREAD);
    }

    @Bean
    public CreditBudgetLedger creditBudgetLedger(Clock clock, MonitorProperties properties) {
        var twelveData = properties.providers().twelveData();
        return new CreditBudgetLedger(
                twelveData.dailyCredits(), twelveData.reserveCredits(), clock, twelveData.budgetZone());
    }
}
