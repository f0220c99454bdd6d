package com.stockalert.monitor.domain.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;

/**
 * Weekday + fixed session hours per exchange. Holidays are not modeled.
 * Unknown exchanges are reported open so a real trigger is never suppressed.
 */
@RequiredArgsConstructor
public class MarketCalendar {

    private final Clock clock;
    private final Duration buffer;

    public boolean isOpen(String exchange) {
        return isOpen(exchange, clock.instant());
    }

    public boolean isOpen(String exchange, Instant at) {
        return Exchanges.sessionOf(exchange)
                .map(session -> session.isOpenAt(ZonedDateTime.ofInstant(at, session.zone()), buffer))
                .orElse(true);
    }

    public boolean anyForeignOpen() {
        var now = clock.instant();
        return Exchanges.FOREIGN_REFERENCE.stream().anyMatch(exchange -> isOpen(exchange, now));
    }

    /**
     * Seconds until the next regular open of the exchange, skipping weekends.
     * Returns 0 for unknown exchanges.
     */
    public long secondsUntilOpen(String exchange) {
        var session = Exchanges.sessionOf(exchange);
        if (session.isEmpty()) {
            return 0;
        }
        var zone = session.get().zone();
        var now = ZonedDateTime.ofInstant(clock.instant(), zone);
        var candidate = now.with(session.get().open()).withSecond(0).withNano(0);

        while (!candidate.isAfter(now) || MarketSession.isWeekend(candidate.getDayOfWeek())) {
            candidate = candidate.plusDays(1);
        }
        return Duration.between(now, candidate).getSeconds();
    }
}
