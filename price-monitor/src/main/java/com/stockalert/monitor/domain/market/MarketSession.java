package com.stockalert.monitor.domain.market;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Regular trading window of one exchange in its local time zone.
 * {@code lunchStart}/{@code lunchEnd} are null for exchanges without a midday break.
 */
public record MarketSession(
        ZoneId zone,
        LocalTime open,
        LocalTime close,
        LocalTime lunchStart,
        LocalTime lunchEnd) {

    public static MarketSession continuous(String zone, LocalTime open, LocalTime close) {
        return new MarketSession(ZoneId.of(zone), open, close, null, null);
    }

    public static MarketSession split(
            String zone, LocalTime open, LocalTime close, LocalTime lunchStart, LocalTime lunchEnd) {
        return new MarketSession(ZoneId.of(zone), open, close, lunchStart, lunchEnd);
    }

    boolean isOpenAt(ZonedDateTime instantAtExchange, Duration buffer) {
        var local = instantAtExchange.withZoneSameInstant(zone);
        if (isWeekend(local.getDayOfWeek())) {
            return false;
        }

        var openWithBuffer = local.with(open).minus(buffer);
        var closeWithBuffer = local.with(close).plus(buffer);
        if (local.isBefore(openWithBuffer) || local.isAfter(closeWithBuffer)) {
            return false;
        }

        if (lunchStart != null && lunchEnd != null) {
            var time = local.toLocalTime();
            return time.isBefore(lunchStart) || !time.isBefore(lunchEnd);
        }
        return true;
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
