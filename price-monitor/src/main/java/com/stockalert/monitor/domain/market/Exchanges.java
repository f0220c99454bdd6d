package com.stockalert.monitor.domain.market;

import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Exchanges {

    public static final String MOEX = "MOEX";
    public static final String NYSE = "NYSE";
    public static final String NASDAQ = "NASDAQ";
    public static final String NYSE_ARCA = "NYSE ARCA";
    public static final String NYSE_MKT = "NYSE MKT";
    public static final String CBOE = "CBOE";
    public static final String HKEX = "HKEX";
    public static final String HKSE = "HKSE";

    /** One representative per foreign session; used to gate the metered cycle. */
    public static final List<String> FOREIGN_REFERENCE = List.of(NYSE, HKEX);

    private static final MarketSession MOSCOW =
            MarketSession.continuous("Europe/Moscow", LocalTime.of(10, 0), LocalTime.of(18, 40));
    private static final MarketSession NEW_YORK =
            MarketSession.continuous("America/New_York", LocalTime.of(9, 30), LocalTime.of(16, 0));
    private static final MarketSession HONG_KONG = MarketSession.split(
            "Asia/Hong_Kong", LocalTime.of(9, 30), LocalTime.of(16, 0), LocalTime.of(12, 0), LocalTime.of(13, 0));

    private static final Map<String, MarketSession> SESSIONS = Map.of(
            MOEX, MOSCOW,
            NYSE, NEW_YORK,
            NASDAQ, NEW_YORK,
            NYSE_ARCA, NEW_YORK,
            NYSE_MKT, NEW_YORK,
            CBOE, NEW_YORK,
            HKEX, HONG_KONG,
            HKSE, HONG_KONG);

    public static String normalize(String exchange) {
        return exchange == null ? "" : exchange.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isDomestic(String exchange) {
        return MOEX.equals(normalize(exchange));
    }

    public static Optional<MarketSession> sessionOf(String exchange) {
        return Optional.ofNullable(SESSIONS.get(normalize(exchange)));
    }

    public static List<String> known() {
        return SESSIONS.keySet().stream().sorted().toList();
    }
}
