package com.stockalert.monitor.infrastructure.provider.yahoo;

import com.stockalert.monitor.domain.market.Exchanges;
import java.util.Locale;
import java.util.Map;

/** Yahoo's short exchange codes mapped onto the exchange names alerts are stored with. */
final class YahooExchangeCodes {

    private static final Map<String, String> CODES = Map.ofEntries(
            Map.entry("NMS", Exchanges.NASDAQ),
            Map.entry("NGM", Exchanges.NASDAQ),
            Map.entry("NCM", Exchanges.NASDAQ),
            Map.entry("NAS", Exchanges.NASDAQ),
            Map.entry("NYQ", Exchanges.NYSE),
            Map.entry("PCX", Exchanges.NYSE_ARCA),
            Map.entry("ASE", Exchanges.NYSE_MKT),
            Map.entry("BTS", Exchanges.CBOE),
            Map.entry("CBO", Exchanges.CBOE),
            Map.entry("HKG", Exchanges.HKEX));

    private YahooExchangeCodes() {}

    /** Unknown codes pass through unchanged. */
    static String normalize(String code) {
        if (code == null) {
            return "";
        }
        return CODES.getOrDefault(code.trim().toUpperCase(Locale.ROOT), code.trim());
    }
}
