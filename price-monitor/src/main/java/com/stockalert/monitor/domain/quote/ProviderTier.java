package com.stockalert.monitor.domain.quote;

public enum ProviderTier {
    /** Free, one ticker per call, domestic exchange only. */
    DOMESTIC,
    /** Free, unlimited tickers per call, foreign exchanges. */
    FREE_BATCH,
    /** Billed per requested symbol, daily quota and per-minute request cap. */
    METERED
}
