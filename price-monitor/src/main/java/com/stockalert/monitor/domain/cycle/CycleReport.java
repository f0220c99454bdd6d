package com.stockalert.monitor.domain.cycle;

public record CycleReport(
        int candidates,
        int pricesReceived,
        int updated,
        int triggered,
        boolean aborted) {

    public static CycleReport empty() {
        return new CycleReport(0, 0, 0, 0, false);
    }

    public static CycleReport abortedBeforeStart() {
        return new CycleReport(0, 0, 0, 0, true);
    }

    public CycleReport plus(CycleReport other) {
        return new CycleReport(
                candidates + other.candidates,
                pricesReceived + other.pricesReceived,
                updated + other.updated,
                triggered + other.triggered,
                aborted || other.aborted);
    }
}
