package com.stockalert.monitor.application.job;

import com.stockalert.monitor.domain.cycle.FreeTierCycle;
import com.stockalert.monitor.domain.cycle.MeteredTierCycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the two refresh cycles at fixed rates. A failing cycle is logged and the
 * schedule keeps running; the next tick starts from fresh database state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceMonitorScheduler {

    private final FreeTierCycle freeTierCycle;
    private final MeteredTierCycle meteredTierCycle;

    @Scheduled(
            fixedRateString = "${monitor.cycles.fast-interval}",
            initialDelayString = "${monitor.cycles.fast-initial-delay}")
    public void runFastCycle() {
        try {
            freeTierCycle.run();
        } catch (Exception e) {
            log.error("Free-tier cycle failed", e);
        }
    }

    @Scheduled(
            fixedRateString = "${monitor.cycles.metered-interval}",
            initialDelayString = "${monitor.cycles.metered-initial-delay}")
    public void runMeteredCycle() {
        try {
            meteredTierCycle.run();
        } catch (Exception e) {
            log.error("Metered cycle failed", e);
        }
    }
}
