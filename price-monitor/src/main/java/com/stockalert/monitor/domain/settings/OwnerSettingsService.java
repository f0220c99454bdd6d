package com.stockalert.monitor.domain.settings;

import com.stockalert.monitor.domain.exceptions.InvalidRefreshIntervalException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OwnerSettingsService {

    static final Duration MIN_INTERVAL = Duration.ofSeconds(10);

    private final OwnerSettingsRepository repository;
    private final RefreshIntervals defaultRefreshIntervals;

    public OwnerSettings resolve(Long ownerId) {
        return repository.findByOwnerId(ownerId)
                .orElseGet(() -> new OwnerSettings(ownerId, defaultRefreshIntervals));
    }

    /** Partial update: a null interval keeps the owner's current value. */
    public OwnerSettings updateIntervals(Long ownerId, Duration domestic, Duration foreign) {
        validate(domestic);
        validate(foreign);

        var current = resolve(ownerId);
        var updated = new OwnerSettings(ownerId, current.intervals().withOverrides(domestic, foreign));
        var saved = repository.save(updated);
        log.info("Owner {} refresh intervals: domestic={}s, foreign={}s",
                ownerId, saved.intervals().domestic().toSeconds(), saved.intervals().foreign().toSeconds());
        return saved;
    }

    private void validate(Duration interval) {
        if (interval != null && interval.compareTo(MIN_INTERVAL) < 0) {
            throw InvalidRefreshIntervalException.of(interval, MIN_INTERVAL);
        }
    }
}
