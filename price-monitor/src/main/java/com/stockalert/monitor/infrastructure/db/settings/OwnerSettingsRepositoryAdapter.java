package com.stockalert.monitor.infrastructure.db.settings;

import com.stockalert.monitor.domain.settings.OwnerSettings;
import com.stockalert.monitor.domain.settings.OwnerSettingsRepository;
import com.stockalert.monitor.domain.settings.RefreshIntervals;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Intervals are stored in whole seconds. */
@Repository
@RequiredArgsConstructor
public class OwnerSettingsRepositoryAdapter implements OwnerSettingsRepository {

    private final OwnerSettingsJpaRepository jpaRepository;
    private final RefreshIntervals defaultRefreshIntervals;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<OwnerSettings> findByOwnerId(Long ownerId) {
        return jpaRepository.findById(ownerId).map(this::toDomain);
    }

    @Override
    @Transactional
    public OwnerSettings save(OwnerSettings settings) {
        var entity = OwnerSettingsEntity.builder()
                .ownerId(settings.ownerId())
                .domesticIntervalSeconds((int) settings.intervals().domestic().toSeconds())
                .foreignIntervalSeconds((int) settings.intervals().foreign().toSeconds())
                .updatedAt(clock.instant())
                .build();
        return toDomain(jpaRepository.save(entity));
    }

    private OwnerSettings toDomain(OwnerSettingsEntity entity) {
        var intervals = defaultRefreshIntervals.withOverrides(
                seconds(entity.getDomesticIntervalSeconds()), seconds(entity.getForeignIntervalSeconds()));
        return new OwnerSettings(entity.getOwnerId(), intervals);
    }

    private static Duration seconds(Integer value) {
        return value == null ? null : Duration.ofSeconds(value);
    }
}
