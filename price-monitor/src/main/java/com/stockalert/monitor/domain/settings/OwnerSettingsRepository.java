package com.stockalert.monitor.domain.settings;

import java.util.Optional;

public interface OwnerSettingsRepository {

    Optional<OwnerSettings> findByOwnerId(Long ownerId);

    OwnerSettings save(OwnerSettings settings);
}
