package com.stockalert.monitor.infrastructure.db.settings;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OwnerSettingsJpaRepository extends JpaRepository<OwnerSettingsEntity, Long> {}
