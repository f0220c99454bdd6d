package com.stockalert.monitor.infrastructure.db.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "owner_settings")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OwnerSettingsEntity {

    @Id
    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "domestic_interval_seconds")
    private Integer domesticIntervalSeconds;

    @Column(name = "foreign_interval_seconds")
    private Integer foreignIntervalSeconds;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
