package com.stockalert.monitor.infrastructure.db.alert;

import com.stockalert.common.event.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface AlertJpaRepository extends JpaRepository<AlertEntity, Long> {

    @Query(
            """
            SELECT new com.stockalert.monitor.infrastructure.db.alert.ActiveAlertRow(
                a, s.domesticIntervalSeconds, s.foreignIntervalSeconds)
            FROM AlertEntity a
            LEFT JOIN OwnerSettingsEntity s ON s.ownerId = a.ownerId
            WHERE a.active = true
            ORDER BY a.id
            """)
    List<ActiveAlertRow> findActiveWithOwnerSettings();

    @Modifying
    @Query(
            """
            UPDATE AlertEntity a SET a.lastPrice = :price, a.lastCheckedAt = :checkedAt
            WHERE a.id = :id AND (a.lastCheckedAt IS NULL OR a.lastCheckedAt <= :checkedAt)
            """)
    int recordCheck(Long id, BigDecimal price, Instant checkedAt);

    @Modifying
    @Query("UPDATE AlertEntity a SET a.active = false WHERE a.id = :id AND a.active = true")
    int deactivateIfActive(Long id);

    @Modifying
    @Query(
            """
            UPDATE AlertEntity a SET a.targetPrice = :targetPrice, a.direction = :direction,
                a.lastPrice = :currentPrice, a.lastCheckedAt = NULL, a.active = true
            WHERE a.id = :id AND a.ownerId = :ownerId
            """)
    int retarget(Long id, Long ownerId, BigDecimal targetPrice, Direction direction, BigDecimal currentPrice);
}
