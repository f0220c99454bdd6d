package com.stockalert.monitor.infrastructure.db.alert;

import com.stockalert.common.event.Direction;
import com.stockalert.monitor.domain.alert.Alert;
import com.stockalert.monitor.domain.alert.AlertRepository;
import com.stockalert.monitor.domain.alert.MonitoredAlert;
import com.stockalert.monitor.domain.settings.RefreshIntervals;
import com.stockalert.monitor.infrastructure.db.alert.mapper.AlertEntityMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class AlertRepositoryAdapter implements AlertRepository {

    private final AlertJpaRepository jpaRepository;
    private final AlertEntityMapper mapper;
    private final RefreshIntervals defaultRefreshIntervals;

    @Override
    @Transactional(readOnly = true)
    public List<MonitoredAlert> findActiveMonitored() {
        return jpaRepository.findActiveWithOwnerSettings().stream()
                .map(this::toMonitored)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findById(Long id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public void recordCheck(Long id, BigDecimal price, Instant checkedAt) {
        jpaRepository.recordCheck(id, price, checkedAt);
    }

    @Override
    @Transactional
    public boolean deactivate(Long id) {
        return jpaRepository.deactivateIfActive(id) == 1;
    }

    @Override
    @Transactional
    public boolean retarget(
            Long id, Long ownerId, BigDecimal targetPrice, Direction direction, BigDecimal currentPrice) {
        return jpaRepository.retarget(id, ownerId, targetPrice, direction, currentPrice) == 1;
    }

    private MonitoredAlert toMonitored(ActiveAlertRow row) {
        var intervals = defaultRefreshIntervals.withOverrides(
                seconds(row.domesticIntervalSeconds()), seconds(row.foreignIntervalSeconds()));
        return new MonitoredAlert(mapper.toDomain(row.alert()), intervals);
    }

    private static Duration seconds(Integer value) {
        return value == null ? null : Duration.ofSeconds(value);
    }
}
