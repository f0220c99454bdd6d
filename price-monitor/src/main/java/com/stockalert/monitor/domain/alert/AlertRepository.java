package com.stockalert.monitor.domain.alert;

import com.stockalert.common.event.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AlertRepository {

    /** Active alerts joined with the owner's intervals, defaults applied where unset. */
    List<MonitoredAlert> findActiveMonitored();

    Optional<Alert> findById(Long id);

    /**
     * Stores the observed price and check time. The check time never moves backwards:
     * a write older than the stored timestamp is ignored.
     */
    void recordCheck(Long id, BigDecimal price, Instant checkedAt);

    /**
     * Conditional ACTIVE → INACTIVE transition.
     *
     * @return true if this call deactivated the alert, false if it was already inactive
     */
    boolean deactivate(Long id);

    boolean retarget(Long id, Long ownerId, BigDecimal targetPrice, Direction direction, BigDecimal currentPrice);
}
