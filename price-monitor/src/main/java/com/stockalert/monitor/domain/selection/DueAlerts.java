package com.stockalert.monitor.domain.selection;

import com.stockalert.monitor.domain.alert.MonitoredAlert;
import java.util.List;

public record DueAlerts(List<MonitoredAlert> domesticDue, List<MonitoredAlert> foreignDue) {

    public boolean isEmpty() {
        return domesticDue.isEmpty() && foreignDue.isEmpty();
    }
}
