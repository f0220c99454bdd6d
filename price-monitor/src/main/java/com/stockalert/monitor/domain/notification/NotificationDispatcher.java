package com.stockalert.monitor.domain.notification;

import com.stockalert.common.event.AlertTriggered;

/**
 * Outbound port for trigger events. Best-effort: implementations report failure
 * through the result and never throw.
 */
public interface NotificationDispatcher {

    DeliveryResult deliver(AlertTriggered event);
}
