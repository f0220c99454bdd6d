package com.stockalert.monitor.infrastructure.db.alert;

/** An active alert with its owner's interval overrides; both are null when the owner has no settings row. */
public record ActiveAlertRow(AlertEntity alert, Integer domesticIntervalSeconds, Integer foreignIntervalSeconds) {}
