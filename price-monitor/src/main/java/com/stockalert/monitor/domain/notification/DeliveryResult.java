package com.stockalert.monitor.domain.notification;

public enum DeliveryResult {
    DELIVERED,
    FAILED
}
