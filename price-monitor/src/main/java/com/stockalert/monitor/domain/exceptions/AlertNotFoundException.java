package com.stockalert.monitor.domain.exceptions;

public class AlertNotFoundException extends RuntimeException {

    private AlertNotFoundException(String message) {
        super(message);
    }

    public static AlertNotFoundException of(Long alertId) {
        return new AlertNotFoundException("Alert not found: " + alertId);
    }
}
