package com.stockalert.monitor.domain.exceptions;

public class AlertNotOwnedException extends RuntimeException {

    private AlertNotOwnedException(String message) {
        super(message);
    }

    public static AlertNotOwnedException of(Long alertId, Long ownerId) {
        return new AlertNotOwnedException("Alert " + alertId + " is not owned by " + ownerId);
    }
}
