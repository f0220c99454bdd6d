package com.stockalert.monitor.domain.exceptions;

import java.math.BigDecimal;

public class InvalidTargetPriceException extends RuntimeException {

    private InvalidTargetPriceException(String message) {
        super(message);
    }

    public static InvalidTargetPriceException of(BigDecimal target) {
        return new InvalidTargetPriceException("Target price must be positive: " + target);
    }
}
