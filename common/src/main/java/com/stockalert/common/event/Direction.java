package com.stockalert.common.event;

import java.math.BigDecimal;

public enum Direction {
    ABOVE,
    BELOW;

    /**
     * Boundary-inclusive crossing check: ABOVE fires at price >= target,
     * BELOW fires at price <= target.
     */
    public boolean isReachedBy(BigDecimal price, BigDecimal target) {
        var cmp = price.compareTo(target);
        return switch (this) {
            case ABOVE -> cmp >= 0;
            case BELOW -> cmp <= 0;
        };
    }

    /** Direction a new target implies relative to the current price. */
    public static Direction towards(BigDecimal target, BigDecimal currentPrice) {
        return target.compareTo(currentPrice) >= 0 ? ABOVE : BELOW;
    }
}
