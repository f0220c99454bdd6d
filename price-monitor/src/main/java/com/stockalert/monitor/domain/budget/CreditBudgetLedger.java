package com.stockalert.monitor.domain.budget;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import lombok.extern.slf4j.Slf4j;

/**
 * Daily credit ledger for the metered provider.
 *
 * <p>{@code used} is reset the first time the ledger is touched on a new calendar date.
 * The reserve floor is kept for single-ticker lookups; the periodic batch may only spend
 * what lies above it. Callers check {@link #availableForBatch()} or {@link #remaining()}
 * before charging.
 */
@Slf4j
public class CreditBudgetLedger {

    private final int dailyLimit;
    private final int reserveFloor;
    private final Clock clock;
    private final ZoneId zone;

    private LocalDate date;
    private int used;

    public CreditBudgetLedger(int dailyLimit, int reserveFloor, Clock clock, ZoneId zone) {
        if (dailyLimit < 0 || reserveFloor < 0) {
            throw new IllegalArgumentException(
                    "Budget limits must not be negative: daily=" + dailyLimit + ", reserve=" + reserveFloor);
        }
        this.dailyLimit = dailyLimit;
        this.reserveFloor = reserveFloor;
        this.clock = clock;
        this.zone = zone;
        this.date = today();
    }

    public synchronized int remaining() {
        rollOver();
        return dailyLimit - used;
    }

    public int reserveFloor() {
        return reserveFloor;
    }

    public synchronized int availableForBatch() {
        rollOver();
        return Math.max(0, dailyLimit - used - reserveFloor);
    }

    /** Flat debit of {@code credits}, one per requested symbol. */
    public synchronized void charge(int credits) {
        if (credits < 0) {
            throw new IllegalArgumentException("Cannot charge negative credits: " + credits);
        }
        rollOver();
        used += credits;
        log.info("Metered provider: -{} credits, used {}/{} today", credits, used, dailyLimit);
    }

    public synchronized BudgetStatus status() {
        rollOver();
        var remaining = dailyLimit - used;
        return new BudgetStatus(
                date, dailyLimit, used, remaining, reserveFloor, Math.max(0, remaining - reserveFloor));
    }

    private void rollOver() {
        var today = today();
        if (!today.equals(date)) {
            if (used > 0) {
                log.info("Metered provider: new budget day {}, {} credits were used on {}", today, used, date);
            }
            date = today;
            used = 0;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }
}
