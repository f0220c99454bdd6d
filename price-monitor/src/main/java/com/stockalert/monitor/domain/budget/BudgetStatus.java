package com.stockalert.monitor.domain.budget;

import java.time.LocalDate;

public record BudgetStatus(
        LocalDate date,
        int dailyLimit,
        int used,
        int remaining,
        int reserve,
        int availableForBatch) {}
