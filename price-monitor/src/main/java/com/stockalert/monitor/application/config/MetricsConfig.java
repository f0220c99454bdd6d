package com.stockalert.monitor.application.config;

import com.stockalert.monitor.domain.budget.CreditBudgetLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter alertsTriggeredCounter(MeterRegistry registry) {
        return Counter.builder("monitor.alerts.triggered")
                .description("Total alerts latched and fired")
                .register(registry);
    }

    @Bean
    public Counter notificationsFailedCounter(MeterRegistry registry) {
        return Counter.builder("monitor.notifications.failed")
                .description("Trigger notifications that could not be delivered")
                .register(registry);
    }

    @Bean
    public Gauge budgetUsedGauge(MeterRegistry registry, CreditBudgetLedger ledger) {
        return Gauge.builder("monitor.budget.credits.used", ledger, l -> l.status().used())
                .description("Metered credits spent today")
                .register(registry);
    }

    @Bean
    public Gauge budgetRemainingGauge(MeterRegistry registry, CreditBudgetLedger ledger) {
        return Gauge.builder("monitor.budget.credits.remaining", ledger, CreditBudgetLedger::remaining)
                .description("Metered credits left today")
                .register(registry);
    }

    @Bean
    public Gauge budgetAvailableForBatchGauge(MeterRegistry registry, CreditBudgetLedger ledger) {
        return Gauge.builder("monitor.budget.credits.available_for_batch", ledger, CreditBudgetLedger::availableForBatch)
                .description("Metered credits the batch cycle may still spend today")
                .register(registry);
    }
}
