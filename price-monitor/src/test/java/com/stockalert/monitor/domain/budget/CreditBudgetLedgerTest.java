package com.stockalert.monitor.domain.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stockalert.monitor.test.fixtures.MutableClock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class CreditBudgetLedgerTest {

    private final MutableClock clock = MutableClock.at("2024-06-03T10:00:00Z");
    private final CreditBudgetLedger ledger = new CreditBudgetLedger(800, 100, clock, ZoneOffset.UTC);

    @Test
    void shouldKeepReserveOutOfBatchAllowance() {
        assertThat(ledger.remaining()).isEqualTo(800);
        assertThat(ledger.availableForBatch()).isEqualTo(700);
        assertThat(ledger.reserveFloor()).isEqualTo(100);
    }

    @Test
    void shouldNeverReportNegativeBatchAllowance() {
        // when
        ledger.charge(750);

        // then
        assertThat(ledger.remaining()).isEqualTo(50);
        assertThat(ledger.availableForBatch()).isZero();
    }

    @Test
    void shouldResetUsageWhenCalendarDateChanges() {
        // given
        ledger.charge(300);
        clock.advance(Duration.ofHours(14));

        // when
        var status = ledger.status();

        // then
        assertThat(status).isEqualTo(new BudgetStatus(LocalDate.of(2024, 6, 4), 800, 0, 800, 100, 700));
    }

    @Test
    void shouldKeepUsageWithinSameDay() {
        // given
        ledger.charge(8);
        clock.advance(Duration.ofHours(14).minusSeconds(1));

        // when
        ledger.charge(8);

        // then
        assertThat(ledger.status())
                .isEqualTo(new BudgetStatus(LocalDate.of(2024, 6, 3), 800, 16, 784, 100, 684));
    }

    @Test
    void shouldRollOverAtMidnightOfConfiguredZone() {
        // given Moscow is UTC+3, so its day ends at 21:00Z
        var moscowLedger = new CreditBudgetLedger(800, 100, clock, ZoneId.of("Europe/Moscow"));
        moscowLedger.charge(100);
        clock.advance(Duration.ofHours(11));

        // then
        assertThat(moscowLedger.remaining()).isEqualTo(800);
    }

    @Test
    void shouldRejectNegativeCharge() {
        assertThatThrownBy(() -> ledger.charge(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
