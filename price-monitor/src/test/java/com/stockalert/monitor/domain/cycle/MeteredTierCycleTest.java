package com.stockalert.monitor.domain.cycle;

import static com.stockalert.monitor.test.fixtures.AlertFixtures.NYSE_OPEN_MOEX_OPEN;
import static com.stockalert.monitor.test.fixtures.AlertFixtures.SATURDAY;
import static com.stockalert.monitor.test.fixtures.AlertFixtures.domesticAlertBuilder;
import static com.stockalert.monitor.test.fixtures.AlertFixtures.foreignAlertBuilder;
import static com.stockalert.monitor.test.fixtures.AlertFixtures.monitored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.stockalert.monitor.domain.alert.AlertRepository;
import com.stockalert.monitor.domain.evaluation.PriceUpdateEvaluator;
import com.stockalert.monitor.domain.market.MarketCalendar;
import com.stockalert.monitor.domain.quote.ProviderTier;
import com.stockalert.monitor.domain.quote.QuoteProvider;
import com.stockalert.monitor.domain.quote.QuoteProviderRegistry;
import com.stockalert.monitor.domain.selection.DueAlertSelector;
import com.stockalert.monitor.test.fixtures.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class MeteredTierCycleTest {

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private PriceUpdateEvaluator evaluator;

    @Mock
    private QuoteProvider meteredProvider;

    private final MutableClock clock = new MutableClock(NYSE_OPEN_MOEX_OPEN);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private MeteredTierCycle cycle;

    @BeforeEach
    void setUp() {
        given(meteredProvider.tier()).willReturn(ProviderTier.METERED);
        var calendar = new MarketCalendar(clock, Duration.ofMinutes(10));
        cycle = new MeteredTierCycle(
                alertRepository,
                new DueAlertSelector(calendar),
                new QuoteProviderRegistry(List.of(meteredProvider)),
                evaluator,
                calendar,
                meterRegistry,
                clock);
    }

    @Test
    void shouldMakeNoCallsWhileAllForeignExchangesAreClosed() {
        // given
        clock.set(SATURDAY);

        // when
        var report = cycle.run();

        // then
        assertThat(report).isEqualTo(CycleReport.empty());
        then(alertRepository).shouldHaveNoInteractions();
        then(meteredProvider).should().tier();
        then(meteredProvider).shouldHaveNoMoreInteractions();
    }

    @Test
    void shouldFetchDistinctTickersOfAlertsOnOpenForeignExchanges() {
        // given
        var aapl = monitored(foreignAlertBuilder().id(1L).build());
        var aaplAgain = monitored(foreignAlertBuilder().id(2L).ownerId(2002L).build());
        var tencent = monitored(foreignAlertBuilder().id(3L).ticker("0700.HK").exchange("HKEX").build());
        var sber = monitored(domesticAlertBuilder().id(4L).build());
        var prices = Map.of("AAPL", new BigDecimal("101.00"));
        given(alertRepository.findActiveMonitored()).willReturn(List.of(aapl, aaplAgain, tencent, sber));
        given(meteredProvider.fetchMany(List.of("AAPL"))).willReturn(prices);
        given(evaluator.applyAll(List.of(aapl, aaplAgain), prices, NYSE_OPEN_MOEX_OPEN))
                .willReturn(new CycleReport(2, 1, 2, 0, false));

        // when
        var report = cycle.run();

        // then
        assertThat(report).isEqualTo(new CycleReport(2, 1, 2, 0, false));
        assertThat(meterRegistry.counter("monitor.quotes.received", "tier", "METERED").count()).isEqualTo(1.0);
    }

    @Test
    void shouldAbortCycleWhenTransactionCannotBeOpened() {
        // given
        given(alertRepository.findActiveMonitored()).willThrow(new CannotCreateTransactionException("connection refused"));

        // when
        var report = cycle.run();

        // then
        assertThat(report).isEqualTo(CycleReport.abortedBeforeStart());
        then(meteredProvider).should().tier();
        then(meteredProvider).shouldHaveNoMoreInteractions();
        then(evaluator).shouldHaveNoInteractions();
    }

    @Test
    void shouldNotEvaluateWhenMeteredTierReturnsNothing() {
        // given
        var aapl = monitored(foreignAlertBuilder().build());
        given(alertRepository.findActiveMonitored()).willReturn(List.of(aapl));
        given(meteredProvider.fetchMany(List.of("AAPL"))).willReturn(Map.of());

        // when
        var report = cycle.run();

        // then
        assertThat(report).isEqualTo(new CycleReport(1, 0, 0, 0, false));
        then(evaluator).shouldHaveNoInteractions();
    }
}
