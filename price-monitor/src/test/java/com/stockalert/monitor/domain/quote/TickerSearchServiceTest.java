package com.stockalert.monitor.domain.quote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.inOrder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TickerSearchServiceTest {

    @Mock
    private QuoteProvider domestic;

    @Mock
    private QuoteProvider metered;

    @Mock
    private QuoteProvider freeBatch;

    private TickerSearchService service;

    @BeforeEach
    void setUp() {
        given(domestic.tier()).willReturn(ProviderTier.DOMESTIC);
        given(metered.tier()).willReturn(ProviderTier.METERED);
        given(freeBatch.tier()).willReturn(ProviderTier.FREE_BATCH);
        service = new TickerSearchService(new QuoteProviderRegistry(List.of(freeBatch, metered, domestic)));
    }

    @Test
    void shouldReturnDomesticQuoteWithoutAskingOtherTiers() {
        // given
        var sber = Quote.builder().ticker("SBER").price(new BigDecimal("305.10")).exchange("MOEX").build();
        given(domestic.fetchOne("SBER")).willReturn(Optional.of(sber));

        // when
        var result = service.search(" sber ");

        // then
        assertThat(result).contains(sber);
        then(metered).should().tier();
        then(metered).shouldHaveNoMoreInteractions();
    }

    @Test
    void shouldFallBackInFixedOrder() {
        // given
        var aapl = Quote.builder().ticker("AAPL").price(new BigDecimal("190.00")).exchange("NASDAQ").build();
        given(domestic.fetchOne("AAPL")).willReturn(Optional.empty());
        given(metered.fetchOne("AAPL")).willReturn(Optional.empty());
        given(freeBatch.fetchOne("AAPL")).willReturn(Optional.of(aapl));

        // when
        var result = service.search("aapl");

        // then
        assertThat(result).contains(aapl);
        var order = inOrder(domestic, metered, freeBatch);
        order.verify(domestic).fetchOne("AAPL");
        order.verify(metered).fetchOne("AAPL");
        order.verify(freeBatch).fetchOne("AAPL");
    }

    @Test
    void shouldReturnEmptyForBlankTicker() {
        assertThat(service.search("  ")).isEmpty();
        assertThat(service.search(null)).isEmpty();
    }
}
