package org.nowstart.lotledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.lotledger.data.dto.QuoteSyncResultDto;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.nowstart.lotledger.data.entity.MarketQuote;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.repository.HoldingRecordRepository;
import org.nowstart.lotledger.repository.MarketQuoteRepository;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.quote.Quote;
import org.nowstart.lotledger.service.quote.QuoteProvider;

@ExtendWith(MockitoExtension.class)
class QuoteSyncServiceTest {

    private static final Instant QUOTED_AT = Instant.parse("2025-06-22T09:15:00Z");

    @Mock
    private QuoteProvider quoteProvider;
    @Mock
    private HoldingRecordRepository holdingRecordRepository;
    @Mock
    private MarketQuoteRepository marketQuoteRepository;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @SuppressWarnings("unchecked")
    void syncQuotes_storesFetchedQuotesAndIsolatesFailures() {
        when(holdingRecordRepository.findByTotalQuantityGreaterThanOrderBySymbolAsc(0L))
                .thenReturn(List.of(holding("API"), holding("BPCL"), holding("KBL")));
        when(quoteProvider.latestQuote("API")).thenReturn(Optional.of(quote("API", "121.50")));
        when(quoteProvider.latestQuote("BPCL")).thenReturn(Optional.empty());
        when(quoteProvider.latestQuote("KBL")).thenThrow(new IllegalStateException("connection refused"));

        QuoteSyncResultDto result = service(Duration.ofSeconds(5)).syncQuotes();

        assertThat(result.requested()).isEqualTo(3);
        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.errors()).containsExactly("BPCL: no quote available", "KBL: connection refused");

        ArgumentCaptor<List<MarketQuote>> captor = ArgumentCaptor.forClass(List.class);
        verify(marketQuoteRepository).saveAll(captor.capture());
        MarketQuote saved = captor.getValue().get(0);
        assertThat(saved.getSymbol()).isEqualTo("API");
        assertThat(saved.getLastPrice()).isEqualByComparingTo("121.50");
        assertThat(saved.getQuotedAt()).isEqualTo(QUOTED_AT);
    }

    @Test
    void syncQuotes_reportsSymbolsThatExceedTimeout() {
        when(holdingRecordRepository.findByTotalQuantityGreaterThanOrderBySymbolAsc(0L))
                .thenReturn(List.of(holding("API")));
        when(quoteProvider.latestQuote("API")).thenAnswer(invocation -> {
            Thread.sleep(5_000L);
            return Optional.of(quote("API", "121.50"));
        });

        QuoteSyncResultDto result = service(Duration.ofMillis(100)).syncQuotes();

        assertThat(result.updated()).isZero();
        assertThat(result.errors()).containsExactly("API: timed out");
        verifyNoInteractions(marketQuoteRepository);
    }

    @Test
    void syncQuotes_doesNothingWithoutOpenHoldings() {
        when(holdingRecordRepository.findByTotalQuantityGreaterThanOrderBySymbolAsc(0L)).thenReturn(List.of());

        QuoteSyncResultDto result = service(Duration.ofSeconds(5)).syncQuotes();

        assertThat(result.requested()).isZero();
        assertThat(result.errors()).isEmpty();
        verifyNoInteractions(quoteProvider, marketQuoteRepository);
    }

    private QuoteSyncService service(Duration timeout) {
        return new QuoteSyncService(quoteProvider, holdingRecordRepository, marketQuoteRepository, executor, properties(timeout));
    }

    private static HoldingRecord holding(String symbol) {
        return HoldingRecord.builder()
                .symbol(symbol)
                .totalQuantity(10L)
                .totalCost(new BigDecimal("1000.00"))
                .averageCost(new BigDecimal("100.00"))
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }

    private static Quote quote(String symbol, String price) {
        return new Quote(symbol, Money.fromMajorUnits(price), QUOTED_AT);
    }

    private static LedgerProperties properties(Duration timeout) {
        return new LedgerProperties(
                "http://localhost:8090",
                "",
                "X-API-KEY",
                true,
                Duration.ofMinutes(15),
                2,
                timeout,
                List.of("yyyy-MM-dd"),
                365L,
                200
        );
    }
}
