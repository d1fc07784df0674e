package org.nowstart.lotledger.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lotledger.data.dto.QuoteSyncResultDto;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.nowstart.lotledger.data.entity.MarketQuote;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.repository.HoldingRecordRepository;
import org.nowstart.lotledger.repository.MarketQuoteRepository;
import org.nowstart.lotledger.service.quote.Quote;
import org.nowstart.lotledger.service.quote.QuoteProvider;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Refreshes stored quotes for every open holding. Symbols are fetched concurrently on the quote-sync
 * pool; a symbol that fails or times out is reported and skipped without affecting the others.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class QuoteSyncService {

    private final QuoteProvider quoteProvider;
    private final HoldingRecordRepository holdingRecordRepository;
    private final MarketQuoteRepository marketQuoteRepository;
    private final ExecutorService quoteSyncExecutor;
    private final LedgerProperties ledgerProperties;

    public QuoteSyncResultDto syncQuotes() {
        List<String> symbols = holdingRecordRepository.findByTotalQuantityGreaterThanOrderBySymbolAsc(0L)
                .stream()
                .map(HoldingRecord::getSymbol)
                .toList();
        if (symbols.isEmpty()) {
            return new QuoteSyncResultDto(0, 0, 0, List.of());
        }

        List<Callable<Optional<Quote>>> tasks = symbols.stream()
                .<Callable<Optional<Quote>>>map(symbol -> () -> quoteProvider.latestQuote(symbol))
                .toList();

        List<Future<Optional<Quote>>> futures;
        try {
            futures = quoteSyncExecutor.invokeAll(
                    tasks,
                    ledgerProperties.quoteSyncTimeout().toMillis(),
                    TimeUnit.MILLISECONDS
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerApiException(HttpStatus.SERVICE_UNAVAILABLE, "quote_sync_interrupted", "Quote sync was interrupted");
        }

        Map<String, Quote> quotes = new TreeMap<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            collect(symbol, futures.get(i), quotes, errors);
        }

        if (!quotes.isEmpty()) {
            marketQuoteRepository.saveAll(quotes.values().stream()
                    .map(this::toMarketQuote)
                    .toList());
        }

        log.info("event=quote_sync requested={} updated={} failed={}", symbols.size(), quotes.size(), errors.size());
        return new QuoteSyncResultDto(symbols.size(), quotes.size(), errors.size(), errors);
    }

    private void collect(String symbol, Future<Optional<Quote>> future, Map<String, Quote> quotes, List<String> errors) {
        try {
            Optional<Quote> quote = future.get();
            if (quote.isPresent()) {
                quotes.put(symbol, quote.get());
                return;
            }
            log.warn("event=quote_unavailable symbol={} reason=not_found", symbol);
            errors.add(symbol + ": no quote available");
        } catch (CancellationException e) {
            log.warn("event=quote_unavailable symbol={} reason=timeout", symbol);
            errors.add(symbol + ": timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("event=quote_unavailable symbol={} reason={}", symbol, cause.getMessage());
            errors.add(symbol + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add(symbol + ": interrupted");
        }
    }

    private MarketQuote toMarketQuote(Quote quote) {
        return MarketQuote.builder()
                .symbol(quote.symbol())
                .lastPrice(quote.lastPrice().toMajorUnits())
                .quotedAt(quote.asOf())
                .build();
    }
}
