package org.nowstart.lotledger.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.nowstart.lotledger.data.dto.DisposalDto;
import org.nowstart.lotledger.data.dto.HoldingDto;
import org.nowstart.lotledger.data.dto.LotDto;
import org.nowstart.lotledger.data.dto.PortfolioSummaryDto;
import org.nowstart.lotledger.data.dto.TransactionDto;
import org.nowstart.lotledger.data.dto.TransactionPageDto;
import org.nowstart.lotledger.data.entity.DisposalRecord;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.entity.MarketQuote;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.repository.DisposalRecordRepository;
import org.nowstart.lotledger.repository.HoldingRecordRepository;
import org.nowstart.lotledger.repository.LedgerTransactionRepository;
import org.nowstart.lotledger.repository.LotRecordRepository;
import org.nowstart.lotledger.repository.MarketQuoteRepository;
import org.nowstart.lotledger.repository.TransactionSpecifications;
import org.nowstart.lotledger.service.valuation.HoldingValuation;
import org.nowstart.lotledger.service.valuation.PortfolioAggregator;
import org.nowstart.lotledger.service.valuation.PortfolioTotals;
import org.nowstart.lotledger.service.valuation.ValuationEngine;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RefreshScope
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PortfolioQueryService {

    private final HoldingRecordRepository holdingRecordRepository;
    private final LotRecordRepository lotRecordRepository;
    private final DisposalRecordRepository disposalRecordRepository;
    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final MarketQuoteRepository marketQuoteRepository;
    private final ValuationEngine valuationEngine;
    private final PortfolioAggregator portfolioAggregator;
    private final LedgerProperties ledgerProperties;

    public List<HoldingDto> getHoldings(boolean valued) {
        List<HoldingRecord> holdings = holdingRecordRepository.findByTotalQuantityGreaterThanOrderBySymbolAsc(0L);
        if (!valued) {
            return holdings.stream()
                    .map(LedgerDtoMapper::toHoldingDto)
                    .toList();
        }
        return value(holdings).stream()
                .map(LedgerDtoMapper::toHoldingDto)
                .toList();
    }

    public HoldingDto getHolding(String symbol) {
        HoldingRecord holding = findHolding(symbol);
        return LedgerDtoMapper.toHoldingDto(value(List.of(holding)).get(0));
    }

    public List<LotDto> getLots(String symbol) {
        HoldingRecord holding = findHolding(symbol);
        return lotRecordRepository.findBySymbolOrderByOpenedDateAscLotIdAsc(holding.getSymbol())
                .stream()
                .map(LedgerDtoMapper::toLotDto)
                .toList();
    }

    public List<DisposalDto> getDisposals(String symbol) {
        List<DisposalRecord> disposals = symbol == null || symbol.isBlank()
                ? disposalRecordRepository.findAllByOrderByDisposalDateAscTransactionIdAscIdAsc()
                : disposalRecordRepository.findBySymbolOrderByDisposalDateAscTransactionIdAscIdAsc(normalize(symbol));
        return disposals.stream()
                .map(LedgerDtoMapper::toDisposalDto)
                .toList();
    }

    /**
     * Totals over every symbol ever held. Closed symbols contribute realized P&amp;L only.
     */
    public PortfolioSummaryDto getSummary() {
        PortfolioTotals totals = portfolioAggregator.aggregate(value(holdingRecordRepository.findAllByOrderBySymbolAsc()));
        return new PortfolioSummaryDto(
                LedgerDtoMapper.major(totals.totalInvestment()),
                LedgerDtoMapper.major(totals.currentValue()),
                LedgerDtoMapper.major(totals.totalUnrealizedPnl()),
                totals.totalUnrealizedPnlPercent(),
                LedgerDtoMapper.major(totals.totalRealizedPnl()),
                totals.holdingsCount(),
                totals.pricedCount(),
                totals.priceUnavailableCount(),
                totals.costPendingCount()
        );
    }

    public TransactionPageDto getTransactions(String symbol, EventKind kind, LocalDate from, LocalDate to, int page, int size) {
        if (page < 0 || size < 1 || size > ledgerProperties.maxPageSize()) {
            throw new LedgerApiException(HttpStatus.BAD_REQUEST, "invalid_page",
                    "page must be >= 0 and size between 1 and " + ledgerProperties.maxPageSize());
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new LedgerApiException(HttpStatus.BAD_REQUEST, "invalid_date_range", "from must not be after to");
        }

        PageRequest pageRequest = PageRequest.of(page, size, Sort.by("tradeDate").ascending().and(Sort.by("id").ascending()));
        Page<LedgerTransaction> result = ledgerTransactionRepository.findAll(
                TransactionSpecifications.filter(symbol, kind, from, to),
                pageRequest
        );
        List<TransactionDto> content = result.getContent()
                .stream()
                .map(LedgerDtoMapper::toTransactionDto)
                .toList();
        return new TransactionPageDto(content, result.getNumber(), result.getSize(), result.getTotalElements(), result.getTotalPages());
    }

    private List<HoldingValuation> value(List<HoldingRecord> holdings) {
        List<String> symbols = holdings.stream()
                .map(HoldingRecord::getSymbol)
                .toList();
        Map<String, MarketQuote> quotes = marketQuoteRepository.findAllById(symbols)
                .stream()
                .collect(Collectors.toMap(MarketQuote::getSymbol, Function.identity()));

        List<HoldingValuation> valuations = new ArrayList<>(holdings.size());
        for (HoldingRecord holding : holdings) {
            MarketQuote quote = quotes.get(holding.getSymbol());
            valuations.add(valuationEngine.value(holding.toSnapshot(), quote == null ? null : quote.toQuote()));
        }
        return valuations;
    }

    private HoldingRecord findHolding(String symbol) {
        return holdingRecordRepository.findById(normalize(symbol))
                .orElseThrow(() -> new LedgerApiException(HttpStatus.NOT_FOUND, "holding_not_found",
                        "No holding for symbol " + symbol));
    }

    private String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
