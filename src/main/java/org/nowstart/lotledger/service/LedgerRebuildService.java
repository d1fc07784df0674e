package org.nowstart.lotledger.service;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lotledger.data.dto.RebuildResultDto;
import org.nowstart.lotledger.data.dto.ReplayFailureDto;
import org.nowstart.lotledger.data.entity.DisposalRecord;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.entity.LotRecord;
import org.nowstart.lotledger.data.exception.LedgerReplayException;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.repository.DisposalRecordRepository;
import org.nowstart.lotledger.repository.HoldingRecordRepository;
import org.nowstart.lotledger.repository.LedgerTransactionRepository;
import org.nowstart.lotledger.repository.LotRecordRepository;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.LedgerEvent;
import org.nowstart.lotledger.service.ledger.core.LedgerInvariantException;
import org.nowstart.lotledger.service.ledger.core.Lot;
import org.nowstart.lotledger.service.ledger.core.LotLedger;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.ledger.core.RealizedDisposal;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Replays every stored transaction into a fresh {@link LotLedger} and replaces the persisted lots,
 * disposals and holdings with the result.
 *
 * <p>Symbols replay one at a time. A merger target replays after the symbols it absorbs, so the cost
 * drawn from their lots can be carried into the target's new lot.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class LedgerRebuildService {

    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final LotRecordRepository lotRecordRepository;
    private final DisposalRecordRepository disposalRecordRepository;
    private final HoldingRecordRepository holdingRecordRepository;
    private final LedgerProperties ledgerProperties;

    @Transactional
    public RebuildResultDto rebuild() {
        List<LedgerTransaction> transactions = ledgerTransactionRepository.findAllByOrderByTradeDateAscIdAsc();
        LotLedger ledger = replay(transactions);
        RebuildResultDto result = persist(ledger, transactions.size());
        log.info(
                "event=ledger_rebuild transactions={} symbols={} lots={} disposals={} cost_pending={}",
                result.transactions(),
                result.symbols(),
                result.lots(),
                result.disposals(),
                result.costPendingSymbols()
        );
        return result;
    }

    /**
     * @throws LedgerReplayException when any symbol cannot be replayed; lists every failed symbol
     */
    LotLedger replay(List<LedgerTransaction> transactions) {
        Map<String, List<LedgerEvent>> eventsBySymbol = new TreeMap<>();
        for (LedgerTransaction transaction : transactions) {
            LedgerEvent event = transaction.toEvent();
            eventsBySymbol.computeIfAbsent(event.symbol(), key -> new ArrayList<>()).add(event);
        }
        eventsBySymbol.values().forEach(events -> events.sort(LedgerEvent.CHRONOLOGICAL));

        MergerPlan mergerPlan = MergerPlan.of(eventsBySymbol);
        LotLedger ledger = new LotLedger(ledgerProperties.longTermHoldingDays());
        List<ReplayFailureDto> failures = new ArrayList<>();
        Set<String> failedSymbols = new LinkedHashSet<>();

        for (String symbol : mergerPlan.replayOrder(eventsBySymbol.keySet())) {
            List<LedgerEvent> events = mergerPlan.priceMergerEvents(symbol, eventsBySymbol.get(symbol), ledger, failedSymbols);
            try {
                ledger.applyEvents(events);
            } catch (LedgerInvariantException e) {
                log.warn("event=ledger_replay_failed symbol={} transaction={} reason={}",
                        e.getSymbol(), e.getSequence(), e.getMessage());
                failures.add(new ReplayFailureDto(e.getSymbol(), e.getSequence(), e.getMessage()));
                failedSymbols.add(symbol);
            }
        }

        if (!failures.isEmpty()) {
            log.error("event=ledger_rebuild_aborted failed_symbols={}", failedSymbols);
            throw new LedgerReplayException(failures);
        }
        return ledger;
    }

    private RebuildResultDto persist(LotLedger ledger, int transactionCount) {
        lotRecordRepository.deleteAllInBatch();
        disposalRecordRepository.deleteAllInBatch();
        holdingRecordRepository.deleteAllInBatch();

        List<LotRecord> lots = new ArrayList<>();
        List<DisposalRecord> disposals = new ArrayList<>();
        List<HoldingRecord> holdings = new ArrayList<>();
        List<String> costPendingSymbols = new ArrayList<>();

        for (String symbol : ledger.symbols()) {
            for (Lot lot : ledger.lots(symbol)) {
                lots.add(LedgerDtoMapper.toLotRecord(lot));
            }
            for (RealizedDisposal disposal : ledger.disposals(symbol)) {
                disposals.add(LedgerDtoMapper.toDisposalRecord(disposal));
            }
            HoldingSnapshot holding = ledger.holding(symbol);
            holdings.add(LedgerDtoMapper.toHoldingRecord(holding));
            if (holding.costPending()) {
                costPendingSymbols.add(symbol);
            }
        }

        lotRecordRepository.saveAll(lots);
        disposalRecordRepository.saveAll(disposals);
        holdingRecordRepository.saveAll(holdings);
        return new RebuildResultDto(transactionCount, holdings.size(), lots.size(), disposals.size(), costPendingSymbols);
    }

    /**
     * Links each merger target to the symbols whose MERGER_OUT rows share the date of its MERGER_IN rows.
     * A date with more than one target symbol cannot be split and stays unresolved.
     */
    static final class MergerPlan {

        private final Map<LocalDate, Set<String>> targetsByDate;
        private final Map<LocalDate, List<LedgerEvent>> sourcesByDate;
        private final Map<String, Set<String>> dependencies;

        private MergerPlan(
                Map<LocalDate, Set<String>> targetsByDate,
                Map<LocalDate, List<LedgerEvent>> sourcesByDate,
                Map<String, Set<String>> dependencies
        ) {
            this.targetsByDate = targetsByDate;
            this.sourcesByDate = sourcesByDate;
            this.dependencies = dependencies;
        }

        static MergerPlan of(Map<String, List<LedgerEvent>> eventsBySymbol) {
            Map<LocalDate, Set<String>> targetsByDate = new HashMap<>();
            Map<LocalDate, List<LedgerEvent>> sourcesByDate = new HashMap<>();
            for (List<LedgerEvent> events : eventsBySymbol.values()) {
                for (LedgerEvent event : events) {
                    if (event.kind() == EventKind.MERGER_IN) {
                        targetsByDate.computeIfAbsent(event.date(), key -> new TreeSet<>()).add(event.symbol());
                    } else if (event.kind() == EventKind.MERGER_OUT) {
                        sourcesByDate.computeIfAbsent(event.date(), key -> new ArrayList<>()).add(event);
                    }
                }
            }

            Map<String, Set<String>> dependencies = new TreeMap<>();
            targetsByDate.forEach((date, targets) -> {
                if (targets.size() != 1) {
                    return;
                }
                String target = targets.iterator().next();
                for (LedgerEvent source : sourcesByDate.getOrDefault(date, List.of())) {
                    if (!source.symbol().equals(target)) {
                        dependencies.computeIfAbsent(target, key -> new TreeSet<>()).add(source.symbol());
                    }
                }
            });
            return new MergerPlan(targetsByDate, sourcesByDate, dependencies);
        }

        /**
         * Symbols in alphabetical order, except that merger sources come before their targets. Symbols
         * caught in a merger cycle replay last.
         */
        List<String> replayOrder(Set<String> symbols) {
            Map<String, Integer> pending = new TreeMap<>();
            Map<String, List<String>> dependents = new HashMap<>();
            for (String symbol : symbols) {
                Set<String> sources = new TreeSet<>(dependencies.getOrDefault(symbol, Set.of()));
                sources.retainAll(symbols);
                pending.put(symbol, sources.size());
                for (String source : sources) {
                    dependents.computeIfAbsent(source, key -> new ArrayList<>()).add(symbol);
                }
            }

            Deque<String> ready = new ArrayDeque<>();
            pending.forEach((symbol, count) -> {
                if (count == 0) {
                    ready.add(symbol);
                }
            });

            List<String> order = new ArrayList<>(symbols.size());
            while (!ready.isEmpty()) {
                String symbol = ready.poll();
                order.add(symbol);
                for (String dependent : dependents.getOrDefault(symbol, List.of())) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }

            if (order.size() < symbols.size()) {
                for (String symbol : pending.keySet()) {
                    if (!order.contains(symbol)) {
                        log.warn("event=merger_cycle symbol={} sources={}", symbol, dependencies.get(symbol));
                        order.add(symbol);
                    }
                }
            }
            return order;
        }

        /**
         * Gives each unpriced MERGER_IN event of {@code symbol} the unit cost drawn from its sources on the
         * same date. Events whose cost cannot be determined are returned unchanged and open cost-pending.
         */
        List<LedgerEvent> priceMergerEvents(String symbol, List<LedgerEvent> events, LotLedger ledger, Set<String> failedSymbols) {
            Map<LocalDate, Optional<Money>> unitCostByDate = new HashMap<>();
            List<LedgerEvent> priced = new ArrayList<>(events.size());
            for (LedgerEvent event : events) {
                if (event.kind() != EventKind.MERGER_IN || event.hasPrice()) {
                    priced.add(event);
                    continue;
                }
                Optional<Money> unitCost = unitCostByDate.computeIfAbsent(
                        event.date(), date -> transferredUnitCost(symbol, date, events, ledger, failedSymbols));
                priced.add(unitCost.map(event::withUnitPrice).orElse(event));
            }
            return priced;
        }

        private Optional<Money> transferredUnitCost(
                String symbol,
                LocalDate date,
                List<LedgerEvent> events,
                LotLedger ledger,
                Set<String> failedSymbols
        ) {
            Set<String> targets = targetsByDate.getOrDefault(date, Set.of());
            if (targets.size() != 1) {
                log.warn("event=merger_cost_ambiguous symbol={} date={} targets={}", symbol, date, targets);
                return Optional.empty();
            }

            Money drawn = Money.zero();
            boolean found = false;
            for (LedgerEvent source : sourcesByDate.getOrDefault(date, List.of())) {
                if (source.symbol().equals(symbol)) {
                    continue;
                }
                if (failedSymbols.contains(source.symbol())) {
                    return Optional.empty();
                }
                Optional<Money> cost = ledger.costDrawnBy(source.symbol(), source.sequence());
                if (cost.isEmpty()) {
                    return Optional.empty();
                }
                drawn = drawn.add(cost.get());
                found = true;
            }
            if (!found) {
                return Optional.empty();
            }

            long quantity = 0L;
            for (LedgerEvent event : events) {
                if (event.kind() == EventKind.MERGER_IN && event.date().equals(date)) {
                    quantity += event.quantity();
                }
            }
            return Optional.of(drawn.divide(quantity));
        }
    }
}
