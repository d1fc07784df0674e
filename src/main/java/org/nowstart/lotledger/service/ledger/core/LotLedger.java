package org.nowstart.lotledger.service.ledger.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-run owner of every symbol's FIFO lot queue.
 *
 * <p>Events are routed to their own symbol's queue only. For each symbol they must be applied in
 * strictly increasing {@code (date, sequence)} order, within one call and across calls; sort with
 * {@link LedgerEvent#CHRONOLOGICAL} first. A violation is rejected before anything changes.
 *
 * <p>Not thread-safe. Build one instance per import or rebuild run.
 */
public class LotLedger {

    public static final long DEFAULT_LONG_TERM_HOLDING_DAYS = 365L;

    private final long longTermHoldingDays;
    private final CorporateActionAdjuster adjuster = new CorporateActionAdjuster();
    private final Map<String, SymbolLedger> ledgers = new TreeMap<>();

    public LotLedger() {
        this(DEFAULT_LONG_TERM_HOLDING_DAYS);
    }

    public LotLedger(long longTermHoldingDays) {
        this.longTermHoldingDays = longTermHoldingDays;
    }

    /**
     * Applies one event to its symbol.
     *
     * @return the disposals the event created, empty for acquisitions
     * @throws InsufficientSharesException when a reduction exceeds the open quantity; lots are untouched
     * @throws OutOfOrderEventException    when the event is not later than the symbol's last event
     */
    public List<RealizedDisposal> apply(LedgerEvent event) {
        return ledgerFor(event.symbol()).apply(event);
    }

    /**
     * Applies a batch after checking that it is chronological per symbol. The order check covers the
     * whole batch before the first event is applied.
     */
    public List<RealizedDisposal> applyEvents(List<LedgerEvent> events) {
        Map<String, LedgerEvent> previousBySymbol = new HashMap<>();
        for (LedgerEvent event : events) {
            LedgerEvent previous = previousBySymbol.put(event.symbol(), event);
            if (previous != null && LedgerEvent.CHRONOLOGICAL.compare(previous, event) >= 0) {
                throw new OutOfOrderEventException(event.symbol(), event.sequence(), event.date(),
                        previous.date(), previous.sequence());
            }
            if (previous == null && ledgers.containsKey(event.symbol())) {
                ledgers.get(event.symbol()).checkOrder(event);
            }
        }

        List<RealizedDisposal> created = new ArrayList<>();
        for (LedgerEvent event : events) {
            created.addAll(apply(event));
        }
        return created;
    }

    public HoldingSnapshot holding(String symbol) {
        SymbolLedger ledger = ledgers.get(normalize(symbol));
        return ledger == null ? HoldingSnapshot.empty(normalize(symbol)) : ledger.snapshot();
    }

    /**
     * Copies of all lots of a symbol in FIFO order, drained ones included.
     */
    public List<Lot> lots(String symbol) {
        SymbolLedger ledger = ledgers.get(normalize(symbol));
        return ledger == null ? List.of() : ledger.lotCopies();
    }

    public List<Lot> openLots(String symbol) {
        return lots(symbol).stream()
                .filter(Lot::isOpen)
                .toList();
    }

    public List<RealizedDisposal> disposals(String symbol) {
        SymbolLedger ledger = ledgers.get(normalize(symbol));
        return ledger == null ? List.of() : ledger.disposals();
    }

    public long totalQuantity(String symbol) {
        SymbolLedger ledger = ledgers.get(normalize(symbol));
        return ledger == null ? 0L : ledger.totalQuantity();
    }

    /**
     * Cost basis drawn from lots by one disposal event. Empty when the event drew nothing or drew from
     * a lot whose cost is unknown.
     */
    public Optional<Money> costDrawnBy(String symbol, long sequence) {
        Money total = Money.zero();
        boolean found = false;
        for (RealizedDisposal disposal : disposals(symbol)) {
            if (disposal.eventSequence() != sequence) {
                continue;
            }
            if (disposal.costBasis() == null) {
                return Optional.empty();
            }
            found = true;
            total = total.add(disposal.costBasis());
        }
        return found ? Optional.of(total) : Optional.empty();
    }

    public List<String> symbols() {
        return List.copyOf(ledgers.keySet());
    }

    private SymbolLedger ledgerFor(String symbol) {
        return ledgers.computeIfAbsent(symbol, key -> new SymbolLedger(key, longTermHoldingDays, adjuster));
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
