package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * FIFO lot queue of a single symbol. Not shared between symbols and not thread-safe.
 */
final class SymbolLedger {

    private final String symbol;
    private final long longTermHoldingDays;
    private final CorporateActionAdjuster adjuster;
    private final List<Lot> lots = new ArrayList<>();
    private final List<RealizedDisposal> disposals = new ArrayList<>();
    private final TransferPool transferPool = new TransferPool();
    private Money realizedPnl = Money.zero();
    private LocalDate lastDate;
    private long lastSequence;

    SymbolLedger(String symbol, long longTermHoldingDays, CorporateActionAdjuster adjuster) {
        this.symbol = symbol;
        this.longTermHoldingDays = longTermHoldingDays;
        this.adjuster = adjuster;
    }

    List<RealizedDisposal> apply(LedgerEvent event) {
        checkOrder(event);
        List<RealizedDisposal> created = switch (event.kind()) {
            case BUY, IPO -> {
                openLot(event, event.date(), event.hasPrice() ? event.unitPrice() : Money.zero(), !event.hasPrice());
                yield List.of();
            }
            case SELL, MERGER_OUT, DEMAT -> consume(event);
            case BONUS, RIGHTS -> {
                adjuster.openBonusLot(this, event);
                yield List.of();
            }
            case MERGER_IN -> {
                adjuster.openMergerLot(this, event);
                yield List.of();
            }
            case REARRANGEMENT -> {
                adjuster.openRearrangedLot(this, event);
                yield List.of();
            }
            case REARRANGEMENT_OUT -> adjuster.closeRearrangedLots(this, event);
        };
        lastDate = event.date();
        lastSequence = event.sequence();
        return created;
    }

    void checkOrder(LedgerEvent event) {
        if (lastDate == null) {
            return;
        }
        int byDate = event.date().compareTo(lastDate);
        if (byDate < 0 || (byDate == 0 && event.sequence() <= lastSequence)) {
            throw new OutOfOrderEventException(symbol, event.sequence(), event.date(), lastDate, lastSequence);
        }
    }

    void openLot(LedgerEvent event, LocalDate openedDate, Money unitCost, boolean costPending) {
        Lot lot = new Lot(symbol, event.sequence(), event.kind(), openedDate, event.quantity(), unitCost, costPending);
        int index = Collections.binarySearch(lots, lot, Lot.FIFO);
        lots.add(index < 0 ? -index - 1 : index + 1, lot);
    }

    /**
     * Drains {@code event.quantity()} shares oldest lot first. Nothing is mutated when the open lots
     * cannot cover the request.
     */
    List<RealizedDisposal> consume(LedgerEvent event) {
        long available = totalQuantity();
        if (event.quantity() > available) {
            throw new InsufficientSharesException(symbol, event.sequence(), event.kind(), event.quantity(), available);
        }

        boolean cashSale = event.kind() == EventKind.SELL && event.hasPrice();
        Money fee = event.fee() == null ? Money.zero() : event.fee();
        Money feeAllocated = Money.zero();
        long drawn = 0L;
        List<RealizedDisposal> created = new ArrayList<>();

        for (Lot lot : lots) {
            if (drawn == event.quantity()) {
                break;
            }
            if (!lot.isOpen()) {
                continue;
            }

            long take = Math.min(lot.getRemainingQuantity(), event.quantity() - drawn);
            drawn += take;
            lot.drain(take);

            Money costBasis = lot.isCostPending() ? null : lot.getUnitCost().multiply(take);
            Money proceeds = null;
            if (cashSale) {
                Money feeToDate = fee.prorate(drawn, event.quantity());
                Money feeShare = feeToDate.subtract(feeAllocated);
                feeAllocated = feeToDate;
                proceeds = event.unitPrice().multiply(take).subtract(feeShare);
            }
            Money gain = proceeds != null && costBasis != null ? proceeds.subtract(costBasis) : null;
            if (gain != null) {
                realizedPnl = realizedPnl.add(gain);
            }

            long holdingDays = ChronoUnit.DAYS.between(lot.getOpenedDate(), event.date());
            RealizedDisposal disposal = new RealizedDisposal(
                    symbol,
                    event.sequence(),
                    event.kind(),
                    event.date(),
                    lot.getLotId(),
                    lot.getOpenedDate(),
                    take,
                    proceeds,
                    costBasis,
                    gain,
                    holdingDays,
                    holdingDays > longTermHoldingDays
            );
            disposals.add(disposal);
            created.add(disposal);
        }
        return List.copyOf(created);
    }

    long totalQuantity() {
        long total = 0L;
        for (Lot lot : lots) {
            total += lot.getRemainingQuantity();
        }
        return total;
    }

    HoldingSnapshot snapshot() {
        long quantity = 0L;
        Money totalCost = Money.zero();
        boolean costPending = false;
        for (Lot lot : lots) {
            if (!lot.isOpen()) {
                continue;
            }
            quantity += lot.getRemainingQuantity();
            totalCost = totalCost.add(lot.remainingCost());
            costPending |= lot.isCostPending();
        }
        Money averageCost = quantity == 0L ? Money.zero() : totalCost.divide(quantity);
        return new HoldingSnapshot(symbol, quantity, totalCost, averageCost, realizedPnl, costPending);
    }

    List<Lot> lotCopies() {
        List<Lot> copies = new ArrayList<>(lots.size());
        for (Lot lot : lots) {
            copies.add(lot.copy());
        }
        return copies;
    }

    List<RealizedDisposal> disposals() {
        return Collections.unmodifiableList(disposals);
    }

    TransferPool transferPool() {
        return transferPool;
    }

    String symbol() {
        return symbol;
    }

    /**
     * Quantity and cost released by rearrangement debits, waiting to be carried into the lots the
     * matching credits open.
     */
    static final class TransferPool {

        private long quantity;
        private Money cost = Money.zero();
        private boolean costPending;

        void deposit(long addedQuantity, Money addedCost, boolean pending) {
            quantity += addedQuantity;
            cost = cost.add(addedCost);
            costPending |= pending;
        }

        /**
         * Takes the cost of up to {@code requested} pooled shares; the last withdrawal takes whatever
         * rounding left behind.
         */
        Money withdraw(long requested) {
            if (quantity == 0L) {
                return Money.zero();
            }
            long take = Math.min(requested, quantity);
            Money share = take == quantity ? cost : cost.prorate(take, quantity);
            quantity -= take;
            cost = cost.subtractNonNegative(share);
            return share;
        }

        boolean isEmpty() {
            return quantity == 0L;
        }

        boolean isCostPending() {
            return costPending;
        }

        void clearPendingIfDrained() {
            if (quantity == 0L) {
                costPending = false;
            }
        }
    }
}
