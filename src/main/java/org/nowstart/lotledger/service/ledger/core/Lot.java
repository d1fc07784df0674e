package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;
import java.util.Comparator;
import lombok.Getter;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * Shares of one symbol acquired at one cost basis. Only the owning {@link LotLedger} drains a lot;
 * drained lots stay in the queue at zero so realized disposals keep pointing at them.
 */
@Getter
public final class Lot {

    static final Comparator<Lot> FIFO = Comparator
            .comparing(Lot::getOpenedDate)
            .thenComparingLong(Lot::getOpeningSequence);

    private final String symbol;
    private final long openingSequence;
    private final EventKind sourceKind;
    private final LocalDate openedDate;
    private final long openedQuantity;
    private final Money unitCost;
    private final boolean costPending;
    private long remainingQuantity;

    Lot(String symbol, long openingSequence, EventKind sourceKind, LocalDate openedDate,
        long openedQuantity, Money unitCost, boolean costPending) {
        this.symbol = symbol;
        this.openingSequence = openingSequence;
        this.sourceKind = sourceKind;
        this.openedDate = openedDate;
        this.openedQuantity = openedQuantity;
        this.remainingQuantity = openedQuantity;
        this.unitCost = unitCost;
        this.costPending = costPending;
    }

    private Lot(Lot source) {
        this(source.symbol, source.openingSequence, source.sourceKind, source.openedDate,
                source.openedQuantity, source.unitCost, source.costPending);
        this.remainingQuantity = source.remainingQuantity;
    }

    /**
     * Lots are identified by the sequence of the event that opened them.
     */
    public long getLotId() {
        return openingSequence;
    }

    public Money remainingCost() {
        return unitCost.multiply(remainingQuantity);
    }

    public boolean isOpen() {
        return remainingQuantity > 0L;
    }

    void drain(long quantity) {
        if (quantity <= 0L || quantity > remainingQuantity) {
            throw new IllegalStateException("cannot drain " + quantity + " from lot " + openingSequence
                    + " holding " + remainingQuantity);
        }
        remainingQuantity -= quantity;
    }

    Lot copy() {
        return new Lot(this);
    }

    @Override
    public String toString() {
        return "Lot{" + symbol + "#" + openingSequence + " " + remainingQuantity + "/" + openedQuantity
                + " @" + unitCost + " opened=" + openedDate + (costPending ? " cost-pending" : "") + "}";
    }
}
