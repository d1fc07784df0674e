package org.nowstart.lotledger.service.ledger.core;

/**
 * Aggregate of a symbol's open lots at one point of replay.
 *
 * @param costPending {@code true} while any open lot was opened without a known cost
 */
public record HoldingSnapshot(
        String symbol,
        long totalQuantity,
        Money totalCost,
        Money averageCost,
        Money realizedPnl,
        boolean costPending
) {

    public static HoldingSnapshot empty(String symbol) {
        return new HoldingSnapshot(symbol, 0L, Money.zero(), Money.zero(), Money.zero(), false);
    }

    public boolean isOpen() {
        return totalQuantity > 0L;
    }
}
