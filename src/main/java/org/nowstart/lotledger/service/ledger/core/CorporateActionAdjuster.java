package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies non-cash corporate actions to a symbol's lot queue. Share count changes, total cost basis
 * does not: new shares either cost nothing (bonus, rights) or carry cost moved from elsewhere
 * (merger, rearrangement). Once opened, these lots are drained by later sales like any other lot.
 */
@Slf4j
final class CorporateActionAdjuster {

    void openBonusLot(SymbolLedger ledger, LedgerEvent event) {
        ledger.openLot(event, event.date(), Money.zero(), false);
    }

    /**
     * The unit cost of merger shares is derived by the caller from the replaced symbol's cost basis;
     * without it the lot is opened cost-pending.
     */
    void openMergerLot(SymbolLedger ledger, LedgerEvent event) {
        if (event.hasPrice()) {
            ledger.openLot(event, event.date(), event.unitPrice(), false);
            return;
        }
        log.warn("event=merger_cost_missing symbol={} sequence={} quantity={}",
                ledger.symbol(), event.sequence(), event.quantity());
        ledger.openLot(event, event.date(), Money.zero(), true);
    }

    /**
     * Debit side of a unit rearrangement: drains lots FIFO and parks the drawn cost for the credits
     * that follow.
     */
    List<RealizedDisposal> closeRearrangedLots(SymbolLedger ledger, LedgerEvent event) {
        List<RealizedDisposal> drawn = ledger.consume(event);
        Money cost = Money.zero();
        boolean pending = false;
        for (RealizedDisposal disposal : drawn) {
            if (disposal.costBasis() == null) {
                pending = true;
            } else {
                cost = cost.add(disposal.costBasis());
            }
        }
        ledger.transferPool().deposit(event.quantity(), cost, pending);
        return drawn;
    }

    /**
     * Credit side of a unit rearrangement. Keeps the original purchase date, when the memo carries one,
     * so the new lot sorts where the shares were first acquired.
     */
    void openRearrangedLot(SymbolLedger ledger, LedgerEvent event) {
        LocalDate openedDate = event.purchaseDate() != null ? event.purchaseDate() : event.date();
        SymbolLedger.TransferPool pool = ledger.transferPool();
        if (pool.isEmpty()) {
            ledger.openLot(event, openedDate, Money.zero(), false);
            return;
        }

        boolean pending = pool.isCostPending();
        Money carried = pool.withdraw(event.quantity());
        pool.clearPendingIfDrained();
        ledger.openLot(event, openedDate, carried.divide(event.quantity()), pending);
    }
}
