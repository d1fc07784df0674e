package org.nowstart.lotledger.service.valuation;

import org.nowstart.lotledger.data.type.ValuationStatus;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.quote.Quote;

/**
 * A holding combined with a quote. Market fields are {@code null} when {@link #status()} says they could
 * not be computed; they are never filled with the cost basis.
 */
public record HoldingValuation(
        HoldingSnapshot holding,
        Quote quote,
        Money currentValue,
        Money unrealizedPnl,
        Double unrealizedPnlPercent,
        ValuationStatus status
) {

    public String symbol() {
        return holding.symbol();
    }

    public boolean isPriced() {
        return status == ValuationStatus.PRICED;
    }
}
