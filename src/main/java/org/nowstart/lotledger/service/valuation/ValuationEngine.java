package org.nowstart.lotledger.service.valuation;

import java.util.OptionalDouble;
import org.nowstart.lotledger.data.type.ValuationStatus;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.quote.Quote;

public class ValuationEngine {

    public HoldingValuation value(HoldingSnapshot holding, Quote quote) {
        if (quote == null) {
            return new HoldingValuation(holding, null, null, null, null, ValuationStatus.PRICE_UNAVAILABLE);
        }

        Money currentValue = quote.lastPrice().multiply(holding.totalQuantity());
        if (holding.costPending()) {
            return new HoldingValuation(holding, quote, currentValue, null, null, ValuationStatus.COST_PENDING);
        }

        Money unrealizedPnl = currentValue.subtract(holding.totalCost());
        OptionalDouble percent = unrealizedPnl.percentOf(holding.totalCost());
        return new HoldingValuation(
                holding,
                quote,
                currentValue,
                unrealizedPnl,
                percent.isPresent() ? percent.getAsDouble() : null,
                ValuationStatus.PRICED
        );
    }
}
