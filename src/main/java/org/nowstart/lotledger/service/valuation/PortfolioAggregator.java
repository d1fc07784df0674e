package org.nowstart.lotledger.service.valuation;

import java.util.List;
import java.util.OptionalDouble;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Money;

/**
 * Sums valuations into portfolio totals. Fully disposed symbols count towards realized P&amp;L only.
 */
public class PortfolioAggregator {

    public PortfolioTotals aggregate(List<HoldingValuation> valuations) {
        Money totalInvestment = Money.zero();
        Money currentValue = Money.zero();
        Money unrealizedPnl = Money.zero();
        Money pricedCost = Money.zero();
        Money realizedPnl = Money.zero();
        int holdings = 0;
        int priced = 0;
        int unavailable = 0;
        int costPending = 0;

        for (HoldingValuation valuation : valuations) {
            HoldingSnapshot holding = valuation.holding();
            realizedPnl = realizedPnl.add(holding.realizedPnl());
            if (!holding.isOpen()) {
                continue;
            }

            holdings++;
            totalInvestment = totalInvestment.add(holding.totalCost());
            switch (valuation.status()) {
                case PRICED -> {
                    priced++;
                    currentValue = currentValue.add(valuation.currentValue());
                    unrealizedPnl = unrealizedPnl.add(valuation.unrealizedPnl());
                    pricedCost = pricedCost.add(holding.totalCost());
                }
                case COST_PENDING -> costPending++;
                case PRICE_UNAVAILABLE -> unavailable++;
            }
        }

        OptionalDouble percent = unrealizedPnl.percentOf(pricedCost);
        return new PortfolioTotals(
                totalInvestment,
                currentValue,
                unrealizedPnl,
                percent.isPresent() ? percent.getAsDouble() : null,
                realizedPnl,
                holdings,
                priced,
                unavailable,
                costPending
        );
    }
}
