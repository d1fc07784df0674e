package org.nowstart.lotledger.service.valuation;

import org.nowstart.lotledger.service.ledger.core.Money;

/**
 * @param currentValue               market value of priced holdings only
 * @param totalUnrealizedPnlPercent  {@code null} when the priced holdings cost nothing
 */
public record PortfolioTotals(
        Money totalInvestment,
        Money currentValue,
        Money totalUnrealizedPnl,
        Double totalUnrealizedPnlPercent,
        Money totalRealizedPnl,
        int holdingsCount,
        int pricedCount,
        int priceUnavailableCount,
        int costPendingCount
) {
}
